package com.yamdb.backend.modules.auth.infrastructure.mail;

import com.yamdb.backend.modules.auth.application.ConfirmationCodeSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.mail.enabled", havingValue = "true")
public class MailConfirmationCodeSender implements ConfirmationCodeSender {

    private static final Logger log = LoggerFactory.getLogger(MailConfirmationCodeSender.class);

    private final JavaMailSender mailSender;
    private final String fromAddress;

    public MailConfirmationCodeSender(
            JavaMailSender mailSender,
            @Value("${app.mail.from:noreply@yamdb.local}") String fromAddress
    ) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
    }

    @Override
    public void send(String email, String username, String code) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromAddress);
        message.setTo(email);
        message.setSubject("YaMDb confirmation code");
        message.setText("""
                Hello %s,

                your YaMDb confirmation code is %s.
                Exchange it for an access token at /api/v1/auth/token.
                """.formatted(username, code));
        mailSender.send(message);
        log.info("Confirmation code mailed to user {}", username);
    }
}
