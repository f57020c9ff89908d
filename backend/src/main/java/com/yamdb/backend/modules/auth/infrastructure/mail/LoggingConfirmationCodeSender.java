package com.yamdb.backend.modules.auth.infrastructure.mail;

import com.yamdb.backend.modules.auth.application.ConfirmationCodeSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Development sender used when mail is disabled. Writes the code to the application log.
 */
@Component
@ConditionalOnProperty(name = "app.mail.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingConfirmationCodeSender implements ConfirmationCodeSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfirmationCodeSender.class);

    @Override
    public void send(String email, String username, String code) {
        log.info("Mail disabled; confirmation code for {} <{}> is {}", username, email, code);
    }
}
