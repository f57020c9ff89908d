package com.yamdb.backend.modules.auth.application;

import com.yamdb.backend.modules.auth.domain.ConfirmationCodeIssuedEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class ConfirmationCodeDeliveryListener {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationCodeDeliveryListener.class);

    private final ConfirmationCodeSender sender;

    public ConfirmationCodeDeliveryListener(ConfirmationCodeSender sender) {
        this.sender = sender;
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onCodeIssued(ConfirmationCodeIssuedEvent event) {
        try {
            sender.send(event.email(), event.username(), event.code());
        } catch (RuntimeException ex) {
            // the account stays valid; the user can sign up again to get a new code
            log.warn("Confirmation code delivery to user {} failed: {}", event.username(), ex.getMessage(), ex);
        }
    }
}
