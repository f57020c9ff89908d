package com.yamdb.backend.modules.auth.application;

/**
 * Delivery channel for confirmation codes. Implementations may throw; callers treat delivery as best effort.
 */
public interface ConfirmationCodeSender {

    void send(String email, String username, String code);
}
