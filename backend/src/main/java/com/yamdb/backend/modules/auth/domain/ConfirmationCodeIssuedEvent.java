package com.yamdb.backend.modules.auth.domain;

/**
 * Published inside the issuing transaction; consumed after commit.
 */
public record ConfirmationCodeIssuedEvent(String email, String username, String code) {

    @Override
    public String toString() {
        return "ConfirmationCodeIssuedEvent[email=" + email + ", username=" + username + "]";
    }
}
