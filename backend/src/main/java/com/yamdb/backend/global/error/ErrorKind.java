package com.yamdb.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Failure categories every core operation reports. Each maps to exactly one HTTP status.
 */
public enum ErrorKind {

    /** Malformed or out-of-range input; the caller must correct and resubmit. */
    VALIDATION(HttpStatus.BAD_REQUEST),
    /** Missing, invalid or expired credential. */
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    /** Policy denial; retrying with the same actor cannot succeed. */
    FORBIDDEN(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    /** Uniqueness violation; the caller may retry as an update instead. */
    CONFLICT(HttpStatus.CONFLICT),
    /** Storage or transport failure; safe to retry, nothing was persisted. */
    UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
