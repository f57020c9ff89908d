package com.yamdb.backend.global.error;

/**
 * {@link ErrorKind#UNAVAILABLE} failure carrying the delay clients should wait before retrying.
 */
public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;

    public RetryableProblemException(String code, String detail, int retryAfterSeconds) {
        super(ErrorKind.UNAVAILABLE, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
