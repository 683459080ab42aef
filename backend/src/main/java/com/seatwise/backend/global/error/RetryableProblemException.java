package com.seatwise.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Problem the caller may retry as-is, e.g. a serialization failure between two
 * concurrent writers on the same floor plan.
 */
public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, int retryAfterSeconds) {
        super(status, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
