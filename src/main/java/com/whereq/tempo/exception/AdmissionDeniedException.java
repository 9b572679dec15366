package com.whereq.tempo.exception;

import lombok.Getter;

/**
 * Base for denials the caller can recover from by retrying after {@link #getRetryAfterSeconds()}
 */
@Getter
public abstract class AdmissionDeniedException extends RuntimeException {

    private final long retryAfterSeconds;

    protected AdmissionDeniedException(String message, long retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
