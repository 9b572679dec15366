package com.whereq.tempo.exception;

/**
 * Exception thrown when an identifier exceeds its admission attempts for the current window
 */
public class RateLimitExceededException extends AdmissionDeniedException {
    public RateLimitExceededException(long retryAfterSeconds) {
        super("You've made too many requests. Please wait " + retryAfterSeconds
            + " seconds before trying again.", retryAfterSeconds);
    }
}
