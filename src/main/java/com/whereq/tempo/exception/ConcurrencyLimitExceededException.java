package com.whereq.tempo.exception;

/**
 * Exception thrown when an identifier already has the maximum number of jobs in flight
 */
public class ConcurrencyLimitExceededException extends AdmissionDeniedException {
    public ConcurrencyLimitExceededException(long retryAfterSeconds) {
        super("You have too many jobs running. Please wait for some to complete before starting new ones.",
            retryAfterSeconds);
    }
}
