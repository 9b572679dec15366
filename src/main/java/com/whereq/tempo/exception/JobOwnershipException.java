package com.whereq.tempo.exception;

/**
 * Exception thrown when a caller acts on a job it does not own
 */
public class JobOwnershipException extends RuntimeException {
    public JobOwnershipException(String jobId) {
        super("You do not own job " + jobId);
    }
}
