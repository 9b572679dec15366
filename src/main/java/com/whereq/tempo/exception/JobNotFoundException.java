package com.whereq.tempo.exception;

/**
 * Exception thrown when a job id is unknown or its record has been evicted
 */
public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
