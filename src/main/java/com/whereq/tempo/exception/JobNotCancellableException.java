package com.whereq.tempo.exception;

import com.whereq.tempo.model.JobStatus;

/**
 * Exception thrown when cancellation is requested for a job that already left the queue
 */
public class JobNotCancellableException extends RuntimeException {
    public JobNotCancellableException(String jobId, JobStatus status) {
        super("Cannot cancel job " + jobId + " with status: " + status + ". Only queued jobs can be cancelled.");
    }
}
