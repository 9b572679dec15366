package com.whereq.tempo.exception;

import com.whereq.tempo.model.JobStatus;

/**
 * Thrown on an illegal job state change. Indicates a bug, never a caller error.
 */
public class InvalidTransitionException extends IllegalStateException {
    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Illegal transition for job " + jobId + ": " + from + " -> " + to);
    }
}
