package com.whereq.tempo.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * QUEUED → RUNNING → {COMPLETED, FAILED}
 * QUEUED → CANCELLED
 */
public enum JobStatus {
    /**
     * Admitted and waiting for a free execution slot
     */
    QUEUED,

    /**
     * Job actively executing
     */
    RUNNING,

    /**
     * Completed successfully
     */
    COMPLETED,

    /**
     * Processor threw or reported an error
     */
    FAILED,

    /**
     * Owner cancelled the job before it started
     */
    CANCELLED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if job is still in flight (counts against its owner's concurrency)
     */
    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }

    /**
     * Check whether moving from this state to {@code next} is legal
     */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
