package com.whereq.tempo.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobStatus;
import com.whereq.tempo.model.JobSummary;
import com.whereq.tempo.model.JobUpdate;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Registry of job records and the FIFO queue of QUEUED jobs.
 * Exclusively owns job state; every status change goes through {@link #transition}.
 */
public interface JobStore {

    /**
     * Create a job in QUEUED state
     *
     * @param type processor type
     * @param payload processor parameters
     * @param ownerId submitting identifier
     * @return the stored job
     * @throws com.whereq.tempo.exception.QueueFullException if the queue is at capacity
     */
    Job insert(String type, JsonNode payload, String ownerId);

    /**
     * Look up a job by id
     */
    Optional<Job> get(String jobId);

    /**
     * Read-only projection with derived queue position and wait estimate
     *
     * @throws com.whereq.tempo.exception.JobNotFoundException if the job is unknown
     */
    JobSummary summarize(String jobId);

    /**
     * Atomically move a job to a new status together with its associated fields
     *
     * @return the updated job
     * @throws com.whereq.tempo.exception.InvalidTransitionException if the transition is illegal
     * @throws com.whereq.tempo.exception.JobNotFoundException if the job is unknown
     */
    Job transition(String jobId, JobStatus newStatus, JobUpdate update);

    /**
     * Atomically cancel a job if it is still QUEUED
     *
     * @param jobId job identifier
     * @param at cancellation timestamp
     * @return the cancelled job
     * @throws com.whereq.tempo.exception.JobNotFoundException if the job is unknown
     * @throws com.whereq.tempo.exception.JobNotCancellableException if the job already left the queue
     */
    Job cancelIfQueued(String jobId, Instant at);

    /**
     * Atomically take the oldest QUEUED job and mark it RUNNING
     *
     * @param startedAt start timestamp
     * @return the started job, empty if nothing is queued
     */
    Optional<Job> startOldestQueued(Instant startedAt);

    /**
     * Update progress of a RUNNING job; ignored for any other status
     */
    void updateProgress(String jobId, int percent);

    /**
     * Remove terminal jobs that finished before the expiration cutoff
     *
     * @return number of evicted jobs
     */
    int evictExpired(Instant now);

    /**
     * 1-based position among QUEUED jobs, 0 if the job is not queued
     */
    int queuePosition(String jobId);

    /**
     * Number of QUEUED jobs
     */
    int queueLength();

    /**
     * Number of retained jobs in the given status
     */
    int countByStatus(JobStatus status);

    /**
     * Number of retained job records
     */
    int size();

    /**
     * Most recent jobs of an owner, newest first
     */
    List<JobSummary> findByOwner(String ownerId, int limit);

    /**
     * Whether the owner has a QUEUED or RUNNING job
     */
    boolean hasActiveJob(String ownerId);

    /**
     * Lifetime counters, unaffected by eviction
     */
    JobCounters counters();

    @Value
    class JobCounters {
        long enqueued;
        long completed;
        long failed;
        long cancelled;
    }
}
