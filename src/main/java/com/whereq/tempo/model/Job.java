package com.whereq.tempo.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of a job. The job store replaces the snapshot on every change,
 * so a reference held by a reader never changes underneath it.
 */
@Value
@Builder(toBuilder = true)
public class Job {
    /**
     * Unique job identifier
     */
    String id;

    /**
     * Key into the processor registry
     */
    String type;

    /**
     * Parameters handed to the processor
     */
    JsonNode payload;

    /**
     * Identifier (user or address) that submitted the job
     */
    String ownerId;

    JobStatus status;

    /**
     * Progress percentage (0-100)
     */
    int progress;

    /**
     * Processor result, set on COMPLETED
     */
    Object result;

    /**
     * Error message, set on FAILED
     */
    String error;

    Instant createdAt;

    Instant startedAt;

    Instant completedAt;
}
