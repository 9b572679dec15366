package com.whereq.tempo.dto;

import com.whereq.tempo.model.JobSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job status query, with polling hints for the client
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {
    private boolean success;

    private JobSummary job;

    /**
     * True while the job is QUEUED or RUNNING
     */
    private boolean shouldPoll;

    /**
     * Suggested delay before the next poll
     */
    private long pollIntervalMs;

    private Instant timestamp;
}
