package com.whereq.tempo.dto;

import com.whereq.tempo.model.JobSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for an accepted job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmitResponse {
    private boolean success;

    private String message;

    /**
     * Job as queued, with position and wait estimate
     */
    private JobSummary job;

    /**
     * Queued jobs at the time of admission
     */
    private int queueLength;

    private long estimatedWaitMs;

    /**
     * Admission attempts left in the caller's window
     */
    private int rateLimitRemaining;

    private Instant timestamp;
}
