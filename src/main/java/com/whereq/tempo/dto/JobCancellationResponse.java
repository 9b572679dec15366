package com.whereq.tempo.dto;

import com.whereq.tempo.model.JobSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCancellationResponse {
    private boolean success;

    /**
     * Cancellation message
     */
    private String message;

    /**
     * Job after cancellation (status CANCELLED)
     */
    private JobSummary job;

    private Instant timestamp;
}
