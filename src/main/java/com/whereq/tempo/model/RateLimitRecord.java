package com.whereq.tempo.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-identifier admission state, owned by the rate limiter
 */
@Data
@NoArgsConstructor
public class RateLimitRecord {
    /**
     * Start of the current counting window
     */
    private Instant windowStart;

    /**
     * Admitted attempts within the window
     */
    private int requestCount;

    /**
     * Jobs of this identifier currently QUEUED or RUNNING
     */
    private int concurrentJobCount;

    public RateLimitRecord(Instant windowStart) {
        this.windowStart = windowStart;
    }
}
