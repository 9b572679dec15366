package com.whereq.tempo.model;

import lombok.Value;

/**
 * Outcome of an admission check
 */
@Value
public class RateLimitDecision {

    boolean allowed;

    /**
     * Attempts left in the current window (allowed decisions only)
     */
    int remaining;

    /**
     * Seconds the caller should wait before retrying (denied decisions only)
     */
    long retryAfterSeconds;

    DenialReason reason;

    public static RateLimitDecision allow(int remaining) {
        return new RateLimitDecision(true, remaining, 0, null);
    }

    public static RateLimitDecision deny(DenialReason reason, long retryAfterSeconds) {
        return new RateLimitDecision(false, 0, retryAfterSeconds, reason);
    }

    public enum DenialReason {
        /**
         * Too many attempts within the window
         */
        RATE_LIMIT_EXCEEDED,

        /**
         * Too many jobs in flight for this identifier
         */
        CONCURRENCY_LIMIT_EXCEEDED
    }
}
