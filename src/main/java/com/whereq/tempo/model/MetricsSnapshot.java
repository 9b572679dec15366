package com.whereq.tempo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time operational view of the admission and execution subsystem
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSnapshot {
    private int queueLength;
    private int runningCount;
    private long totalEnqueued;
    private long totalCompleted;
    private long totalFailed;
    private long totalCancelled;

    /**
     * Job records currently retained, terminal ones included
     */
    private int totalJobs;

    private long avgRuntimeMs;
    private int activeIdentifiers;
    private long rateLimitDenialsRecent;
    private long rateLimitDenialsTotal;
    private HealthState health;
    private Limits config;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Limits {
        private int globalConcurrencyLimit;
        private int maxQueueSize;
        private int maxRequestsPerMinute;
        private int maxConcurrentJobsPerUser;
        private boolean jitterEnabled;
        private long maxJitterMs;
    }
}
