package com.whereq.tempo.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for WhereQ Tempo.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "tempo")
@Data
public class TempoProperties {

    private RateLimitConfig rateLimit = new RateLimitConfig();

    private QueueConfig queue = new QueueConfig();

    private JitterConfig jitter = new JitterConfig();

    private PollConfig poll = new PollConfig();

    @Data
    public static class RateLimitConfig {
        /**
         * Admission attempts allowed per identifier within one window.
         */
        private int maxRequestsPerMinute = 30;

        /**
         * Jobs one identifier may have QUEUED or RUNNING at the same time.
         */
        private int maxConcurrentJobsPerUser = 3;

        /**
         * Length of the counting window in milliseconds.
         */
        private long windowMs = 60_000;

        /**
         * Retry hint returned when the per-user concurrency ceiling is hit.
         */
        private int concurrencyRetryAfterSeconds = 30;

        /**
         * How far back denials count as "recent" in the metrics snapshot.
         */
        private long denialWindowMs = 300_000;

        /**
         * Interval between idle record cleanups.
         */
        private long cleanupIntervalMs = 300_000;
    }

    @Data
    public static class QueueConfig {
        /**
         * Hard ceiling on jobs RUNNING across all callers.
         */
        private int globalConcurrencyLimit = 5;

        /**
         * Maximum number of QUEUED jobs before submissions are rejected.
         */
        private int maxQueueSize = 100;

        /**
         * Age after which a terminal job is evicted.
         */
        private long jobExpirationMs = 3_600_000;

        /**
         * Interval between eviction passes.
         */
        private long cleanupIntervalMs = 300_000;

        /**
         * Runtime assumed for wait estimates before any job has completed.
         */
        private long defaultRuntimeEstimateMs = 5_000;

        /**
         * Number of recent runtimes averaged for wait estimates.
         */
        private int runtimeSampleSize = 100;

        /**
         * Interval of the scheduler safety tick.
         */
        private long schedulerTickMs = 1_000;
    }

    @Data
    public static class JitterConfig {
        /**
         * Enable randomized admission delay.
         */
        private boolean enabled = true;

        /**
         * Upper bound of the uniform jitter component.
         */
        private long maxJitterMs = 500;
    }

    @Data
    public static class PollConfig {
        /**
         * Suggested polling interval while a job is RUNNING.
         */
        private long runningIntervalMs = 1_000;

        /**
         * Suggested polling interval while a job is QUEUED.
         */
        private long queuedIntervalMs = 2_000;
    }
}
