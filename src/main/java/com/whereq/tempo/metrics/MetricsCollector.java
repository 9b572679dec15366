package com.whereq.tempo.metrics;

import com.whereq.tempo.admission.RateLimiter;
import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.executor.WorkerScheduler;
import com.whereq.tempo.model.HealthState;
import com.whereq.tempo.model.MetricsSnapshot;
import com.whereq.tempo.queue.JobStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Aggregates queue, scheduler and rate limiter state into an operational snapshot.
 * Read-only: never mutates the components it observes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsCollector {

    static final double DEGRADED_QUEUE_RATIO = 0.8;

    private final JobStore jobStore;

    private final WorkerScheduler workerScheduler;

    private final RateLimiter rateLimiter;

    private final RuntimeStatistics runtimeStatistics;

    private final TempoProperties properties;

    private final MeterRegistry meterRegistry;

    @PostConstruct
    public void initialize() {
        Gauge.builder("tempo.queue.length", jobStore, JobStore::queueLength)
            .description("Number of queued jobs")
            .register(meterRegistry);

        Gauge.builder("tempo.jobs.running", workerScheduler, WorkerScheduler::runningCount)
            .description("Number of running jobs")
            .register(meterRegistry);

        Gauge.builder("tempo.queue.utilization", this::queueUtilization)
            .description("Queued jobs as a fraction of queue capacity")
            .register(meterRegistry);

        Gauge.builder("tempo.ratelimit.identifiers", rateLimiter, RateLimiter::activeIdentifiers)
            .description("Identifiers with a live rate limit record")
            .register(meterRegistry);

        log.info("MetricsCollector initialized: max queue size={}, global concurrency={}",
            properties.getQueue().getMaxQueueSize(), properties.getQueue().getGlobalConcurrencyLimit());
    }

    /**
     * Current operational snapshot
     */
    public MetricsSnapshot snapshot() {
        int queueLength = jobStore.queueLength();
        JobStore.JobCounters counters = jobStore.counters();

        return MetricsSnapshot.builder()
            .queueLength(queueLength)
            .runningCount(workerScheduler.runningCount())
            .totalEnqueued(counters.getEnqueued())
            .totalCompleted(counters.getCompleted())
            .totalFailed(counters.getFailed())
            .totalCancelled(counters.getCancelled())
            .totalJobs(jobStore.size())
            .avgRuntimeMs(runtimeStatistics.averageMs())
            .activeIdentifiers(rateLimiter.activeIdentifiers())
            .rateLimitDenialsRecent(rateLimiter.recentDenials())
            .rateLimitDenialsTotal(rateLimiter.totalDenials())
            .health(health(queueLength))
            .config(MetricsSnapshot.Limits.builder()
                .globalConcurrencyLimit(properties.getQueue().getGlobalConcurrencyLimit())
                .maxQueueSize(properties.getQueue().getMaxQueueSize())
                .maxRequestsPerMinute(properties.getRateLimit().getMaxRequestsPerMinute())
                .maxConcurrentJobsPerUser(properties.getRateLimit().getMaxConcurrentJobsPerUser())
                .jitterEnabled(properties.getJitter().isEnabled())
                .maxJitterMs(properties.getJitter().getMaxJitterMs())
                .build())
            .build();
    }

    /**
     * Advisory health derived from queue fill ratio; a queue without capacity is always degraded
     */
    public HealthState health(int queueLength) {
        int maxQueueSize = properties.getQueue().getMaxQueueSize();
        if (maxQueueSize <= 0) {
            return HealthState.DEGRADED;
        }
        return (double) queueLength / maxQueueSize < DEGRADED_QUEUE_RATIO
            ? HealthState.HEALTHY
            : HealthState.DEGRADED;
    }

    private double queueUtilization() {
        int maxQueueSize = properties.getQueue().getMaxQueueSize();
        return maxQueueSize > 0 ? (double) jobStore.queueLength() / maxQueueSize : 1.0;
    }
}
