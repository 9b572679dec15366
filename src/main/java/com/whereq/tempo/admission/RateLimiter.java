package com.whereq.tempo.admission;

import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.RateLimitDecision;
import com.whereq.tempo.model.RateLimitDecision.DenialReason;
import com.whereq.tempo.model.RateLimitRecord;
import com.whereq.tempo.queue.JobLifecycleListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Fixed-window rate limiter with a per-identifier in-flight job ceiling.
 * All record state is guarded by the limiter's monitor.
 */
@Slf4j
@Component
public class RateLimiter implements JobLifecycleListener {

    private final TempoProperties.RateLimitConfig config;

    private final Clock clock;

    private final Map<String, RateLimitRecord> records = new HashMap<>();

    // timestamps of recent denials, oldest first
    private final Deque<Instant> recentDenials = new ArrayDeque<>();

    private final Counter rateLimitedCounter;
    private final Counter concurrencyLimitedCounter;

    private long totalDenials;

    public RateLimiter(TempoProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.config = properties.getRateLimit();
        this.clock = clock;

        rateLimitedCounter = Counter.builder("tempo.admission.denied")
            .tag("reason", "rate_limit")
            .description("Submissions denied by the per-identifier request window")
            .register(meterRegistry);

        concurrencyLimitedCounter = Counter.builder("tempo.admission.denied")
            .tag("reason", "concurrency_limit")
            .description("Submissions denied by the per-identifier in-flight ceiling")
            .register(meterRegistry);
    }

    /**
     * Check whether the identifier may submit now and, if so, count the attempt and reserve an in-flight slot
     *
     * @param identifier caller identifier
     * @return allow with remaining attempts, or deny with a retry hint
     */
    public synchronized RateLimitDecision checkAndRecord(String identifier) {
        Instant now = clock.instant();
        RateLimitRecord record = records.computeIfAbsent(identifier, id -> new RateLimitRecord(now));
        refreshWindow(record, now);

        if (record.getRequestCount() >= config.getMaxRequestsPerMinute()) {
            long retryAfter = secondsUntilReset(record, now);
            recordDenial(now);
            rateLimitedCounter.increment();
            log.warn("Rate limit exceeded for {}: {}/{} requests, retry after {}s",
                identifier, record.getRequestCount(), config.getMaxRequestsPerMinute(), retryAfter);
            return RateLimitDecision.deny(DenialReason.RATE_LIMIT_EXCEEDED, retryAfter);
        }

        if (record.getConcurrentJobCount() >= config.getMaxConcurrentJobsPerUser()) {
            recordDenial(now);
            concurrencyLimitedCounter.increment();
            log.warn("Concurrency limit exceeded for {}: {}/{} jobs in flight",
                identifier, record.getConcurrentJobCount(), config.getMaxConcurrentJobsPerUser());
            return RateLimitDecision.deny(DenialReason.CONCURRENCY_LIMIT_EXCEEDED,
                config.getConcurrencyRetryAfterSeconds());
        }

        record.setRequestCount(record.getRequestCount() + 1);
        record.setConcurrentJobCount(record.getConcurrentJobCount() + 1);

        return RateLimitDecision.allow(config.getMaxRequestsPerMinute() - record.getRequestCount());
    }

    /**
     * Give back an in-flight slot reserved by {@link #checkAndRecord}
     *
     * @param identifier caller identifier
     */
    public synchronized void releaseJobSlot(String identifier) {
        RateLimitRecord record = records.get(identifier);
        if (record == null || record.getConcurrentJobCount() == 0) {
            log.warn("Attempted to release a job slot that is not held by {}", identifier);
            return;
        }
        record.setConcurrentJobCount(record.getConcurrentJobCount() - 1);
    }

    @Override
    public void onJobFinished(Job job) {
        releaseJobSlot(job.getOwnerId());
    }

    /**
     * Jobs the identifier currently has in flight
     */
    public synchronized int concurrentJobCount(String identifier) {
        RateLimitRecord record = records.get(identifier);
        return record != null ? record.getConcurrentJobCount() : 0;
    }

    /**
     * Drop records with nothing in flight whose window ended long ago
     *
     * @return number of removed records
     */
    public synchronized int evictIdle(Instant now) {
        Instant cutoff = now.minus(Duration.ofMillis(config.getWindowMs() * 2));
        int removed = 0;

        Iterator<RateLimitRecord> it = records.values().iterator();
        while (it.hasNext()) {
            RateLimitRecord record = it.next();
            if (record.getConcurrentJobCount() == 0 && record.getWindowStart().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        pruneDenials(now);

        log.info("Rate limit cleanup complete: removed {}, active entries {}", removed, records.size());
        return removed;
    }

    /**
     * Number of identifiers with a live record
     */
    public synchronized int activeIdentifiers() {
        return records.size();
    }

    /**
     * Denials within the configured recent window. Read-only; old entries are dropped by
     * {@link #evictIdle} and on the next denial.
     */
    public synchronized long recentDenials() {
        Instant cutoff = clock.instant().minusMillis(config.getDenialWindowMs());
        return recentDenials.stream()
            .filter(deniedAt -> !deniedAt.isBefore(cutoff))
            .count();
    }

    public synchronized long totalDenials() {
        return totalDenials;
    }

    private void refreshWindow(RateLimitRecord record, Instant now) {
        Instant windowEnd = record.getWindowStart().plusMillis(config.getWindowMs());
        if (!now.isBefore(windowEnd)) {
            record.setWindowStart(now);
            record.setRequestCount(0);
        }
    }

    private long secondsUntilReset(RateLimitRecord record, Instant now) {
        long remainingMs = Duration.between(now, record.getWindowStart().plusMillis(config.getWindowMs())).toMillis();
        return Math.max(1, (remainingMs + 999) / 1000);
    }

    private void recordDenial(Instant now) {
        totalDenials++;
        recentDenials.addLast(now);
        pruneDenials(now);
    }

    private void pruneDenials(Instant now) {
        Instant cutoff = now.minusMillis(config.getDenialWindowMs());
        while (!recentDenials.isEmpty() && recentDenials.peekFirst().isBefore(cutoff)) {
            recentDenials.removeFirst();
        }
    }
}
