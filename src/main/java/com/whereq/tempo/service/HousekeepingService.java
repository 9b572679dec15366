package com.whereq.tempo.service;

import com.whereq.tempo.admission.RateLimiter;
import com.whereq.tempo.queue.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Periodic eviction of expired jobs and idle rate limit records
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HousekeepingService {

    private final JobStore jobStore;

    private final RateLimiter rateLimiter;

    private final Clock clock;

    @Scheduled(fixedRateString = "${tempo.queue.cleanup-interval-ms:300000}",
        initialDelayString = "${tempo.queue.cleanup-interval-ms:300000}")
    public void evictExpiredJobs() {
        try {
            int evicted = jobStore.evictExpired(clock.instant());
            log.debug("Job eviction pass removed {} jobs, {} remain", evicted, jobStore.size());
        } catch (RuntimeException e) {
            log.error("Job eviction pass failed", e);
        }
    }

    @Scheduled(fixedRateString = "${tempo.rate-limit.cleanup-interval-ms:300000}",
        initialDelayString = "${tempo.rate-limit.cleanup-interval-ms:300000}")
    public void evictIdleRateLimitRecords() {
        try {
            rateLimiter.evictIdle(clock.instant());
        } catch (RuntimeException e) {
            log.error("Rate limit cleanup failed", e);
        }
    }
}
