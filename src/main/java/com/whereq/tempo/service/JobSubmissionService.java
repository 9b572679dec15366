package com.whereq.tempo.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.tempo.admission.JitterController;
import com.whereq.tempo.admission.RateLimiter;
import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.dto.JobCancellationResponse;
import com.whereq.tempo.dto.JobListResponse;
import com.whereq.tempo.dto.JobStatusResponse;
import com.whereq.tempo.dto.JobSubmitResponse;
import com.whereq.tempo.exception.ConcurrencyLimitExceededException;
import com.whereq.tempo.exception.JobNotFoundException;
import com.whereq.tempo.exception.JobOwnershipException;
import com.whereq.tempo.exception.QueueFullException;
import com.whereq.tempo.exception.RateLimitExceededException;
import com.whereq.tempo.executor.WorkerScheduler;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobStatus;
import com.whereq.tempo.model.JobSummary;
import com.whereq.tempo.model.RateLimitDecision;
import com.whereq.tempo.queue.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Service for job submission and management
 */
@Slf4j
@Service
public class JobSubmissionService {

    static final int RECENT_JOBS_LIMIT = 20;

    private final JobStore jobStore;

    private final RateLimiter rateLimiter;

    private final JitterController jitterController;

    private final WorkerScheduler workerScheduler;

    private final TempoProperties properties;

    private final Clock clock;

    private final Counter admittedCounter;
    private final Counter rejectedCounter;

    public JobSubmissionService(JobStore jobStore,
                                RateLimiter rateLimiter,
                                JitterController jitterController,
                                WorkerScheduler workerScheduler,
                                TempoProperties properties,
                                Clock clock,
                                MeterRegistry meterRegistry) {
        this.jobStore = jobStore;
        this.rateLimiter = rateLimiter;
        this.jitterController = jitterController;
        this.workerScheduler = workerScheduler;
        this.properties = properties;
        this.clock = clock;

        admittedCounter = Counter.builder("tempo.admission.admitted")
            .description("Number of jobs admitted to the queue")
            .register(meterRegistry);

        rejectedCounter = Counter.builder("tempo.admission.rejected")
            .description("Number of jobs rejected due to full queue")
            .register(meterRegistry);
    }

    /**
     * Submit a job for async execution
     *
     * @param type job type
     * @param payload job parameters
     * @param identifier caller identifier
     * @return Mono with submission response, or an admission error
     */
    public Mono<JobSubmitResponse> submitJob(String type, JsonNode payload, String identifier) {
        return Mono.fromCallable(() -> admit(identifier))
            .flatMap(decision -> {
                // Set once the reserved slot is either bound to an inserted job or given back
                AtomicBoolean settled = new AtomicBoolean();

                return smoothingDelay(identifier)
                    .then(Mono.fromCallable(() -> insertReserved(type, payload, identifier, settled)))
                    .doOnCancel(() -> releaseUnsettled(identifier, settled))
                    .doOnError(e -> releaseUnsettled(identifier, settled))
                    .map(job -> {
                        workerScheduler.trigger();
                        return buildSubmitResponse(job, decision);
                    });
            })
            .doOnNext(response -> log.info("Job {} submitted successfully by {}",
                response.getJob().getId(), identifier))
            .doOnError(e -> log.warn("Job submission failed for {}: {}", identifier, e.getMessage()));
    }

    /**
     * Current status of a job with polling hints
     *
     * @param jobId job identifier
     * @return Mono with job status, or {@link JobNotFoundException}
     */
    public Mono<JobStatusResponse> getJobStatus(String jobId) {
        return Mono.fromCallable(() -> {
            JobSummary summary = jobStore.summarize(jobId);
            boolean shouldPoll = summary.getStatus().isActive();
            long pollIntervalMs = summary.getStatus() == JobStatus.RUNNING
                ? properties.getPoll().getRunningIntervalMs()
                : properties.getPoll().getQueuedIntervalMs();

            return JobStatusResponse.builder()
                .success(true)
                .job(summary)
                .shouldPoll(shouldPoll)
                .pollIntervalMs(pollIntervalMs)
                .timestamp(clock.instant())
                .build();
        });
    }

    /**
     * Recent jobs of the caller, newest first
     */
    public Mono<JobListResponse> listJobs(String identifier) {
        return Mono.fromCallable(() -> {
            List<JobSummary> jobs = jobStore.findByOwner(identifier, RECENT_JOBS_LIMIT);
            return JobListResponse.builder()
                .success(true)
                .jobs(jobs)
                .timestamp(clock.instant())
                .build();
        });
    }

    /**
     * Cancel a queued job
     *
     * @param jobId job identifier
     * @param identifier caller identifier, must own the job
     * @return Mono with cancellation response
     */
    public Mono<JobCancellationResponse> cancelJob(String jobId, String identifier) {
        return Mono.fromCallable(() -> {
                Job job = jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

                if (!job.getOwnerId().equals(identifier)) {
                    throw new JobOwnershipException(jobId);
                }

                Job cancelled = jobStore.cancelIfQueued(jobId, clock.instant());

                return JobCancellationResponse.builder()
                    .success(true)
                    .message("Job cancelled successfully")
                    .job(JobSummary.of(cancelled, 0, 0))
                    .timestamp(clock.instant())
                    .build();
            })
            .doOnSuccess(response -> log.info("Job {} cancelled by {}", jobId, identifier))
            .doOnError(e -> log.warn("Failed to cancel job {}: {}", jobId, e.getMessage()));
    }

    /**
     * Queue capacity first, so a full queue is reported regardless of the caller's rate limit state
     */
    private RateLimitDecision admit(String identifier) {
        int queueLength = jobStore.queueLength();
        int maxQueueSize = properties.getQueue().getMaxQueueSize();
        if (queueLength >= maxQueueSize) {
            rejectedCounter.increment();
            throw new QueueFullException(queueLength, maxQueueSize);
        }

        RateLimitDecision decision = rateLimiter.checkAndRecord(identifier);
        if (!decision.isAllowed()) {
            switch (decision.getReason()) {
                case RATE_LIMIT_EXCEEDED -> throw new RateLimitExceededException(decision.getRetryAfterSeconds());
                case CONCURRENCY_LIMIT_EXCEEDED ->
                    throw new ConcurrencyLimitExceededException(decision.getRetryAfterSeconds());
            }
        }
        return decision;
    }

    /**
     * Delay before the job becomes visible to the scheduler, spreading out bursts
     */
    private Mono<Long> smoothingDelay(String identifier) {
        long delay = jitterController.computeDelay();
        if (delay <= 0) {
            return Mono.empty();
        }
        log.debug("Applying smoothing delay of {}ms for {}", delay, identifier);
        return Mono.delay(Duration.ofMillis(delay));
    }

    /**
     * Insert the job under the slot reserved at admission. Returns null if the request was
     * abandoned first; gives the slot back if the insert fails.
     */
    private Job insertReserved(String type, JsonNode payload, String identifier, AtomicBoolean settled) {
        if (!settled.compareAndSet(false, true)) {
            return null;
        }
        try {
            Job job = jobStore.insert(type, payload, identifier);
            admittedCounter.increment();
            return job;
        } catch (RuntimeException e) {
            rateLimiter.releaseJobSlot(identifier);
            if (e instanceof QueueFullException) {
                rejectedCounter.increment();
            }
            throw e;
        }
    }

    private void releaseUnsettled(String identifier, AtomicBoolean settled) {
        if (settled.compareAndSet(false, true)) {
            log.info("Submission by {} abandoned before insert, releasing its job slot", identifier);
            rateLimiter.releaseJobSlot(identifier);
        }
    }

    private JobSubmitResponse buildSubmitResponse(Job job, RateLimitDecision decision) {
        JobSummary summary = jobStore.summarize(job.getId());
        return JobSubmitResponse.builder()
            .success(true)
            .message("Job queued successfully")
            .job(summary)
            .queueLength(jobStore.queueLength())
            .estimatedWaitMs(summary.getEstimatedWaitMs())
            .rateLimitRemaining(decision.getRemaining())
            .timestamp(clock.instant())
            .build();
    }
}
