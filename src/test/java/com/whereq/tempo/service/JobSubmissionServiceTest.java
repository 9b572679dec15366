package com.whereq.tempo.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.whereq.tempo.admission.JitterController;
import com.whereq.tempo.admission.RateLimiter;
import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.exception.ConcurrencyLimitExceededException;
import com.whereq.tempo.exception.JobNotCancellableException;
import com.whereq.tempo.exception.JobNotFoundException;
import com.whereq.tempo.exception.JobOwnershipException;
import com.whereq.tempo.exception.QueueFullException;
import com.whereq.tempo.exception.RateLimitExceededException;
import com.whereq.tempo.executor.ProcessorRegistry;
import com.whereq.tempo.executor.WorkerScheduler;
import com.whereq.tempo.metrics.RuntimeStatistics;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobStatus;
import com.whereq.tempo.model.JobSummary;
import com.whereq.tempo.queue.InMemoryJobStore;
import com.whereq.tempo.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JobSubmissionServiceTest {

    private static final String ALICE = "user:alice";
    private static final String BOB = "user:bob";

    private TempoProperties properties;
    private MutableClock clock;
    private RateLimiter rateLimiter;
    private InMemoryJobStore store;
    private Sinks.One<Object> gate;
    private WorkerScheduler scheduler;
    private JobSubmissionService service;

    @BeforeEach
    void setUp() {
        properties = new TempoProperties();
        properties.getJitter().setEnabled(false);
        properties.getQueue().setGlobalConcurrencyLimit(1);
        properties.getRateLimit().setMaxRequestsPerMinute(3);
        properties.getRateLimit().setMaxConcurrentJobsPerUser(3);
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

        store = build(null);
    }

    private InMemoryJobStore build(InMemoryJobStore override) {
        return build(override, 0);
    }

    /**
     * @param smoothingDelayMs fixed admission delay, 0 for none
     */
    private InMemoryJobStore build(InMemoryJobStore override, long smoothingDelayMs) {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        RuntimeStatistics runtimeStatistics = new RuntimeStatistics(properties);
        rateLimiter = new RateLimiter(properties, clock, meterRegistry);
        InMemoryJobStore jobStore = override != null
            ? override
            : new InMemoryJobStore(properties, runtimeStatistics, List.of(rateLimiter), clock);

        gate = Sinks.one();
        ProcessorRegistry registry = new ProcessorRegistry();
        registry.register("gated", (payload, progress) -> gate.asMono());
        registry.register("instant", (payload, progress) -> Mono.just("done"));

        JitterController jitterController = new JitterController(properties, jobStore) {
            @Override
            public long computeDelay() {
                return smoothingDelayMs;
            }
        };

        scheduler = new WorkerScheduler(jobStore, registry, runtimeStatistics, properties, clock, meterRegistry);
        service = new JobSubmissionService(jobStore, rateLimiter, jitterController,
            scheduler, properties, clock, meterRegistry);
        return jobStore;
    }

    @Test
    void smoothingDelayRunsBeforeJobBecomesVisible() {
        store = build(null, 5_000);

        StepVerifier.withVirtualTime(() -> service.submitJob("gated", null, ALICE))
            .expectSubscription()
            .thenAwait(Duration.ofMillis(4_999))
            .then(() -> {
                assertThat(store.size()).isZero();
                assertThat(scheduler.runningCount()).isZero();
                assertThat(rateLimiter.concurrentJobCount(ALICE)).isEqualTo(1);
            })
            .thenAwait(Duration.ofMillis(1))
            .assertNext(response -> assertThat(response.getJob().getStatus()).isEqualTo(JobStatus.RUNNING))
            .verifyComplete();

        assertThat(store.size()).isEqualTo(1);
        assertThat(scheduler.runningCount()).isEqualTo(1);
    }

    @Test
    void abandonedSubmissionReleasesItsSlot() {
        properties.getRateLimit().setMaxConcurrentJobsPerUser(1);
        store = build(null, 5_000);

        StepVerifier.withVirtualTime(() -> service.submitJob("gated", null, ALICE))
            .expectSubscription()
            .thenAwait(Duration.ofMillis(50))
            .thenCancel()
            .verify();

        assertThat(store.size()).isZero();
        assertThat(rateLimiter.concurrentJobCount(ALICE)).isZero();

        StepVerifier.withVirtualTime(() -> service.submitJob("gated", null, ALICE))
            .expectSubscription()
            .thenAwait(Duration.ofMillis(5_000))
            .assertNext(response -> assertThat(response.getJob().getStatus()).isEqualTo(JobStatus.RUNNING))
            .verifyComplete();

        assertThat(rateLimiter.concurrentJobCount(ALICE)).isEqualTo(1);
    }

    @Test
    void jobStartedDuringCancellationIsConflict() {
        InMemoryJobStore racing = new InMemoryJobStore(properties, new RuntimeStatistics(properties), List.of(), clock) {
            @Override
            public synchronized Optional<Job> get(String jobId) {
                Optional<Job> snapshot = super.get(jobId);
                // the scheduler picks the job up right after the ownership check reads it
                startOldestQueued(clock.instant());
                return snapshot;
            }
        };
        build(racing);
        String jobId = racing.insert("gated", null, ALICE).getId();

        StepVerifier.create(service.cancelJob(jobId, ALICE))
            .expectError(JobNotCancellableException.class)
            .verify();

        assertThat(racing.summarize(jobId).getStatus()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    void admittedJobIsQueuedBehindRunningJob() {
        StepVerifier.create(service.submitJob("gated", null, ALICE))
            .assertNext(response -> {
                assertThat(response.isSuccess()).isTrue();
                assertThat(response.getJob().getStatus()).isEqualTo(JobStatus.RUNNING);
                assertThat(response.getRateLimitRemaining()).isEqualTo(2);
            })
            .verifyComplete();

        StepVerifier.create(service.submitJob("gated", JsonNodeFactory.instance.objectNode().put("n", 5), ALICE))
            .assertNext(response -> {
                assertThat(response.getMessage()).isEqualTo("Job queued successfully");
                assertThat(response.getJob().getStatus()).isEqualTo(JobStatus.QUEUED);
                assertThat(response.getJob().getQueuePosition()).isEqualTo(1);
                assertThat(response.getQueueLength()).isEqualTo(1);
                assertThat(response.getEstimatedWaitMs()).isEqualTo(5_000);
                assertThat(response.getRateLimitRemaining()).isEqualTo(1);
            })
            .verifyComplete();
    }

    @Test
    void fourthSubmissionInWindowIsRateLimited() {
        properties.getRateLimit().setMaxConcurrentJobsPerUser(10);
        for (int i = 0; i < 3; i++) {
            StepVerifier.create(service.submitJob("instant", null, ALICE)).expectNextCount(1).verifyComplete();
        }

        StepVerifier.create(service.submitJob("instant", null, ALICE))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(RateLimitExceededException.class);
                assertThat(((RateLimitExceededException) error).getRetryAfterSeconds()).isPositive();
            })
            .verify();

        clock.advanceMillis(60_000);

        StepVerifier.create(service.submitJob("instant", null, ALICE)).expectNextCount(1).verifyComplete();
    }

    @Test
    void tooManyJobsInFlightIsDenied() {
        properties.getRateLimit().setMaxConcurrentJobsPerUser(2);
        service.submitJob("gated", null, ALICE).block();
        service.submitJob("gated", null, ALICE).block();

        StepVerifier.create(service.submitJob("gated", null, ALICE))
            .expectError(ConcurrencyLimitExceededException.class)
            .verify();

        StepVerifier.create(service.submitJob("gated", null, BOB)).expectNextCount(1).verifyComplete();
    }

    @Test
    void finishedJobsFreeInFlightSlots() {
        properties.getRateLimit().setMaxConcurrentJobsPerUser(1);
        service.submitJob("gated", null, ALICE).block();
        assertThat(rateLimiter.concurrentJobCount(ALICE)).isEqualTo(1);

        gate.tryEmitValue("released");

        assertThat(rateLimiter.concurrentJobCount(ALICE)).isZero();
        StepVerifier.create(service.submitJob("instant", null, ALICE)).expectNextCount(1).verifyComplete();
    }

    @Test
    void fullQueueIsReportedBeforeRateLimit() {
        properties.getQueue().setMaxQueueSize(0);
        properties.getRateLimit().setMaxRequestsPerMinute(1);

        for (int i = 0; i < 3; i++) {
            StepVerifier.create(service.submitJob("instant", null, ALICE))
                .expectError(QueueFullException.class)
                .verify();
        }

        assertThat(store.size()).isZero();
        assertThat(rateLimiter.totalDenials()).isZero();
        assertThat(rateLimiter.concurrentJobCount(ALICE)).isZero();
    }

    @Test
    void reservedSlotIsReleasedWhenInsertFindsQueueFull() {
        properties.getQueue().setMaxQueueSize(0);
        InMemoryJobStore understated = new InMemoryJobStore(properties, new RuntimeStatistics(properties), List.of(), clock) {
            @Override
            public synchronized int queueLength() {
                return -1;
            }
        };
        build(understated);

        StepVerifier.create(service.submitJob("instant", null, ALICE))
            .expectError(QueueFullException.class)
            .verify();

        assertThat(rateLimiter.concurrentJobCount(ALICE)).isZero();
    }

    @Test
    void statusCarriesPollingHints() {
        String running = service.submitJob("gated", null, ALICE).block().getJob().getId();
        String queued = service.submitJob("gated", null, ALICE).block().getJob().getId();

        StepVerifier.create(service.getJobStatus(running))
            .assertNext(response -> {
                assertThat(response.isShouldPoll()).isTrue();
                assertThat(response.getPollIntervalMs()).isEqualTo(1_000);
            })
            .verifyComplete();

        StepVerifier.create(service.getJobStatus(queued))
            .assertNext(response -> {
                assertThat(response.isShouldPoll()).isTrue();
                assertThat(response.getPollIntervalMs()).isEqualTo(2_000);
                assertThat(response.getJob().getQueuePosition()).isEqualTo(1);
            })
            .verifyComplete();

        gate.tryEmitValue("finished");

        StepVerifier.create(service.getJobStatus(running))
            .assertNext(response -> {
                assertThat(response.getJob().getStatus()).isEqualTo(JobStatus.COMPLETED);
                assertThat(response.getJob().getResult()).isEqualTo("finished");
                assertThat(response.isShouldPoll()).isFalse();
            })
            .verifyComplete();
    }

    @Test
    void unknownJobStatusIsNotFound() {
        StepVerifier.create(service.getJobStatus("job-missing"))
            .expectError(JobNotFoundException.class)
            .verify();
    }

    @Test
    void ownerCancelsQueuedJob() {
        service.submitJob("gated", null, ALICE).block();
        String queued = service.submitJob("gated", null, ALICE).block().getJob().getId();

        StepVerifier.create(service.cancelJob(queued, ALICE))
            .assertNext(response -> {
                assertThat(response.getMessage()).isEqualTo("Job cancelled successfully");
                assertThat(response.getJob().getStatus()).isEqualTo(JobStatus.CANCELLED);
            })
            .verifyComplete();

        assertThat(store.queueLength()).isZero();
        assertThat(rateLimiter.concurrentJobCount(ALICE)).isEqualTo(1);
    }

    @Test
    void cancellationChecksOwnershipAndState() {
        String running = service.submitJob("gated", null, ALICE).block().getJob().getId();
        String queued = service.submitJob("gated", null, ALICE).block().getJob().getId();

        StepVerifier.create(service.cancelJob(queued, BOB))
            .expectError(JobOwnershipException.class)
            .verify();
        StepVerifier.create(service.cancelJob(running, ALICE))
            .expectError(JobNotCancellableException.class)
            .verify();
        StepVerifier.create(service.cancelJob("job-missing", ALICE))
            .expectError(JobNotFoundException.class)
            .verify();

        assertThat(store.get(queued)).map(job -> job.getStatus()).contains(JobStatus.QUEUED);
    }

    @Test
    void listsCallerJobsOnly() {
        properties.getQueue().setGlobalConcurrencyLimit(5);
        service.submitJob("instant", null, ALICE).block();
        clock.advanceMillis(5);
        service.submitJob("instant", null, BOB).block();
        clock.advanceMillis(5);
        String newest = service.submitJob("gated", null, ALICE).block().getJob().getId();

        StepVerifier.create(service.listJobs(ALICE))
            .assertNext(response -> {
                assertThat(response.getJobs()).hasSize(2);
                assertThat(response.getJobs()).extracting(JobSummary::getId).first().isEqualTo(newest);
            })
            .verifyComplete();
    }
}
