package com.whereq.tempo.executor;

import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.metrics.RuntimeStatistics;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobStatus;
import com.whereq.tempo.model.JobUpdate;
import com.whereq.tempo.queue.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Starts queued jobs under the global concurrency ceiling and runs them through their processor.
 *
 * <p>Scheduling is event driven: {@link #trigger()} runs on every enqueue and every completion,
 * with a periodic tick as a safety net. The running counter is the only state guarded by the
 * scheduler's monitor; dispatch happens outside it so processors never run under the lock.</p>
 */
@Slf4j
@Service
public class WorkerScheduler {

    private final JobStore jobStore;

    private final ProcessorRegistry processorRegistry;

    private final RuntimeStatistics runtimeStatistics;

    private final TempoProperties.QueueConfig config;

    private final Clock clock;

    private final Object lock = new Object();

    private int running;

    private final Counter successCounter;
    private final Counter failureCounter;
    private final Timer executionTimer;

    public WorkerScheduler(JobStore jobStore,
                           ProcessorRegistry processorRegistry,
                           RuntimeStatistics runtimeStatistics,
                           TempoProperties properties,
                           Clock clock,
                           MeterRegistry meterRegistry) {
        this.jobStore = jobStore;
        this.processorRegistry = processorRegistry;
        this.runtimeStatistics = runtimeStatistics;
        this.config = properties.getQueue();
        this.clock = clock;

        successCounter = Counter.builder("tempo.jobs.succeeded")
            .description("Number of successfully completed jobs")
            .register(meterRegistry);

        failureCounter = Counter.builder("tempo.jobs.failed")
            .description("Number of failed jobs")
            .register(meterRegistry);

        executionTimer = Timer.builder("tempo.jobs.execution.time")
            .description("Job execution time")
            .register(meterRegistry);
    }

    /**
     * Fill free execution slots with the oldest queued jobs
     */
    public void trigger() {
        List<Job> started = new ArrayList<>();

        synchronized (lock) {
            while (running < config.getGlobalConcurrencyLimit()) {
                Optional<Job> next = jobStore.startOldestQueued(clock.instant());
                if (next.isEmpty()) {
                    break;
                }
                running++;
                started.add(next.get());
                log.info("Started job {} (running: {}/{})",
                    next.get().getId(), running, config.getGlobalConcurrencyLimit());
            }
        }

        started.forEach(this::dispatch);
    }

    @Scheduled(fixedDelayString = "${tempo.queue.scheduler-tick-ms:1000}")
    public void tick() {
        log.debug("Scheduler tick: running {}, queued {}", runningCount(), jobStore.queueLength());
        trigger();
    }

    /**
     * Number of jobs currently holding an execution slot
     */
    public int runningCount() {
        synchronized (lock) {
            return running;
        }
    }

    /**
     * Execute a started job. Never throws; every outcome ends in a terminal transition and a freed slot.
     */
    private void dispatch(Job job) {
        Instant startTime = clock.instant();

        Optional<JobProcessor> processor = processorRegistry.find(job.getType());
        if (processor.isEmpty()) {
            log.error("Job {} failed: no processor registered for job type {}", job.getId(), job.getType());
            finish(job, startTime, null, "No processor registered for job type: " + job.getType());
            return;
        }

        Mono<?> execution;
        try {
            execution = processor.get().process(job.getPayload(),
                percent -> jobStore.updateProgress(job.getId(), percent));
            if (execution == null) {
                execution = Mono.error(new IllegalStateException(
                    "Processor for job type " + job.getType() + " returned no result"));
            }
        } catch (RuntimeException e) {
            execution = Mono.error(e);
        }

        execution
            .cast(Object.class)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .subscribe(
                result -> finish(job, startTime, result.orElse(null), null),
                error -> {
                    log.error("Job {} failed: {}", job.getId(), error.getMessage(), error);
                    finish(job, startTime, null, errorMessage(error));
                });
    }

    private void finish(Job job, Instant startTime, Object result, String error) {
        long runtimeMs = Duration.between(startTime, clock.instant()).toMillis();
        try {
            if (error == null) {
                jobStore.transition(job.getId(), JobStatus.COMPLETED, JobUpdate.completed(clock.instant(), result));
                runtimeStatistics.record(runtimeMs);
                executionTimer.record(Duration.ofMillis(runtimeMs));
                successCounter.increment();
                log.info("Job {} completed in {}ms", job.getId(), runtimeMs);
            } else {
                jobStore.transition(job.getId(), JobStatus.FAILED, JobUpdate.failed(clock.instant(), error));
                failureCounter.increment();
            }
        } catch (RuntimeException e) {
            log.error("Could not record outcome of job {}", job.getId(), e);
        } finally {
            synchronized (lock) {
                running--;
            }
        }

        try {
            trigger();
        } catch (RuntimeException e) {
            log.error("Scheduling after job {} failed, next tick will retry", job.getId(), e);
        }
    }

    private static String errorMessage(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? "Unknown error" : message;
    }
}
