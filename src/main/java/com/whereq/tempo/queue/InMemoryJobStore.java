package com.whereq.tempo.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.exception.InvalidTransitionException;
import com.whereq.tempo.exception.JobNotCancellableException;
import com.whereq.tempo.exception.JobNotFoundException;
import com.whereq.tempo.exception.QueueFullException;
import com.whereq.tempo.metrics.RuntimeStatistics;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobStatus;
import com.whereq.tempo.model.JobSummary;
import com.whereq.tempo.model.JobUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory job store for single-instance deployments.
 * All reads and writes are serialized on the store monitor; lifecycle listeners run after it is released.
 */
@Slf4j
@Service
public class InMemoryJobStore implements JobStore {

    private final TempoProperties properties;

    private final RuntimeStatistics runtimeStatistics;

    private final List<JobLifecycleListener> listeners;

    private final Clock clock;

    private final Map<String, Job> jobs = new HashMap<>();

    // QUEUED job ids in creation order
    private final LinkedHashSet<String> queue = new LinkedHashSet<>();

    private long totalEnqueued;
    private long totalCompleted;
    private long totalFailed;
    private long totalCancelled;

    public InMemoryJobStore(TempoProperties properties,
                            RuntimeStatistics runtimeStatistics,
                            List<JobLifecycleListener> listeners,
                            Clock clock) {
        this.properties = properties;
        this.runtimeStatistics = runtimeStatistics;
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
    }

    @Override
    public Job insert(String type, JsonNode payload, String ownerId) {
        Job job;
        synchronized (this) {
            int maxQueueSize = properties.getQueue().getMaxQueueSize();
            if (queue.size() >= maxQueueSize) {
                log.warn("Job rejected for {}: queue full ({}/{})", ownerId, queue.size(), maxQueueSize);
                throw new QueueFullException(queue.size(), maxQueueSize);
            }

            job = Job.builder()
                .id(generateJobId())
                .type(type)
                .payload(payload != null ? payload : JsonNodeFactory.instance.objectNode())
                .ownerId(ownerId)
                .status(JobStatus.QUEUED)
                .progress(0)
                .createdAt(clock.instant())
                .build();

            jobs.put(job.getId(), job);
            queue.add(job.getId());
            totalEnqueued++;
        }

        log.info("Enqueued job {} (type: {}, position: {}, owner: {})",
            job.getId(), type, queuePosition(job.getId()), ownerId);
        return job;
    }

    @Override
    public synchronized Optional<Job> get(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized JobSummary summarize(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return toSummary(job);
    }

    @Override
    public Job transition(String jobId, JobStatus newStatus, JobUpdate update) {
        Job updated;
        synchronized (this) {
            Job current = jobs.get(jobId);
            if (current == null) {
                throw new JobNotFoundException(jobId);
            }
            updated = applyTransition(current, newStatus, update);
        }

        log.info("Job {} status updated: {}", jobId, newStatus);
        if (newStatus.isTerminal()) {
            notifyFinished(updated);
        }
        return updated;
    }

    @Override
    public Job cancelIfQueued(String jobId, Instant at) {
        Job cancelled;
        synchronized (this) {
            Job current = jobs.get(jobId);
            if (current == null) {
                throw new JobNotFoundException(jobId);
            }
            if (current.getStatus() != JobStatus.QUEUED) {
                throw new JobNotCancellableException(jobId, current.getStatus());
            }
            cancelled = applyTransition(current, JobStatus.CANCELLED, JobUpdate.at(at));
        }

        log.info("Job {} cancelled", jobId);
        notifyFinished(cancelled);
        return cancelled;
    }

    @Override
    public synchronized Optional<Job> startOldestQueued(Instant startedAt) {
        Iterator<String> it = queue.iterator();
        if (!it.hasNext()) {
            return Optional.empty();
        }
        Job oldest = jobs.get(it.next());
        return Optional.of(applyTransition(oldest, JobStatus.RUNNING, JobUpdate.at(startedAt)));
    }

    @Override
    public synchronized void updateProgress(String jobId, int percent) {
        Job job = jobs.get(jobId);
        if (job == null || job.getStatus() != JobStatus.RUNNING) {
            return;
        }
        int clamped = Math.min(100, Math.max(0, percent));
        jobs.put(jobId, job.toBuilder().progress(clamped).build());
    }

    @Override
    public int evictExpired(Instant now) {
        Instant cutoff = now.minus(Duration.ofMillis(properties.getQueue().getJobExpirationMs()));
        int evicted = 0;
        int remaining;
        synchronized (this) {
            Iterator<Job> it = jobs.values().iterator();
            while (it.hasNext()) {
                Job job = it.next();
                if (job.getStatus().isTerminal()
                        && job.getCompletedAt() != null
                        && job.getCompletedAt().isBefore(cutoff)) {
                    it.remove();
                    evicted++;
                }
            }
            remaining = jobs.size();
        }

        if (evicted > 0) {
            log.info("Cleanup: removed {} expired jobs, {} retained", evicted, remaining);
        }
        return evicted;
    }

    @Override
    public synchronized int queuePosition(String jobId) {
        int position = 1;
        for (String queuedId : queue) {
            if (queuedId.equals(jobId)) {
                return position;
            }
            position++;
        }
        return 0;
    }

    @Override
    public synchronized int queueLength() {
        return queue.size();
    }

    @Override
    public synchronized int countByStatus(JobStatus status) {
        if (status == JobStatus.QUEUED) {
            return queue.size();
        }
        return (int) jobs.values().stream()
            .filter(job -> job.getStatus() == status)
            .count();
    }

    @Override
    public synchronized int size() {
        return jobs.size();
    }

    @Override
    public synchronized List<JobSummary> findByOwner(String ownerId, int limit) {
        return jobs.values().stream()
            .filter(job -> job.getOwnerId().equals(ownerId))
            .sorted(Comparator.comparing(Job::getCreatedAt).reversed())
            .limit(limit)
            .map(this::toSummary)
            .toList();
    }

    @Override
    public synchronized boolean hasActiveJob(String ownerId) {
        return jobs.values().stream()
            .anyMatch(job -> job.getOwnerId().equals(ownerId) && job.getStatus().isActive());
    }

    @Override
    public synchronized JobCounters counters() {
        return new JobCounters(totalEnqueued, totalCompleted, totalFailed, totalCancelled);
    }

    /**
     * Validate and apply a transition. Caller holds the store monitor.
     */
    private Job applyTransition(Job current, JobStatus newStatus, JobUpdate update) {
        if (!current.getStatus().canTransitionTo(newStatus)) {
            InvalidTransitionException e =
                new InvalidTransitionException(current.getId(), current.getStatus(), newStatus);
            log.error("Rejected state change", e);
            throw e;
        }

        Instant at = update.getAt() != null ? update.getAt() : clock.instant();
        Job.JobBuilder next = current.toBuilder().status(newStatus);

        switch (newStatus) {
            case RUNNING -> {
                queue.remove(current.getId());
                next.startedAt(at);
            }
            case COMPLETED -> {
                next.completedAt(at).result(update.getResult()).progress(100);
                totalCompleted++;
            }
            case FAILED -> {
                next.completedAt(at).error(update.getError());
                totalFailed++;
            }
            case CANCELLED -> {
                queue.remove(current.getId());
                next.completedAt(at);
                totalCancelled++;
            }
            default -> throw new InvalidTransitionException(current.getId(), current.getStatus(), newStatus);
        }

        Job updated = next.build();
        jobs.put(updated.getId(), updated);
        return updated;
    }

    private JobSummary toSummary(Job job) {
        int position = job.getStatus() == JobStatus.QUEUED ? queuePosition(job.getId()) : 0;
        return JobSummary.of(job, position, estimateWaitMs(position));
    }

    private long estimateWaitMs(int position) {
        if (position <= 0) {
            return 0;
        }
        int concurrency = Math.max(1, properties.getQueue().getGlobalConcurrencyLimit());
        return position * runtimeStatistics.estimateMs() / concurrency;
    }

    private void notifyFinished(Job job) {
        for (JobLifecycleListener listener : listeners) {
            try {
                listener.onJobFinished(job);
            } catch (RuntimeException e) {
                log.error("Lifecycle listener {} failed for job {}", listener.getClass().getSimpleName(), job.getId(), e);
            }
        }
    }

    /**
     * Generate unique job ID
     */
    private String generateJobId() {
        return "job-" + UUID.randomUUID();
    }
}
