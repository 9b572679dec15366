package com.whereq.tempo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read-only projection of a job returned to callers, including derived queue fields
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSummary {
    private String id;
    private JobStatus status;
    private String type;
    private int progress;
    private Object result;
    private String error;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    /**
     * 1-based rank among QUEUED jobs, 0 once the job has left the queue
     */
    private int queuePosition;

    /**
     * Rough wait estimate derived from queue position and recent runtimes
     */
    private long estimatedWaitMs;

    public static JobSummary of(Job job, int queuePosition, long estimatedWaitMs) {
        return JobSummary.builder()
            .id(job.getId())
            .status(job.getStatus())
            .type(job.getType())
            .progress(job.getProgress())
            .result(job.getResult())
            .error(job.getError())
            .createdAt(job.getCreatedAt())
            .startedAt(job.getStartedAt())
            .completedAt(job.getCompletedAt())
            .queuePosition(queuePosition)
            .estimatedWaitMs(estimatedWaitMs)
            .build();
    }
}
