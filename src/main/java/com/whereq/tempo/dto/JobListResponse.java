package com.whereq.tempo.dto;

import com.whereq.tempo.model.JobSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * The caller's recent jobs, newest first
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobListResponse {
    private boolean success;
    private List<JobSummary> jobs;
    private Instant timestamp;
}
