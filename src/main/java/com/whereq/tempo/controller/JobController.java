package com.whereq.tempo.controller;

import com.whereq.tempo.admission.IdentityResolver;
import com.whereq.tempo.dto.JobCancellationResponse;
import com.whereq.tempo.dto.JobListResponse;
import com.whereq.tempo.dto.JobStatusResponse;
import com.whereq.tempo.dto.JobSubmitRequest;
import com.whereq.tempo.dto.JobSubmitResponse;
import com.whereq.tempo.service.JobSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Controller for async job submission and management.
 * Admission errors are mapped by {@link ApiExceptionHandler}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Tag(name = "Jobs", description = "Async job submission, status polling and cancellation")
public class JobController {

    public static final String RATE_LIMIT_REMAINING_HEADER = "X-RateLimit-Remaining";

    private final JobSubmissionService jobSubmissionService;

    private final IdentityResolver identityResolver;

    /**
     * Submit a job for async execution
     *
     * @param request job request
     * @param httpRequest incoming request, used to identify the caller
     * @return Mono with 202 Accepted response
     */
    @PostMapping
    @Operation(summary = "Submit job", description = "Queue a job; poll the returned location for its outcome")
    public Mono<ResponseEntity<JobSubmitResponse>> submitJob(
            @Valid @RequestBody JobSubmitRequest request,
            ServerHttpRequest httpRequest) {

        String identifier = identityResolver.resolve(httpRequest);

        log.info("Received job submission from {}: type={}", identifier, request.getType());

        return jobSubmissionService.submitJob(request.getType(), request.getPayload(), identifier)
            .map(response -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/jobs/" + response.getJob().getId()))
                .header(RATE_LIMIT_REMAINING_HEADER, String.valueOf(response.getRateLimitRemaining()))
                .body(response));
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "The caller's most recent jobs, newest first")
    public Mono<ResponseEntity<JobListResponse>> listJobs(ServerHttpRequest httpRequest) {
        return jobSubmissionService.listJobs(identityResolver.resolve(httpRequest))
            .map(ResponseEntity::ok);
    }

    /**
     * Get job status
     *
     * @param jobId job identifier
     * @return Mono with job status and polling hints
     */
    @GetMapping("/{jobId}")
    @Operation(summary = "Job status", description = "Current state, queue position and polling hints")
    public Mono<ResponseEntity<JobStatusResponse>> getJobStatus(@PathVariable String jobId) {
        log.debug("Job status request for {}", jobId);

        return jobSubmissionService.getJobStatus(jobId)
            .map(ResponseEntity::ok);
    }

    /**
     * Cancel a job
     *
     * @param jobId job identifier
     * @param httpRequest incoming request, used to identify the caller
     * @return Mono with cancellation response
     */
    @DeleteMapping("/{jobId}")
    @Operation(summary = "Cancel job", description = "Cancel a queued job owned by the caller")
    public Mono<ResponseEntity<JobCancellationResponse>> cancelJob(
            @PathVariable String jobId,
            ServerHttpRequest httpRequest) {

        String identifier = identityResolver.resolve(httpRequest);

        log.info("Job cancellation request for {} from {}", jobId, identifier);

        return jobSubmissionService.cancelJob(jobId, identifier)
            .map(ResponseEntity::ok);
    }
}
