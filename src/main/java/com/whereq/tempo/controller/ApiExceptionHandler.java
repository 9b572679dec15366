package com.whereq.tempo.controller;

import com.whereq.tempo.dto.ErrorResponse;
import com.whereq.tempo.exception.AdmissionDeniedException;
import com.whereq.tempo.exception.JobNotCancellableException;
import com.whereq.tempo.exception.JobNotFoundException;
import com.whereq.tempo.exception.JobOwnershipException;
import com.whereq.tempo.exception.QueueFullException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps domain exceptions to HTTP responses
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

    public static final String RATE_LIMIT_RESET_HEADER = "X-RateLimit-Reset";

    private final Clock clock;

    @ExceptionHandler(AdmissionDeniedException.class)
    public ResponseEntity<ErrorResponse> tooManyRequests(AdmissionDeniedException ex) {
        Instant now = clock.instant();
        long resetAt = now.plusSeconds(ex.getRetryAfterSeconds()).getEpochSecond();

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
            .header(JobController.RATE_LIMIT_REMAINING_HEADER, "0")
            .header(RATE_LIMIT_RESET_HEADER, String.valueOf(resetAt))
            .body(ErrorResponse.builder()
                .error(HttpStatus.TOO_MANY_REQUESTS.getReasonPhrase())
                .message(ex.getMessage())
                .retryAfterSeconds(ex.getRetryAfterSeconds())
                .timestamp(now)
                .build());
    }

    @ExceptionHandler(QueueFullException.class)
    public ResponseEntity<ErrorResponse> queueFull(QueueFullException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(ErrorResponse.builder()
                .error(HttpStatus.SERVICE_UNAVAILABLE.getReasonPhrase())
                .message(ex.getMessage())
                .queueLength(ex.getQueueLength())
                .timestamp(clock.instant())
                .build());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(JobNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(JobOwnershipException.class)
    public ResponseEntity<ErrorResponse> forbidden(JobOwnershipException ex) {
        return error(HttpStatus.FORBIDDEN, ex.getMessage());
    }

    @ExceptionHandler(JobNotCancellableException.class)
    public ResponseEntity<ErrorResponse> conflict(JobNotCancellableException ex) {
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> validation(WebExchangeBindException ex) {
        Map<String, String> fields = new HashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        String message = fields.values().stream().findFirst().orElse("Invalid request");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ErrorResponse.builder()
                .error(HttpStatus.BAD_REQUEST.getReasonPhrase())
                .message(message)
                .fields(fields)
                .timestamp(clock.instant())
                .build());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> badInput(ServerWebInputException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getReason() == null ? "Invalid request" : ex.getReason());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> status(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return error(status, ex.getReason() == null ? status.getReasonPhrase() : ex.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> internalError(Exception ex) {
        log.error("Unexpected error while handling request", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
            .body(ErrorResponse.builder()
                .error(status.getReasonPhrase())
                .message(message)
                .timestamp(clock.instant())
                .build());
    }
}
