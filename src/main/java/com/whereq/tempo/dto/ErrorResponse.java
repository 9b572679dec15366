package com.whereq.tempo.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Error body shared by all endpoints
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    /**
     * Short HTTP reason, e.g. "Too Many Requests"
     */
    private String error;

    private String message;

    /**
     * Set on 429 responses
     */
    private Long retryAfterSeconds;

    /**
     * Set on queue-full responses
     */
    private Integer queueLength;

    /**
     * Field validation messages
     */
    private Map<String, String> fields;

    private Instant timestamp;
}
