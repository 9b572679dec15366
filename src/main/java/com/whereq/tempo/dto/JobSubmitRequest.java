package com.whereq.tempo.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to queue a job for async execution")
public class JobSubmitRequest {

    @Schema(description = "Job type, selects the processor", example = "simulate", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "Job type is required")
    private String type;

    @Schema(description = "Job-specific parameters, passed to the processor unchanged", example = "{\"steps\": 5, \"stepMs\": 1000}")
    private JsonNode payload;
}
