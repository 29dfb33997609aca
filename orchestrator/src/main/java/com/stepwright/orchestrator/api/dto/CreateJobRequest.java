package com.stepwright.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request body for POST /jobs.
 *
 * payload is the task document (see TaskDocument). maxAttempts defaults to 3.
 */
public record CreateJobRequest(
        @NotBlank String   type,
        @NotNull  JsonNode payload,
        Integer            priority,
        @Min(1)   Integer  maxAttempts
) {
    public CreateJobRequest {
        if (priority == null) priority = 0;
        if (maxAttempts == null) maxAttempts = 3;
    }
}
