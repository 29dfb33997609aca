package com.stepwright.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Request body for POST /queue/claim.
 * Empty allowedTypes means any type.
 */
public record ClaimRequest(
        @NotBlank String workerId,
        @Positive int    leaseSeconds,
        List<String>     allowedTypes,
        List<String>     capabilities
) {
    public ClaimRequest {
        if (allowedTypes == null) allowedTypes = List.of();
        if (capabilities == null) capabilities = List.of();
    }
}
