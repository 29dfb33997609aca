package com.stepwright.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for POST /jobs/{id}/control.
 * action: pause | resume | takeover | retry_step | hard_reset_step | resume_from_step
 */
public record ControlRequest(
        @NotBlank String action,
        String           stepId,
        String           strategy,
        String           reason,
        String           actor
) {}
