package com.stepwright.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;

/** action: pause | resume. mode (pause only): drain | quiesce. */
public record WorkerPauseRequest(
        @NotBlank String action,
        String           mode,
        String           reason,
        String           actor
) {}
