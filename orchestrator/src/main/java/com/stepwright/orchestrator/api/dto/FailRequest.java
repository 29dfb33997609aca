package com.stepwright.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;

public record FailRequest(@NotBlank String workerId, String error, boolean retryable) {}
