package com.stepwright.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;

public record CancelAckRequest(@NotBlank String workerId, String message) {}
