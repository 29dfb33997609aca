package com.stepwright.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record HeartbeatRequest(@NotBlank String workerId, @Positive int leaseSeconds) {}
