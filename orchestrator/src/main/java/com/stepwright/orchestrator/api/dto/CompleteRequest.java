package com.stepwright.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;

public record CompleteRequest(@NotBlank String workerId, String result) {}
