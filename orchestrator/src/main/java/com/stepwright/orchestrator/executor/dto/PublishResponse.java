package com.stepwright.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Response from POST /workspace/publish; ref points at what was published. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PublishResponse(String ref) {}
