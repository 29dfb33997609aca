package com.stepwright.orchestrator.api.dto;

public record CancelRequest(String reason, String actor) {}
