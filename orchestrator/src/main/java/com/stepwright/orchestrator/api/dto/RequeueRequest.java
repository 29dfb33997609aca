package com.stepwright.orchestrator.api.dto;

public record RequeueRequest(String actor) {}
