package com.stepwright.orchestrator.model;

public enum AttemptOutcome {
    RUNNING,
    SUCCEEDED,
    FAILED,
    INTERRUPTED
}
