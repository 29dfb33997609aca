package com.stepwright.orchestrator.model;

/**
 * Lifecycle of a queued job.
 *
 * QUEUED → RUNNING → SUCCEEDED | FAILED | CANCELLED
 *
 * RUNNING can fall back to QUEUED (retryable failure, lease expiry, release).
 * FAILED with retryable=true can be re-queued by an operator.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
