package com.stepwright.orchestrator.service;

import java.util.UUID;

/**
 * An invalid transition was attempted, e.g. completing a job that is already terminal.
 */
public class JobStateException extends RuntimeException {

    private final UUID jobId;

    public JobStateException(UUID jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public UUID getJobId() { return jobId; }
}
