package com.stepwright.orchestrator.service;

import java.util.UUID;

/**
 * The caller does not hold the job's lease. Surfaced to the caller as-is and
 * never retried internally: a worker that sees this has lost the job.
 */
public class JobOwnershipException extends RuntimeException {

    private final UUID jobId;

    public JobOwnershipException(UUID jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public UUID getJobId() { return jobId; }
}
