package com.stepwright.orchestrator.heal;

import java.util.UUID;

/**
 * An operator asked to cancel the job; raised at the next control checkpoint.
 */
public class JobCancelledException extends RuntimeException {

    private final UUID jobId;

    public JobCancelledException(UUID jobId, String reason) {
        super("Job " + jobId + " cancelled" + (reason == null ? "" : ": " + reason));
        this.jobId = jobId;
    }

    public UUID getJobId() { return jobId; }
}
