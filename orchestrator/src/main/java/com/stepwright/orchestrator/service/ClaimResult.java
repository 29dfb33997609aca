package com.stepwright.orchestrator.service;

import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.model.WorkerPauseState;

import java.util.Optional;

/**
 * Result of a claim: the job (null when nothing was eligible, which is the
 * normal idle outcome) and the global worker pause state at claim time.
 */
public record ClaimResult(Job job, WorkerPauseState system) {

    public Optional<Job> claimed() {
        return Optional.ofNullable(job);
    }
}
