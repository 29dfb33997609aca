package com.stepwright.orchestrator.heal;

/**
 * This worker is shutting down (or its thread was interrupted). The job is
 * handed back to the queue without a verdict.
 */
public class WorkerStoppingException extends RuntimeException {

    public WorkerStoppingException(String message) {
        super(message);
    }

    public WorkerStoppingException(String message, Throwable cause) {
        super(message, cause);
    }
}
