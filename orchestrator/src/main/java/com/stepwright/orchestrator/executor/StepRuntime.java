package com.stepwright.orchestrator.executor;

/**
 * Runs one step attempt inside the job's workspace.
 *
 * {@link #execute} blocks until the attempt ends. It must react to thread
 * interruption, and {@link #terminate} must stop an attempt that does not.
 */
public interface StepRuntime {

    StepOutcome execute(StepInvocation invocation, ActivityListener activity) throws InterruptedException;

    /** Best-effort kill of a running attempt. Safe to call when nothing is running. */
    void terminate(StepInvocation invocation);
}
