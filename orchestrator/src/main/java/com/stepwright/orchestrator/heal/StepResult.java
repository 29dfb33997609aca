package com.stepwright.orchestrator.heal;

import com.stepwright.orchestrator.executor.StepOutcome;

/**
 * What the self-heal controller reports back for one step.
 *
 * @param outcome            set for SUCCEEDED
 * @param attempt            attempt number that succeeded (SUCCEEDED only)
 * @param rewindTo           target step index (REWIND only)
 * @param retryable          whether the queue may retry the job (FAILED only)
 * @param failureMessage     operator-facing explanation (FAILED only)
 * @param hardResetsConsumed automatic hard resets spent while working on this step
 */
public record StepResult(
        Kind        kind,
        StepOutcome outcome,
        int         attempt,
        int         rewindTo,
        boolean     retryable,
        String      failureMessage,
        int         hardResetsConsumed
) {
    public enum Kind { SUCCEEDED, FAILED, REWIND }

    public static StepResult succeeded(StepOutcome outcome, int attempt, int hardResetsConsumed) {
        return new StepResult(Kind.SUCCEEDED, outcome, attempt, -1, false, null, hardResetsConsumed);
    }

    public static StepResult failed(String failureMessage, boolean retryable, int hardResetsConsumed) {
        return new StepResult(Kind.FAILED, null, 0, -1, retryable, failureMessage, hardResetsConsumed);
    }

    public static StepResult rewind(int stepIndex, int hardResetsConsumed) {
        return new StepResult(Kind.REWIND, null, 0, stepIndex, false, null, hardResetsConsumed);
    }
}
