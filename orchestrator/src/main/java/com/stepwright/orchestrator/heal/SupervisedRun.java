package com.stepwright.orchestrator.heal;

import com.stepwright.orchestrator.executor.StepOutcome;

import java.time.Duration;

/**
 * How one supervised attempt ended.
 *
 * @param outcome     the runtime's result; null when the runtime threw or a watchdog tripped
 * @param error       what the runtime threw, if it did
 * @param trip        watchdog that ended the attempt, NONE otherwise
 * @param elapsed     wall-clock time of the attempt
 * @param longestIdle longest gap between two activity pulses (or since the last one)
 * @param terminated  true once {@code StepRuntime.terminate} was called for this attempt
 */
public record SupervisedRun(
        StepOutcome outcome,
        Throwable   error,
        WatchdogTrip trip,
        Duration    elapsed,
        Duration    longestIdle,
        boolean     terminated
) {
    public boolean completedNormally() {
        return trip == WatchdogTrip.NONE && error == null && outcome != null;
    }

    /**
     * The outcome to classify. Trips and runtime exceptions become a failure
     * outcome carrying their description, with no diff.
     */
    public StepOutcome effectiveOutcome() {
        if (trip != WatchdogTrip.NONE) {
            String what = trip == WatchdogTrip.WALL_CLOCK
                    ? "step exceeded wall-clock timeout after " + elapsed.toSeconds() + "s"
                    : "step produced no activity for " + longestIdle.toSeconds() + "s";
            return StepOutcome.failure(null, null, "watchdog " + trip.wireName() + ": " + what, "", null);
        }
        if (error != null) {
            String msg = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
            return StepOutcome.failure(null, null, "runtime error: " + msg, "", null);
        }
        if (outcome == null) {
            return StepOutcome.failure(null, null, "runtime returned no outcome", "", null);
        }
        return outcome;
    }
}
