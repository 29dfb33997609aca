package com.stepwright.orchestrator.heal;

import com.stepwright.orchestrator.executor.StepOutcome;
import com.stepwright.orchestrator.model.FailureClass;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Assigns a {@link FailureClass} to a failed attempt. Rules are evaluated in
 * order and the first match wins: policy, contract, repo, stuck, transient.
 */
public class FailureClassifier {

    private static final Pattern POLICY_MESSAGE = Pattern.compile(
            "policy violation|blocked by policy|not allowed by policy|denied by policy",
            Pattern.CASE_INSENSITIVE);

    private final int noProgressLimit;

    public FailureClassifier(int noProgressLimit) {
        this.noProgressLimit = noProgressLimit;
    }

    /**
     * @param outcome             what the runtime reported (synthesised when it threw)
     * @param contractViolation   result-contract problem found on a "successful" outcome, if any
     * @param trip                watchdog that ended the attempt, NONE if it ended on its own
     * @param repeated            signature and diff equal the previous failure of this step
     * @param consecutiveNoProgress current no-progress counter, after this failure was recorded
     */
    public FailureClass classify(StepOutcome outcome, Optional<String> contractViolation,
                                 WatchdogTrip trip, boolean repeated, int consecutiveNoProgress) {
        String hint = outcome.failureHint() == null ? "" : outcome.failureHint().strip().toLowerCase(Locale.ROOT);
        String message = outcome.errorMessage() == null ? "" : outcome.errorMessage();

        if (hint.equals("policy") || POLICY_MESSAGE.matcher(message).find()) {
            return FailureClass.DETERMINISTIC_POLICY;
        }
        if (hint.equals("contract") || contractViolation.isPresent()) {
            return FailureClass.DETERMINISTIC_CONTRACT;
        }
        if (hint.equals("repo") && repeated) {
            return FailureClass.DETERMINISTIC_REPO;
        }
        if (trip != WatchdogTrip.NONE || consecutiveNoProgress >= noProgressLimit) {
            return FailureClass.STUCK_NO_PROGRESS;
        }
        return FailureClass.TRANSIENT_RUNTIME;
    }

    /**
     * Checks a runtime result against the result contract: a reported success
     * needs a summary, and changed files must be relative paths inside the workspace.
     */
    public Optional<String> contractViolation(StepOutcome outcome) {
        if (outcome.succeeded() && (outcome.summary() == null || outcome.summary().isBlank())) {
            return Optional.of("runtime reported success without a summary");
        }
        for (String file : outcome.changedFiles()) {
            if (file == null || file.isBlank()) {
                return Optional.of("runtime reported a blank changed file path");
            }
            String normalized = file.replace('\\', '/');
            if (normalized.startsWith("/") || normalized.matches("^[A-Za-z]:/.*")) {
                return Optional.of("changed file outside the workspace: " + file);
            }
            for (String segment : normalized.split("/")) {
                if (segment.equals("..")) {
                    return Optional.of("changed file outside the workspace: " + file);
                }
            }
        }
        return Optional.empty();
    }
}
