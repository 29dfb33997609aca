package com.stepwright.orchestrator.executor;

import java.util.List;

/**
 * What a runtime reports when an attempt ends on its own.
 *
 * @param diff         unified diff of the attempt's changes ("" for none)
 * @param changedFiles relative paths touched by the attempt
 * @param exitCode     process exit code, if the runtime has one
 * @param failureHint  runtime's own guess at the failure kind: "policy", "contract", "repo" or null
 */
public record StepOutcome(
        boolean      succeeded,
        String       summary,
        String       diff,
        List<String> changedFiles,
        Integer      exitCode,
        String       failureHint,
        String       errorMessage
) {
    public StepOutcome {
        if (diff == null) diff = "";
        changedFiles = changedFiles == null ? List.of() : List.copyOf(changedFiles);
    }

    public static StepOutcome success(String summary, String diff, List<String> changedFiles) {
        return new StepOutcome(true, summary, diff, changedFiles, 0, null, null);
    }

    public static StepOutcome failure(Integer exitCode, String failureHint, String errorMessage,
                                      String diff, List<String> changedFiles) {
        return new StepOutcome(false, null, diff, changedFiles, exitCode, failureHint, errorMessage);
    }
}
