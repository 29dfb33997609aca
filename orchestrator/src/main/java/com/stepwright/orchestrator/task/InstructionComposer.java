package com.stepwright.orchestrator.task;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Builds the instruction text handed to the step runtime.
 *
 * The task objective is always included, even for single-step jobs, so a
 * retried attempt never loses the broader intent. On a retry the previous
 * attempt's failure summary, diff hash and changed files are appended;
 * nothing else from earlier attempts is carried over.
 */
@Component
public class InstructionComposer {

    static final String SAME_AS_OBJECTIVE =
            "(same as task objective; no additional step-specific instructions)";
    static final String NO_STEP_INSTRUCTIONS =
            "(no step-specific instructions; continue based on objective)";

    public String compose(String objective, ResolvedStep step, int stepCount, RetryContext retry) {
        String objectiveText = objective == null ? "" : objective.strip();
        String title = step.title() != null ? " " + step.title() : "";

        StringBuilder sb = new StringBuilder();
        sb.append("TASK OBJECTIVE:\n").append(objectiveText).append("\n\n");
        sb.append("STEP ").append(step.stepIndex() + 1).append('/').append(stepCount)
          .append(' ').append(step.stepId()).append(title).append(":\n")
          .append(stepInstruction(objectiveText, step)).append("\n\n");
        sb.append("EFFECTIVE SKILL:\n").append(step.skillId()).append("\n\n");
        sb.append("WORKSPACE:\n")
          .append("- The repository is already checked out; earlier steps' changes are applied.\n")
          .append("- Do not commit or push. Publishing happens after the last step.");

        if (retry != null) {
            sb.append("\n\nPREVIOUS ATTEMPT:\n").append(retry.failureSummary());
            if (retry.priorDiffHash() != null) {
                sb.append("\nPrior diff hash: ").append(retry.priorDiffHash());
            }
            List<String> files = retry.priorChangedFiles();
            if (files != null && !files.isEmpty()) {
                sb.append("\nPrior changed files: ").append(String.join(", ", files));
            }
        }
        return sb.toString();
    }

    private static String stepInstruction(String objective, ResolvedStep step) {
        if (!step.hasInstructions()) return NO_STEP_INSTRUCTIONS;
        String own = step.instructions().strip();
        if (!objective.isEmpty() && normalize(own).equals(normalize(objective))) {
            return SAME_AS_OBJECTIVE;
        }
        return own;
    }

    private static String normalize(String text) {
        return text.replaceAll("\\s+", " ").strip().toLowerCase(Locale.ROOT);
    }
}
