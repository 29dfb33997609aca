package com.stepwright.orchestrator.task;

/**
 * One entry of a job's step list, fixed at claim time.
 *
 * @param stepIndex    0-based position
 * @param stepId       explicit id, or "step-{index+1}"
 * @param title        optional
 * @param instructions optional step-specific instructions
 * @param skillId      step skill, else the task's skill, else "auto"
 */
public record ResolvedStep(
        int    stepIndex,
        String stepId,
        String title,
        String instructions,
        String skillId
) {
    public boolean hasInstructions() {
        return instructions != null && !instructions.isBlank();
    }
}
