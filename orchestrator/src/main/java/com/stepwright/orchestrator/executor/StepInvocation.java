package com.stepwright.orchestrator.executor;

import com.stepwright.orchestrator.task.ResolvedStep;
import com.stepwright.orchestrator.task.RetryContext;

import java.util.UUID;

/**
 * Everything a runtime needs for one attempt of one step.
 *
 * @param instruction composed objective + step text (see InstructionComposer)
 * @param retry       null on the first attempt of a step window
 */
public record StepInvocation(
        UUID         jobId,
        String       workspaceRef,
        ResolvedStep step,
        int          stepCount,
        int          attempt,
        String       instruction,
        RetryContext retry
) {}
