package com.stepwright.orchestrator.heal;

import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.task.ResolvedStep;

import java.util.List;

/**
 * What the runner hands the self-heal controller for one step. Read-only.
 *
 * @param job                 the claimed job as read at claim time
 * @param objective           the task objective (composed into every instruction)
 * @param steps               the job's full resolved step list
 * @param step                the step to run
 * @param hardResetsRemaining automatic hard resets the job may still spend
 */
public record AttemptContext(
        Job                job,
        String             workerId,
        String             workspaceRef,
        String             objective,
        List<ResolvedStep> steps,
        ResolvedStep       step,
        int                hardResetsRemaining
) {
    public AttemptContext {
        steps = List.copyOf(steps);
    }

    public int stepCount() {
        return steps.size();
    }
}
