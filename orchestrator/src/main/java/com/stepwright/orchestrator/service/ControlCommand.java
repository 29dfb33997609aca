package com.stepwright.orchestrator.service;

import com.stepwright.orchestrator.model.ControlAction;

/** One operator write to a job's live control state. */
public record ControlCommand(
        ControlAction action,
        String        stepId,
        String        strategy,
        String        reason,
        String        actor
) {}
