package com.stepwright.orchestrator.api.dto;

import com.stepwright.orchestrator.model.ControlEvent;

import java.time.Instant;
import java.util.UUID;

public record ControlEventResponse(
        Long    id,
        UUID    jobId,
        String  action,
        String  stepId,
        String  strategy,
        String  reason,
        String  actor,
        Instant createdAt
) {
    public static ControlEventResponse from(ControlEvent e) {
        return new ControlEventResponse(e.getId(), e.getJobId(), e.getAction(), e.getStepId(),
                e.getStrategy(), e.getReason(), e.getActor(), e.getCreatedAt());
    }
}
