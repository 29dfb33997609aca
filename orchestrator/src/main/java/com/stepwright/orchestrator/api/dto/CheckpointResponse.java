package com.stepwright.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.stepwright.orchestrator.model.StepCheckpoint;

import java.time.Instant;

public record CheckpointResponse(
        Long                id,
        String              stepId,
        int                 stepIndex,
        int                 attempt,
        String              diffHash,
        @JsonRawValue String changedFiles,
        String              summary,
        String              patchPath,
        String              metadataPath,
        Instant             finishedAt
) {
    public static CheckpointResponse from(StepCheckpoint c) {
        return new CheckpointResponse(c.getId(), c.getStepId(), c.getStepIndex(), c.getAttempt(),
                c.getDiffHash(), c.getChangedFiles(), c.getSummary(), c.getPatchPath(),
                c.getMetadataPath(), c.getFinishedAt());
    }
}
