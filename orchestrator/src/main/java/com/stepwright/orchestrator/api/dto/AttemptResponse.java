package com.stepwright.orchestrator.api.dto;

import com.stepwright.orchestrator.model.AttemptRecord;

import java.time.Instant;
import java.util.Locale;

public record AttemptResponse(
        Long    id,
        String  stepId,
        int     stepIndex,
        int     attempt,
        String  workerId,
        String  outcome,
        String  failureClass,
        String  failureSignature,
        String  signatureHash,
        String  strategy,
        Double  wallClockSeconds,
        Double  idleSeconds,
        String  diffHash,
        String  summary,
        Instant startedAt,
        Instant finishedAt
) {
    public static AttemptResponse from(AttemptRecord a) {
        return new AttemptResponse(
                a.getId(), a.getStepId(), a.getStepIndex(), a.getAttempt(), a.getWorkerId(),
                a.getOutcome().name().toLowerCase(Locale.ROOT),
                a.getFailureClass() == null ? null : a.getFailureClass().wireName(),
                a.getFailureSignature(), a.getSignatureHash(),
                a.getStrategy() == null ? null : a.getStrategy().wireName(),
                a.getWallClockSeconds(), a.getIdleSeconds(), a.getDiffHash(), a.getSummary(),
                a.getStartedAt(), a.getFinishedAt());
    }
}
