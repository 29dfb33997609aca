package com.stepwright.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.stepwright.orchestrator.model.Job;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Job as returned by every endpoint that returns a job. The payload is
 * echoed back as the JSON the caller submitted.
 */
public record JobResponse(
        UUID                id,
        String              type,
        String              status,
        int                 priority,
        @JsonRawValue String payload,
        int                 attempt,
        int                 maxAttempts,
        String              claimedBy,
        Instant             leaseExpiresAt,
        Instant             nextAttemptAt,
        boolean             retryable,
        String              resultSummary,
        String              errorMessage,
        boolean             cancelRequested,
        Instant             publishedAt,
        LiveControlResponse liveControl,
        Instant             createdAt,
        Instant             updatedAt,
        Instant             startedAt,
        Instant             finishedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getType(),
                job.getStatus().name().toLowerCase(Locale.ROOT),
                job.getPriority(),
                job.getPayload(),
                job.getAttempt(),
                job.getMaxAttempts(),
                job.getClaimedBy(),
                job.getLeaseExpiresAt(),
                job.getNextAttemptAt(),
                job.isRetryable(),
                job.getResultSummary(),
                job.getErrorMessage(),
                job.isCancelRequested(),
                job.getPublishedAt(),
                LiveControlResponse.from(job.getLiveControl()),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getStartedAt(),
                job.getFinishedAt()
        );
    }
}
