package com.stepwright.orchestrator.model;

import java.time.Instant;

/**
 * A pending operator recovery, as read from {@link LiveControlState}.
 * {@code stepId} is null when the operator did not name a step.
 */
public record RecoveryRequest(
        RecoveryAction action,
        String         stepId,
        String         strategy,
        String         requestedBy,
        String         reason,
        Instant        updatedAt
) {}
