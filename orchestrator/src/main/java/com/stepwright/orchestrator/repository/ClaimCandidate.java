package com.stepwright.orchestrator.repository;

import java.time.Instant;
import java.util.UUID;

/**
 * Unlocked read of a queued job, just enough to decide eligibility
 * before trying to lock the row. {@code priority} and {@code createdAt}
 * position the candidate in claim order for the next batch.
 */
public record ClaimCandidate(UUID id, String type, String payload, int priority, Instant createdAt) {}
