package com.stepwright.orchestrator.service;

import java.time.Duration;

/**
 * Claim engine tuning, bound from {@code stepwright.queue.*}.
 *
 * @param retryBackoffBase delay before the first queue-level retry; doubles per attempt
 * @param retryBackoffMax  upper bound for that delay
 * @param claimBatchSize   candidates read per round trip while looking for an eligible job
 * @param maxLeaseSeconds  longest lease a worker may ask for
 */
public record QueueSettings(
        Duration retryBackoffBase,
        Duration retryBackoffMax,
        int      claimBatchSize,
        int      maxLeaseSeconds
) {
    public QueueSettings {
        if (retryBackoffBase.isNegative() || retryBackoffMax.isNegative()) {
            throw new IllegalArgumentException("retry backoff must not be negative");
        }
        if (claimBatchSize < 1) {
            throw new IllegalArgumentException("claimBatchSize must be >= 1, got " + claimBatchSize);
        }
        if (maxLeaseSeconds < 1) {
            throw new IllegalArgumentException("maxLeaseSeconds must be >= 1, got " + maxLeaseSeconds);
        }
    }

    public static QueueSettings defaults() {
        return new QueueSettings(Duration.ofSeconds(5), Duration.ofMinutes(5), 200, 3600);
    }

    /** base * 2^(attempt-1), capped at max. */
    public Duration backoffFor(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 20));
        Duration delay = retryBackoffBase.multipliedBy(1L << exponent);
        return delay.compareTo(retryBackoffMax) > 0 ? retryBackoffMax : delay;
    }
}
