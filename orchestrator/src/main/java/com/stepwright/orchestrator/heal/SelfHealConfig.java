package com.stepwright.orchestrator.heal;

import java.time.Duration;

/**
 * Per-step watchdog and retry budgets, bound from {@code stepwright.self-heal.*}.
 *
 * @param stepMaxAttempts  attempts per step window before escalating past soft reset
 * @param stepTimeout      wall-clock limit of one attempt
 * @param idleTimeout      longest silence (no runtime output) tolerated within an attempt
 * @param noProgressLimit  identical consecutive failures (same signature, same diff) before escalating
 * @param jobMaxHardResets automatic hard resets allowed per job (0 disables them)
 */
public record SelfHealConfig(
        int      stepMaxAttempts,
        Duration stepTimeout,
        Duration idleTimeout,
        int      noProgressLimit,
        int      jobMaxHardResets
) {
    public SelfHealConfig {
        requirePositive("stepMaxAttempts", stepMaxAttempts);
        requirePositive("noProgressLimit", noProgressLimit);
        if (jobMaxHardResets < 0) {
            throw new IllegalArgumentException("jobMaxHardResets must be >= 0, got " + jobMaxHardResets);
        }
        if (stepTimeout == null || stepTimeout.isZero() || stepTimeout.isNegative()) {
            throw new IllegalArgumentException("stepTimeout must be > 0, got " + stepTimeout);
        }
        if (idleTimeout == null || idleTimeout.isZero() || idleTimeout.isNegative()) {
            throw new IllegalArgumentException("idleTimeout must be > 0, got " + idleTimeout);
        }
    }

    public static SelfHealConfig defaults() {
        return new SelfHealConfig(3, Duration.ofSeconds(900), Duration.ofSeconds(300), 2, 1);
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, got " + value);
        }
    }
}
