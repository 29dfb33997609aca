package com.stepwright.orchestrator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Operator actions accepted by POST /jobs/{id}/control.
 *
 * The first three toggle pause/takeover flags; the rest queue a
 * {@link RecoveryAction} for the worker to pick up at its next checkpoint.
 */
public enum ControlAction {
    PAUSE(null),
    RESUME(null),
    TAKEOVER(null),
    RETRY_STEP(RecoveryAction.RETRY_STEP),
    HARD_RESET_STEP(RecoveryAction.HARD_RESET_STEP),
    RESUME_FROM_STEP(RecoveryAction.RESUME_FROM_STEP);

    private final RecoveryAction recovery;

    ControlAction(RecoveryAction recovery) {
        this.recovery = recovery;
    }

    public Optional<RecoveryAction> recovery() {
        return Optional.ofNullable(recovery);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses "pause", "hard_reset_step", "Resume-From-Step" ... ; empty when unknown. */
    public static Optional<ControlAction> fromWire(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ControlAction action : values()) {
            if (action.name().equals(normalized)) return Optional.of(action);
        }
        return Optional.empty();
    }
}
