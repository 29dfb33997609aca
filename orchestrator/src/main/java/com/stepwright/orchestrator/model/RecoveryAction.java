package com.stepwright.orchestrator.model;

import java.util.Locale;

/**
 * Recovery an operator can force on a running job.
 * At most one is pending per job (see {@link LiveControlState}).
 */
public enum RecoveryAction {
    RETRY_STEP,
    HARD_RESET_STEP,
    RESUME_FROM_STEP;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
