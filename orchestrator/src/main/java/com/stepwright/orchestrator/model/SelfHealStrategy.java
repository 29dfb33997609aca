package com.stepwright.orchestrator.model;

import java.util.Locale;

/** Recovery strategy recorded against an attempt. */
public enum SelfHealStrategy {
    NONE,
    SOFT_RESET,
    HARD_RESET,
    QUEUE_RETRY,
    OPERATOR_REQUEST;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
