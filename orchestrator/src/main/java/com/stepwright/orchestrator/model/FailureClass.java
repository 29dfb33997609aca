package com.stepwright.orchestrator.model;

import java.util.Locale;

/**
 * Classification of a failed step attempt, in evaluation order.
 */
public enum FailureClass {
    DETERMINISTIC_POLICY,
    DETERMINISTIC_CONTRACT,
    DETERMINISTIC_REPO,
    STUCK_NO_PROGRESS,
    TRANSIENT_RUNTIME;

    /** Policy and contract failures never get another attempt. */
    public boolean forbidsRetry() {
        return this == DETERMINISTIC_POLICY || this == DETERMINISTIC_CONTRACT;
    }

    /** Only these two classes may escalate into a queue-level retry. */
    public boolean isQueueRetryable() {
        return this == STUCK_NO_PROGRESS || this == TRANSIENT_RUNTIME;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
