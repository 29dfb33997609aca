package com.stepwright.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.Optional;

/**
 * Operator-writable control sub-document of a {@link Job}.
 *
 * Written concurrently by operators (pause, takeover, recovery requests) and
 * by the owning worker (acknowledging a recovery). Every operator write bumps
 * {@code controlVersion} under the job's row lock. A recovery request also
 * records that version as {@code recoveryVersion}; the worker only clears the
 * request if its {@code recoveryVersion} is the one it read, so a request that
 * arrives while the worker is acting on an older one survives, and a pause or
 * takeover in between does not keep an honored request alive.
 */
@Embeddable
public class LiveControlState {

    @Column(name = "control_paused", nullable = false)
    private boolean paused = false;

    @Column(name = "control_takeover", nullable = false)
    private boolean takeover = false;

    @Column(name = "control_version", nullable = false)
    private long controlVersion = 0;

    @Column(name = "control_last_action")
    private String lastAction;

    // Pending recovery (all null when nothing is pending).
    @Enumerated(EnumType.STRING)
    @Column(name = "recovery_action")
    private RecoveryAction recoveryAction;

    @Column(name = "recovery_step_id")
    private String recoveryStepId;

    @Column(name = "recovery_strategy")
    private String recoveryStrategy;

    @Column(name = "recovery_requested_by")
    private String recoveryRequestedBy;

    @Column(name = "recovery_reason", columnDefinition = "TEXT")
    private String recoveryReason;

    @Column(name = "recovery_updated_at")
    private Instant recoveryUpdatedAt;

    // controlVersion of the write that created the pending request.
    @Column(name = "recovery_version", nullable = false)
    private long recoveryVersion = 0;

    public LiveControlState() {}

    // ------------------------------------------------------------------
    // Recovery request
    // ------------------------------------------------------------------

    public Optional<RecoveryRequest> pendingRecovery() {
        if (recoveryAction == null) return Optional.empty();
        return Optional.of(new RecoveryRequest(recoveryAction, recoveryStepId, recoveryStrategy,
                recoveryRequestedBy, recoveryReason, recoveryUpdatedAt));
    }

    /** Last writer wins: a new request replaces an unacknowledged one. */
    public void requestRecovery(RecoveryAction action, String stepId, String strategy,
                                String requestedBy, String reason, Instant now, long version) {
        this.recoveryVersion     = version;
        this.recoveryAction      = action;
        this.recoveryStepId      = stepId;
        this.recoveryStrategy    = strategy;
        this.recoveryRequestedBy = requestedBy;
        this.recoveryReason      = reason;
        this.recoveryUpdatedAt   = now;
    }

    public void clearRecovery() {
        this.recoveryAction      = null;
        this.recoveryStepId      = null;
        this.recoveryStrategy    = null;
        this.recoveryRequestedBy = null;
        this.recoveryReason      = null;
        this.recoveryUpdatedAt   = null;
    }

    /** Paused or taken over: the worker must hold at its next checkpoint. */
    public boolean isHolding() {
        return paused || takeover;
    }

    public long bumpVersion() {
        return ++controlVersion;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public boolean isPaused()          { return paused; }
    public boolean isTakeover()        { return takeover; }
    public long    getControlVersion() { return controlVersion; }
    public long    getRecoveryVersion() { return recoveryVersion; }
    public String  getLastAction()     { return lastAction; }

    public void setPaused(boolean paused)          { this.paused = paused; }
    public void setTakeover(boolean takeover)      { this.takeover = takeover; }
    public void setLastAction(String lastAction)   { this.lastAction = lastAction; }
}
