package com.stepwright.orchestrator.heal;

import com.stepwright.orchestrator.model.RecoveryRequest;

import java.util.Optional;

/**
 * Live control as read at one checkpoint, after any hold has cleared.
 *
 * @param recovery       pending operator recovery, or null
 * @param recoveryVersion version stamped on the recovery when it was requested; used for compare-and-clear
 */
public record ControlSnapshot(RecoveryRequest recovery, long recoveryVersion) {

    public Optional<RecoveryRequest> pendingRecovery() {
        return Optional.ofNullable(recovery);
    }
}
