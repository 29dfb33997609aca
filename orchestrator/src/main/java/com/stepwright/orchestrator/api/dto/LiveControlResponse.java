package com.stepwright.orchestrator.api.dto;

import com.stepwright.orchestrator.model.LiveControlState;
import com.stepwright.orchestrator.model.RecoveryRequest;

import java.time.Instant;

public record LiveControlResponse(
        boolean  paused,
        boolean  takeover,
        long     controlVersion,
        String   lastAction,
        Recovery pendingRecovery
) {
    public record Recovery(String action, String stepId, String strategy,
                           String requestedBy, String reason, Instant updatedAt) {

        static Recovery from(RecoveryRequest r) {
            return new Recovery(r.action().wireName(), r.stepId(), r.strategy(),
                    r.requestedBy(), r.reason(), r.updatedAt());
        }
    }

    public static LiveControlResponse from(LiveControlState state) {
        return new LiveControlResponse(
                state.isPaused(),
                state.isTakeover(),
                state.getControlVersion(),
                state.getLastAction(),
                state.pendingRecovery().map(Recovery::from).orElse(null));
    }
}
