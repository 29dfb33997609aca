package com.stepwright.orchestrator.api.dto;

import com.stepwright.orchestrator.model.WorkerPauseState;

import java.time.Instant;
import java.util.Locale;

/** Global worker pause state. */
public record SystemStateResponse(
        boolean paused,
        String  mode,
        String  reason,
        String  requestedBy,
        Instant updatedAt,
        long    version
) {
    public static SystemStateResponse from(WorkerPauseState s) {
        return new SystemStateResponse(s.isPaused(), s.getMode().name().toLowerCase(Locale.ROOT), s.getReason(),
                s.getRequestedBy(), s.getUpdatedAt(), s.getVersion());
    }
}
