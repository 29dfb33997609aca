package com.stepwright.orchestrator.heal;

import java.util.Locale;

public enum WatchdogTrip {
    NONE,
    WALL_CLOCK,
    IDLE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
