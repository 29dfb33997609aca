package com.stepwright.orchestrator.executor;

/**
 * Called by a runtime whenever it produces output. Feeds the idle watchdog.
 */
@FunctionalInterface
public interface ActivityListener {

    void pulse();

    ActivityListener NONE = () -> {};
}
