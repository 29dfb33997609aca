package com.stepwright.orchestrator.model;

/**
 * DRAIN:   stop handing out new jobs, let running ones finish.
 * QUIESCE: DRAIN, and running jobs also hold at their next control checkpoint.
 */
public enum WorkerPauseMode {
    DRAIN,
    QUIESCE
}
