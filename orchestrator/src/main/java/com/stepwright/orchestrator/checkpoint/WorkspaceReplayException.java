package com.stepwright.orchestrator.checkpoint;

/** Replay could not rebuild the workspace (missing checkpoint, patch did not apply, ...). */
public class WorkspaceReplayException extends RuntimeException {

    public WorkspaceReplayException(String message) {
        super(message);
    }

    public WorkspaceReplayException(String message, Throwable cause) {
        super(message, cause);
    }
}
