package com.stepwright.orchestrator.executor;

/**
 * Owns the per-job working copy that steps run in.
 */
public interface WorkspaceManager {

    /** Create the workspace from the baseline. Idempotent for an existing ref. */
    void prepare(String workspaceRef, Baseline baseline);

    /** Discard every change and return the workspace to the baseline. */
    void reset(String workspaceRef, Baseline baseline);

    /** Apply a unified diff on top of the current workspace state. */
    void applyPatch(String workspaceRef, String patch);

    void delete(String workspaceRef);
}
