package com.stepwright.orchestrator.checkpoint;

/**
 * A stored patch no longer matches its recorded hash. Replay stops; this
 * needs an operator, never an automatic retry.
 */
public class CheckpointIntegrityException extends RuntimeException {

    private final long checkpointId;
    private final int  stepIndex;

    public CheckpointIntegrityException(long checkpointId, int stepIndex, String expected, String actual) {
        super("Checkpoint " + checkpointId + " (step index " + stepIndex + ") failed verification: expected sha256 "
                + expected + " but patch hashes to " + actual);
        this.checkpointId = checkpointId;
        this.stepIndex    = stepIndex;
    }

    public long getCheckpointId() { return checkpointId; }
    public int  getStepIndex()    { return stepIndex; }
}
