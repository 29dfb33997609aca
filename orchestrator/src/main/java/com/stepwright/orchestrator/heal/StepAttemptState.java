package com.stepwright.orchestrator.heal;

import java.util.Objects;

/**
 * Retry bookkeeping for one step while it is being worked on.
 *
 * windowAttempts counts attempts since the last window opened (step start,
 * hard reset, operator retry). consecutiveNoProgress counts identical
 * consecutive failure pairs: a failure matching the previous one in both
 * signature and diff hash adds one, anything else resets it to zero.
 * Opening a new window keeps the last signature, so the first failure after
 * a rebuild can still be recognised as a repeat.
 */
public class StepAttemptState {

    private int    windowAttempts;
    private int    consecutiveNoProgress;
    private String lastSignature;
    private String lastDiffHash;

    public void beginAttempt() {
        windowAttempts++;
    }

    /**
     * @return true if this failure repeats the previous one (same signature and diff)
     */
    public boolean recordFailure(String signatureFingerprint, String diffHash) {
        boolean repeated = lastSignature != null
                && lastSignature.equals(signatureFingerprint)
                && Objects.equals(lastDiffHash, diffHash);
        consecutiveNoProgress = repeated ? consecutiveNoProgress + 1 : 0;
        lastSignature = signatureFingerprint;
        lastDiffHash  = diffHash;
        return repeated;
    }

    public void openWindow() {
        windowAttempts        = 0;
        consecutiveNoProgress = 0;
    }

    public boolean noProgressExhausted(int limit) {
        return consecutiveNoProgress >= limit;
    }

    public int windowAttempts()        { return windowAttempts; }
    public int consecutiveNoProgress() { return consecutiveNoProgress; }
    public String lastSignature()      { return lastSignature; }
}
