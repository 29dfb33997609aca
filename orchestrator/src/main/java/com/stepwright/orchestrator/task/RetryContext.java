package com.stepwright.orchestrator.task;

import java.util.List;

/**
 * What one attempt passes on to the next: a scrubbed one-paragraph failure
 * summary plus the previous diff hash and changed files. Never a transcript.
 */
public record RetryContext(
        String       failureSummary,
        String       priorDiffHash,
        List<String> priorChangedFiles
) {}
