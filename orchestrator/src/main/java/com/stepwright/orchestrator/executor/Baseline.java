package com.stepwright.orchestrator.executor;

/** The pristine source a workspace is built from: repository + ref. */
public record Baseline(String repository, String ref) {

    public Baseline {
        if (ref == null || ref.isBlank()) ref = "main";
    }
}
