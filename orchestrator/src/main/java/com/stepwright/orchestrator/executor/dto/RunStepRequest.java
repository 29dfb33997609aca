package com.stepwright.orchestrator.executor.dto;

import java.util.List;

/**
 * Request body for POST /workspace/run_step.
 * Field names match the executor's snake_case models.
 */
public record RunStepRequest(
        String       job_id,
        String       workspace_ref,
        String       step_id,
        int          step_index,
        int          step_count,
        int          attempt,
        String       skill,
        String       instruction,
        String       prior_failure_summary,
        String       prior_diff_hash,
        List<String> prior_changed_files
) {}
