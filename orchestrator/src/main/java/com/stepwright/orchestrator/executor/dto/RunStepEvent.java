package com.stepwright.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One NDJSON line streamed back by POST /workspace/run_step.
 *
 *   {"type":"output","line":"..."}   progress (any non-result line counts as activity)
 *   {"type":"result","succeeded":true,"summary":"...","diff":"...","changed_files":[...],
 *    "exit_code":0,"failure_hint":null,"error":null}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunStepEvent(
        String       type,
        String       line,
        Boolean      succeeded,
        String       summary,
        String       diff,
        List<String> changed_files,
        Integer      exit_code,
        String       failure_hint,
        String       error
) {
    public boolean isResult() {
        return "result".equals(type);
    }
}
