package com.stepwright.orchestrator.api.dto;

import com.stepwright.orchestrator.service.ClaimResult;

/** {@code job} is null when nothing was eligible. */
public record ClaimResponse(JobResponse job, SystemStateResponse system) {

    public static ClaimResponse from(ClaimResult result) {
        return new ClaimResponse(
                result.claimed().map(JobResponse::from).orElse(null),
                SystemStateResponse.from(result.system()));
    }
}
