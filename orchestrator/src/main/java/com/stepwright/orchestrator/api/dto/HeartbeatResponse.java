package com.stepwright.orchestrator.api.dto;

/** What a worker needs at a checkpoint: its job, live control and the global pause. */
public record HeartbeatResponse(JobResponse job, LiveControlResponse liveControl, SystemStateResponse system) {}
