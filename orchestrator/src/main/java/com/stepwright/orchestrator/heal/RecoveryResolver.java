package com.stepwright.orchestrator.heal;

import com.stepwright.orchestrator.checkpoint.CheckpointStore;
import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.model.RecoveryAction;
import com.stepwright.orchestrator.model.RecoveryRequest;
import com.stepwright.orchestrator.service.LiveControlService;
import com.stepwright.orchestrator.task.ResolvedStep;
import com.stepwright.orchestrator.telemetry.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a pending operator recovery into a target step, or rejects it, and
 * acknowledges it either way.
 *
 * {@code currentIndex} equal to the step count means "between the last step
 * and publish"; only rewinds make sense there.
 */
@Component
public class RecoveryResolver {

    private static final Logger log = LoggerFactory.getLogger(RecoveryResolver.class);

    public enum Kind {
        /** Retry the current step in its workspace. */
        RETRY_CURRENT,
        /** Rebuild up to the current step, then retry it. */
        REBUILD_CURRENT,
        /** Leave the current step; rebuild up to {@code targetIndex} and continue from there. */
        REWIND,
        REJECTED
    }

    public record Resolution(Kind kind, int targetIndex, RecoveryRequest request, String detail) {}

    private final LiveControlService liveControl;
    private final CheckpointStore    checkpoints;
    private final TelemetrySink      telemetry;

    public RecoveryResolver(LiveControlService liveControl,
                            CheckpointStore checkpoints,
                            TelemetrySink telemetry) {
        this.liveControl = liveControl;
        this.checkpoints = checkpoints;
        this.telemetry   = telemetry;
    }

    public Resolution resolve(Job job, String workerId, List<ResolvedStep> steps,
                              int currentIndex, ControlSnapshot control) {
        RecoveryRequest request = control.recovery();
        Resolution resolution = decide(job, steps, currentIndex, request);

        boolean honored = resolution.kind() != Kind.REJECTED;
        liveControl.acknowledgeRecovery(job.getId(), control.recoveryVersion(), request,
                honored, resolution.detail(), workerId);

        if (!honored) {
            log.warn("Rejected {} on job {}: {}", request.action().wireName(), job.getId(), resolution.detail());
        } else {
            log.info("Honoring {} on job {}: {}", request.action().wireName(), job.getId(), resolution.detail());
            if (request.action() == RecoveryAction.RESUME_FROM_STEP) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("fromStepIndex", currentIndex);
                payload.put("toStepIndex",   resolution.targetIndex());
                payload.put("stepId",        steps.get(resolution.targetIndex()).stepId());
                payload.put("reason",        "operator");
                payload.put("requestedBy",   request.requestedBy());
                telemetry.info(job.getId(), "resume.from_step", payload);
            }
        }
        return resolution;
    }

    private Resolution decide(Job job, List<ResolvedStep> steps, int currentIndex, RecoveryRequest request) {
        switch (request.action()) {
            case RETRY_STEP -> {
                if (currentIndex >= steps.size()) {
                    return rejected(request, "no step in progress to retry");
                }
                String current = steps.get(currentIndex).stepId();
                if (request.stepId() != null && !request.stepId().equals(current)) {
                    return rejected(request, "retry_step targets " + request.stepId()
                            + " but the current step is " + current);
                }
                return new Resolution(Kind.RETRY_CURRENT, currentIndex, request, "retrying step " + current);
            }
            case HARD_RESET_STEP, RESUME_FROM_STEP -> {
                Integer target = targetIndex(steps, currentIndex, request.stepId());
                if (target == null) {
                    return rejected(request, request.stepId() == null
                            ? request.action().wireName() + " needs a step id here"
                            : "unknown step id " + request.stepId());
                }
                if (!checkpoints.canRebuildTo(job.getId(), target)) {
                    return rejected(request, "cannot rebuild to step " + steps.get(target).stepId()
                            + ": an earlier step has no checkpoint");
                }
                String detail = "rebuilding to step " + steps.get(target).stepId();
                return new Resolution(target == currentIndex ? Kind.REBUILD_CURRENT : Kind.REWIND,
                        target, request, detail);
            }
            default -> throw new IllegalStateException("Unhandled recovery action " + request.action());
        }
    }

    private static Integer targetIndex(List<ResolvedStep> steps, int currentIndex, String stepId) {
        if (stepId == null) {
            return currentIndex < steps.size() ? currentIndex : null;
        }
        for (ResolvedStep step : steps) {
            if (step.stepId().equals(stepId)) return step.stepIndex();
        }
        return null;
    }

    private static Resolution rejected(RecoveryRequest request, String detail) {
        return new Resolution(Kind.REJECTED, -1, request, detail);
    }
}
