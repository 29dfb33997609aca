package com.stepwright.orchestrator.service;

import com.stepwright.orchestrator.model.ControlAction;
import com.stepwright.orchestrator.model.ControlEvent;
import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.model.LiveControlState;
import com.stepwright.orchestrator.model.RecoveryRequest;
import com.stepwright.orchestrator.repository.ControlEventRepository;
import com.stepwright.orchestrator.repository.JobRepository;
import com.stepwright.orchestrator.task.ResolvedStep;
import com.stepwright.orchestrator.task.TaskDocumentReader;
import com.stepwright.orchestrator.telemetry.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Operator side of the live control channel, plus the worker's
 * acknowledgement of recovery requests.
 *
 *   pause    → paused=true
 *   resume   → paused=false, takeover=false
 *   takeover → paused=true,  takeover=true
 *   retry_step | hard_reset_step | resume_from_step → pending recovery (last writer wins)
 *
 * Every write runs under the job's row lock, bumps controlVersion and appends
 * a {@link ControlEvent}. A recovery request is stamped with the version of
 * the write that created it.
 */
@Service
public class LiveControlService {

    private static final Logger log = LoggerFactory.getLogger(LiveControlService.class);

    private final JobRepository          jobRepo;
    private final ControlEventRepository controlEvents;
    private final TaskDocumentReader     tasks;
    private final TelemetrySink          telemetry;
    private final Clock                  clock;

    public LiveControlService(JobRepository jobRepo,
                              ControlEventRepository controlEvents,
                              TaskDocumentReader tasks,
                              TelemetrySink telemetry,
                              Clock clock) {
        this.jobRepo       = jobRepo;
        this.controlEvents = controlEvents;
        this.tasks         = tasks;
        this.telemetry     = telemetry;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Operator writes
    // ------------------------------------------------------------------

    @Transactional
    public Job apply(UUID jobId, ControlCommand cmd) {
        if (cmd.action() == null) {
            throw new QueueValidationException("Control action is required");
        }
        Job job = jobRepo.findByIdForUpdate(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.getStatus().isTerminal()) {
            throw new JobStateException(jobId, "Job " + jobId + " is already " + job.getStatus());
        }
        String stepId = blankToNull(cmd.stepId());
        validateStep(job, cmd, stepId);

        Instant now = clock.instant();
        LiveControlState control = job.getLiveControl();
        long version = control.bumpVersion();
        switch (cmd.action()) {
            case PAUSE -> control.setPaused(true);
            case RESUME -> {
                control.setPaused(false);
                control.setTakeover(false);
            }
            case TAKEOVER -> {
                control.setPaused(true);
                control.setTakeover(true);
            }
            case RETRY_STEP, HARD_RESET_STEP, RESUME_FROM_STEP ->
                    control.requestRecovery(cmd.action().recovery().orElseThrow(), stepId,
                            blankToNull(cmd.strategy()), cmd.actor(), cmd.reason(), now, version);
        }
        control.setLastAction(cmd.action().wireName());
        jobRepo.save(job);

        controlEvents.save(new ControlEvent(jobId, cmd.action().wireName(), stepId,
                blankToNull(cmd.strategy()), cmd.reason(), cmd.actor(), now));
        log.info("Control '{}' on job {} by {} (version {})", cmd.action().wireName(), jobId, cmd.actor(), version);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", cmd.action().wireName());
        payload.put("stepId", stepId);
        payload.put("actor", cmd.actor());
        payload.put("controlVersion", version);
        telemetry.info(jobId, "task.control", payload);
        return job;
    }

    // ------------------------------------------------------------------
    // Worker acknowledgement
    // ------------------------------------------------------------------

    /**
     * Record that the worker honored (or rejected) a recovery request and
     * clear it, but only if the pending request is still the one the worker
     * read, identified by its {@code observedVersion}. Pause, resume and
     * takeover writes do not replace the request and so do not block the clear.
     *
     * @return true if the pending request was cleared
     */
    @Transactional
    public boolean acknowledgeRecovery(UUID jobId, long observedVersion, RecoveryRequest request,
                                       boolean honored, String detail, String workerId) {
        Job job = jobRepo.findByIdForUpdate(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        LiveControlState control = job.getLiveControl();
        boolean cleared = false;
        if (control.pendingRecovery().isPresent() && control.getRecoveryVersion() == observedVersion) {
            control.clearRecovery();
            jobRepo.save(job);
            cleared = true;
        }

        String action = honored ? "recovery.ack" : "recovery.rejected";
        controlEvents.save(new ControlEvent(jobId, action, request.stepId(), request.strategy(),
                detail, workerId, clock.instant()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", request.action().wireName());
        payload.put("stepId", request.stepId());
        payload.put("honored", honored);
        payload.put("cleared", cleared);
        payload.put("detail", detail);
        payload.put("observedVersion", observedVersion);
        telemetry.info(jobId, "control.recovery.ack", payload);

        if (!cleared) {
            log.info("Recovery {} on job {} acknowledged but not cleared: a newer request replaced version {}",
                    request.action().wireName(), jobId, observedVersion);
        }
        return cleared;
    }

    @Transactional(readOnly = true)
    public List<ControlEvent> events(UUID jobId) {
        if (!jobRepo.existsById(jobId)) throw new JobNotFoundException(jobId);
        return controlEvents.findByJobIdOrderByIdAsc(jobId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void validateStep(Job job, ControlCommand cmd, String stepId) {
        if (cmd.action().recovery().isEmpty()) return;
        if (cmd.action() == ControlAction.RESUME_FROM_STEP && stepId == null) {
            throw new QueueValidationException("resume_from_step requires a stepId");
        }
        if (stepId == null) return;
        List<ResolvedStep> steps = job.getResolvedSteps() != null
                ? tasks.readSteps(job.getResolvedSteps())
                : tasks.read(job.getPayload()).steps();
        boolean known = steps.stream().anyMatch(s -> s.stepId().equals(stepId));
        if (!known) {
            throw new QueueValidationException("Job " + job.getId() + " has no step '" + stepId + "'");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
