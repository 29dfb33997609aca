package com.stepwright.orchestrator.api;

import com.stepwright.orchestrator.api.dto.AttemptResponse;
import com.stepwright.orchestrator.api.dto.CancelRequest;
import com.stepwright.orchestrator.api.dto.CheckpointResponse;
import com.stepwright.orchestrator.api.dto.ControlEventResponse;
import com.stepwright.orchestrator.api.dto.ControlRequest;
import com.stepwright.orchestrator.api.dto.CreateJobRequest;
import com.stepwright.orchestrator.api.dto.EventResponse;
import com.stepwright.orchestrator.api.dto.JobResponse;
import com.stepwright.orchestrator.api.dto.RequeueRequest;
import com.stepwright.orchestrator.model.ControlAction;
import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.model.JobStatus;
import com.stepwright.orchestrator.service.ControlCommand;
import com.stepwright.orchestrator.service.JobHistoryService;
import com.stepwright.orchestrator.service.LiveControlService;
import com.stepwright.orchestrator.service.QueueService;
import com.stepwright.orchestrator.service.QueueValidationException;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Operator API for jobs.
 *
 * POST /jobs                        enqueue a job
 * GET  /jobs?status=&type=&limit=   list jobs, newest first
 * GET  /jobs/{id}                   one job with its live control state
 * GET  /jobs/{id}/attempts          step attempt history
 * GET  /jobs/{id}/checkpoints       step checkpoints
 * GET  /jobs/{id}/events            telemetry events
 * GET  /jobs/{id}/control-events    operator control audit trail
 * POST /jobs/{id}/control           pause / resume / takeover / recovery requests
 * POST /jobs/{id}/cancel            cancel (immediate if queued, at next checkpoint if running)
 * POST /jobs/{id}/requeue           put a retryable failed job back on the queue
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private static final String DEFAULT_ACTOR = "operator";

    private final QueueService       queueService;
    private final LiveControlService liveControl;
    private final JobHistoryService  history;

    public JobController(QueueService queueService,
                         LiveControlService liveControl,
                         JobHistoryService history) {
        this.queueService = queueService;
        this.liveControl  = liveControl;
        this.history      = history;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"type":"repair","payload":{"repository":"https://github.com/acme/app.git",
     *          "task":{"instructions":"Fix the flaky test","steps":[{"id":"diagnose"},{"id":"fix"}]}}}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> create(@Valid @RequestBody CreateJobRequest req) {
        Job job = queueService.createJob(req.type(), req.payload().toString(), req.priority(), req.maxAttempts());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping
    public List<JobResponse> list(@RequestParam(required = false) String status,
                                  @RequestParam(required = false) String type,
                                  @RequestParam(defaultValue = "50") int limit) {
        return queueService.list(parseStatus(status), type, limit).stream()
                .map(JobResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public JobResponse get(@PathVariable UUID id) {
        return JobResponse.from(queueService.get(id));
    }

    @GetMapping("/{id}/attempts")
    public List<AttemptResponse> attempts(@PathVariable UUID id) {
        return history.attempts(id).stream().map(AttemptResponse::from).toList();
    }

    @GetMapping("/{id}/checkpoints")
    public List<CheckpointResponse> checkpoints(@PathVariable UUID id) {
        return history.checkpoints(id).stream().map(CheckpointResponse::from).toList();
    }

    @GetMapping("/{id}/events")
    public List<EventResponse> events(@PathVariable UUID id) {
        return history.events(id).stream().map(EventResponse::from).toList();
    }

    @GetMapping("/{id}/control-events")
    public List<ControlEventResponse> controlEvents(@PathVariable UUID id) {
        return liveControl.events(id).stream().map(ControlEventResponse::from).toList();
    }

    @PostMapping("/{id}/control")
    public JobResponse control(@PathVariable UUID id, @Valid @RequestBody ControlRequest req) {
        ControlAction action = ControlAction.fromWire(req.action())
                .orElseThrow(() -> new QueueValidationException("Unknown control action '" + req.action() + "'"));
        ControlCommand cmd = new ControlCommand(action, blankToNull(req.stepId()), blankToNull(req.strategy()),
                req.reason(), actorOrDefault(req.actor()));
        return JobResponse.from(liveControl.apply(id, cmd));
    }

    @PostMapping("/{id}/cancel")
    public JobResponse cancel(@PathVariable UUID id, @RequestBody(required = false) CancelRequest req) {
        String reason = req == null ? null : req.reason();
        String actor  = actorOrDefault(req == null ? null : req.actor());
        return JobResponse.from(queueService.requestCancel(id, actor, reason));
    }

    @PostMapping("/{id}/requeue")
    public JobResponse requeue(@PathVariable UUID id, @RequestBody(required = false) RequeueRequest req) {
        return JobResponse.from(queueService.requeue(id, actorOrDefault(req == null ? null : req.actor())));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static JobStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return JobStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new QueueValidationException("Unknown job status '" + raw + "'");
        }
    }

    private static String actorOrDefault(String actor) {
        return actor == null || actor.isBlank() ? DEFAULT_ACTOR : actor;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
