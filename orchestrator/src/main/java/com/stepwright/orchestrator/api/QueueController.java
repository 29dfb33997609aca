package com.stepwright.orchestrator.api;

import com.stepwright.orchestrator.api.dto.CancelAckRequest;
import com.stepwright.orchestrator.api.dto.ClaimRequest;
import com.stepwright.orchestrator.api.dto.ClaimResponse;
import com.stepwright.orchestrator.api.dto.CompleteRequest;
import com.stepwright.orchestrator.api.dto.FailRequest;
import com.stepwright.orchestrator.api.dto.HeartbeatRequest;
import com.stepwright.orchestrator.api.dto.HeartbeatResponse;
import com.stepwright.orchestrator.api.dto.JobResponse;
import com.stepwright.orchestrator.api.dto.LiveControlResponse;
import com.stepwright.orchestrator.api.dto.SystemStateResponse;
import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.service.QueueService;
import com.stepwright.orchestrator.service.WorkerPauseService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Worker-facing queue API, for workers running outside this process.
 *
 * POST /queue/claim                    claim the next eligible job (job is null when idle)
 * POST /queue/jobs/{id}/heartbeat      extend the lease, read live control
 * POST /queue/jobs/{id}/complete       finish successfully
 * POST /queue/jobs/{id}/fail           finish with an error, optionally retryable
 * POST /queue/jobs/{id}/cancel/ack     acknowledge an operator cancel
 */
@RestController
@RequestMapping("/queue")
public class QueueController {

    private final QueueService       queueService;
    private final WorkerPauseService workerPause;

    public QueueController(QueueService queueService, WorkerPauseService workerPause) {
        this.queueService = queueService;
        this.workerPause  = workerPause;
    }

    @PostMapping("/claim")
    public ClaimResponse claim(@Valid @RequestBody ClaimRequest req) {
        return ClaimResponse.from(queueService.claim(req.workerId(), req.leaseSeconds(),
                req.allowedTypes(), req.capabilities()));
    }

    @PostMapping("/jobs/{id}/heartbeat")
    public HeartbeatResponse heartbeat(@PathVariable UUID id, @Valid @RequestBody HeartbeatRequest req) {
        Job job = queueService.heartbeat(id, req.workerId(), req.leaseSeconds());
        return new HeartbeatResponse(JobResponse.from(job),
                LiveControlResponse.from(job.getLiveControl()),
                SystemStateResponse.from(workerPause.current()));
    }

    @PostMapping("/jobs/{id}/complete")
    public JobResponse complete(@PathVariable UUID id, @Valid @RequestBody CompleteRequest req) {
        return JobResponse.from(queueService.complete(id, req.workerId(), req.result()));
    }

    @PostMapping("/jobs/{id}/fail")
    public JobResponse fail(@PathVariable UUID id, @Valid @RequestBody FailRequest req) {
        return JobResponse.from(queueService.fail(id, req.workerId(), req.error(), req.retryable()));
    }

    @PostMapping("/jobs/{id}/cancel/ack")
    public JobResponse ackCancel(@PathVariable UUID id, @Valid @RequestBody CancelAckRequest req) {
        return JobResponse.from(queueService.ackCancel(id, req.workerId(), req.message()));
    }
}
