package com.stepwright.orchestrator.heal;

import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.model.LiveControlState;
import com.stepwright.orchestrator.service.QueueService;
import com.stepwright.orchestrator.service.WorkerPauseService;
import com.stepwright.orchestrator.telemetry.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Control checkpoint, called before every attempt and before publish.
 *
 * Each call renews the lease through a heartbeat and reads live control
 * fresh from the job row. While the job is paused or taken over, or the
 * workers are quiesced, the call blocks and polls. Cancellation and worker
 * shutdown surface as exceptions.
 */
@Component
public class LiveControlGate {

    private static final Logger log = LoggerFactory.getLogger(LiveControlGate.class);

    private final QueueService       queueService;
    private final WorkerPauseService workerPause;
    private final TelemetrySink      telemetry;
    private final int                leaseSeconds;
    private final Duration           pollInterval;

    private final AtomicBoolean stopping = new AtomicBoolean(false);

    public LiveControlGate(QueueService queueService,
                           WorkerPauseService workerPause,
                           TelemetrySink telemetry,
                           @Value("${stepwright.worker.lease-seconds:120}") int leaseSeconds,
                           @Value("${stepwright.worker.control-poll-millis:2000}") long pollMillis) {
        this.queueService = queueService;
        this.workerPause  = workerPause;
        this.telemetry    = telemetry;
        this.leaseSeconds = leaseSeconds;
        this.pollInterval = Duration.ofMillis(Math.max(10, pollMillis));
    }

    /**
     * @throws JobCancelledException   an operator asked to cancel the job
     * @throws WorkerStoppingException this worker is shutting down
     * @throws com.stepwright.orchestrator.service.JobOwnershipException the lease was lost
     */
    public ControlSnapshot checkpoint(UUID jobId, String workerId) {
        boolean holding = false;
        while (true) {
            if (stopping.get() || Thread.currentThread().isInterrupted()) {
                throw new WorkerStoppingException("Worker " + workerId + " is stopping");
            }
            Job job = queueService.heartbeat(jobId, workerId, leaseSeconds);
            if (job.isCancelRequested()) {
                throw new JobCancelledException(jobId, job.getCancelReason());
            }
            LiveControlState control = job.getLiveControl();
            boolean quiesced = workerPause.current().isQuiescing();

            if (control.isHolding() || quiesced) {
                if (!holding) {
                    holding = true;
                    log.info("Job {} held at control checkpoint (paused={}, takeover={}, quiesced={})",
                            jobId, control.isPaused(), control.isTakeover(), quiesced);
                    telemetry.info(jobId, "task.control.pause.active", holdPayload(control, quiesced));
                }
                sleep(workerId);
                continue;
            }
            if (holding) {
                log.info("Job {} released from control hold", jobId);
                telemetry.info(jobId, "task.control.pause.cleared", holdPayload(control, false));
            }
            return new ControlSnapshot(control.pendingRecovery().orElse(null), control.getRecoveryVersion());
        }
    }

    /** Makes every later checkpoint raise {@link WorkerStoppingException}. */
    public void requestStop() {
        stopping.set(true);
    }

    public boolean isStopping() {
        return stopping.get();
    }

    private void sleep(String workerId) {
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerStoppingException("Worker " + workerId + " interrupted while held", e);
        }
    }

    private static Map<String, Object> holdPayload(LiveControlState control, boolean quiesced) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("paused",         control.isPaused());
        payload.put("takeover",       control.isTakeover());
        payload.put("quiesced",       quiesced);
        payload.put("controlVersion", control.getControlVersion());
        return payload;
    }
}
