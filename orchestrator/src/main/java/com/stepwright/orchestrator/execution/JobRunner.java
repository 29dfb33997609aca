package com.stepwright.orchestrator.execution;

import com.stepwright.orchestrator.checkpoint.CheckpointIntegrityException;
import com.stepwright.orchestrator.checkpoint.CheckpointStore;
import com.stepwright.orchestrator.checkpoint.WorkspaceRebuilder;
import com.stepwright.orchestrator.checkpoint.WorkspaceReplayException;
import com.stepwright.orchestrator.executor.ExecutorException;
import com.stepwright.orchestrator.executor.Publisher;
import com.stepwright.orchestrator.executor.WorkspaceManager;
import com.stepwright.orchestrator.heal.AttemptContext;
import com.stepwright.orchestrator.heal.AttemptJournal;
import com.stepwright.orchestrator.heal.ControlSnapshot;
import com.stepwright.orchestrator.heal.JobCancelledException;
import com.stepwright.orchestrator.heal.LiveControlGate;
import com.stepwright.orchestrator.heal.RecoveryResolver;
import com.stepwright.orchestrator.heal.SelfHealConfig;
import com.stepwright.orchestrator.heal.SelfHealController;
import com.stepwright.orchestrator.heal.StepResult;
import com.stepwright.orchestrator.heal.WorkerStoppingException;
import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.model.StepCheckpoint;
import com.stepwright.orchestrator.service.JobOwnershipException;
import com.stepwright.orchestrator.service.JobStateException;
import com.stepwright.orchestrator.service.QueueService;
import com.stepwright.orchestrator.task.InvalidTaskException;
import com.stepwright.orchestrator.task.ResolvedStep;
import com.stepwright.orchestrator.task.TaskDocument;
import com.stepwright.orchestrator.task.TaskDocumentReader;
import com.stepwright.orchestrator.telemetry.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Executes one claimed job: prepare the workspace, run every step through
 * the self-heal controller, publish once, complete.
 *
 * A re-claimed job resumes at its first step without a checkpoint. Every
 * exit path leaves the job in a state another worker can act on: complete,
 * fail, cancel acknowledgement, or release.
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final QueueService       queueService;
    private final TaskDocumentReader taskReader;
    private final WorkspaceManager   workspaces;
    private final Publisher          publisher;
    private final CheckpointStore    checkpoints;
    private final WorkspaceRebuilder rebuilder;
    private final SelfHealController selfHeal;
    private final SelfHealConfig     selfHealConfig;
    private final AttemptJournal     journal;
    private final LiveControlGate    gate;
    private final RecoveryResolver   recovery;
    private final HeartbeatPump      heartbeats;
    private final TelemetrySink      telemetry;

    public JobRunner(QueueService queueService,
                     TaskDocumentReader taskReader,
                     WorkspaceManager workspaces,
                     Publisher publisher,
                     CheckpointStore checkpoints,
                     WorkspaceRebuilder rebuilder,
                     SelfHealController selfHeal,
                     SelfHealConfig selfHealConfig,
                     AttemptJournal journal,
                     LiveControlGate gate,
                     RecoveryResolver recovery,
                     HeartbeatPump heartbeats,
                     TelemetrySink telemetry) {
        this.queueService   = queueService;
        this.taskReader     = taskReader;
        this.workspaces     = workspaces;
        this.publisher      = publisher;
        this.checkpoints    = checkpoints;
        this.rebuilder      = rebuilder;
        this.selfHeal       = selfHeal;
        this.selfHealConfig = selfHealConfig;
        this.journal        = journal;
        this.gate           = gate;
        this.recovery       = recovery;
        this.heartbeats     = heartbeats;
        this.telemetry      = telemetry;
    }

    /**
     * Runs the job to an outcome. Never throws for job-level problems; those
     * end up as a queue transition.
     */
    public void run(Job job, String workerId, int leaseSeconds) {
        UUID jobId = job.getId();
        String workspaceRef = job.getWorkspaceRef() != null ? job.getWorkspaceRef() : jobId.toString();
        MDC.put("jobId", jobId.toString());
        MDC.put("workerId", workerId);
        boolean terminal = false;

        try (HeartbeatPump.Handle ignored = heartbeats.start(jobId, workerId, leaseSeconds)) {
            terminal = execute(job, workerId, workspaceRef);
        } catch (JobCancelledException e) {
            log.info("Job {} cancelled by operator, acknowledging", jobId);
            terminal = settle(jobId, () -> queueService.ackCancel(jobId, workerId, e.getMessage()));
        } catch (WorkerStoppingException e) {
            log.info("Releasing job {}: {}", jobId, e.getMessage());
            settle(jobId, () -> queueService.release(jobId, workerId, e.getMessage()));
        } catch (JobOwnershipException e) {
            log.warn("Lost ownership of job {}; stopping without a verdict: {}", jobId, e.getMessage());
        } catch (CheckpointIntegrityException e) {
            log.error("Job {} stopped on checkpoint {} (step index {}): {}",
                    jobId, e.getCheckpointId(), e.getStepIndex(), e.getMessage());
            terminal = failJob(jobId, workerId, e.getMessage(), false);
        } catch (WorkspaceReplayException | InvalidTaskException e) {
            log.error("Job {} cannot run: {}", jobId, e.getMessage());
            terminal = failJob(jobId, workerId, e.getMessage(), false);
        } catch (ExecutorException e) {
            log.error("Executor error for job {}: {}", jobId, e.getMessage(), e);
            terminal = failJob(jobId, workerId, "executor error: " + e.getMessage(), true);
        } catch (RuntimeException e) {
            log.error("Unhandled error running job {}: {}", jobId, e.getMessage(), e);
            terminal = failJob(jobId, workerId, "unhandled error: " + e.getMessage(), true);
        } finally {
            if (terminal) {
                deleteWorkspace(jobId, workspaceRef);
            }
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    /** @return true if the job reached a terminal status */
    private boolean execute(Job job, String workerId, String workspaceRef) {
        UUID jobId = job.getId();
        TaskDocument task = taskReader.read(job.getPayload());
        List<ResolvedStep> steps = job.getResolvedSteps() != null
                ? taskReader.readSteps(job.getResolvedSteps())
                : task.steps();

        // prepare
        workspaces.prepare(workspaceRef, rebuilder.baselineOf(job));
        Map<String, Object> plan = new LinkedHashMap<>();
        plan.put("stepCount", steps.size());
        plan.put("steps", steps.stream().map(ResolvedStep::stepId).toList());
        plan.put("jobAttempt", job.getAttempt());
        telemetry.info(jobId, "task.steps.plan", plan);

        int index = checkpoints.firstIncompleteStep(jobId, steps.size());
        if (index > 0) {
            int applied = rebuilder.rebuild(job, workspaceRef, index);
            Map<String, Object> resume = new LinkedHashMap<>();
            resume.put("fromStepIndex",     0);
            resume.put("toStepIndex",       index);
            resume.put("reason",            "reclaim");
            resume.put("patchesApplied",    applied);
            telemetry.info(jobId, "resume.from_step", resume);
            log.info("Job {} resumes at step {} of {}", jobId, index + 1, steps.size());
        }

        // execute
        while (true) {
            while (index < steps.size()) {
                ResolvedStep step = steps.get(index);
                MDC.put("stepId", step.stepId());
                MDC.put("stepIndex", String.valueOf(step.stepIndex()));
                telemetry.info(jobId, "step.started", Map.of(
                        "stepId",    step.stepId(),
                        "stepIndex", step.stepIndex(),
                        "stepCount", steps.size()));

                int hardResetsRemaining = Math.max(0,
                        selfHealConfig.jobMaxHardResets() - journal.hardResetsUsed(jobId));
                StepResult result = selfHeal.runStep(new AttemptContext(job, workerId, workspaceRef,
                        task.objective(), steps, step, hardResetsRemaining));
                MDC.remove("attempt");

                switch (result.kind()) {
                    case SUCCEEDED -> {
                        StepCheckpoint cp = checkpoints.record(jobId, step, result.attempt(), result.outcome());
                        telemetry.info(jobId, "step.finished", Map.of(
                                "stepId",       step.stepId(),
                                "stepIndex",    step.stepIndex(),
                                "attempt",      result.attempt(),
                                "checkpointId", cp.getId() == null ? -1L : cp.getId()));
                        index++;
                    }
                    case FAILED -> {
                        Job after = queueService.fail(jobId, workerId, result.failureMessage(), result.retryable());
                        return after.getStatus().isTerminal();
                    }
                    case REWIND -> {
                        log.info("Job {} rewinding from step {} to step {}",
                                jobId, step.stepId(), steps.get(result.rewindTo()).stepId());
                        rebuilder.rebuild(job, workspaceRef, result.rewindTo());
                        index = result.rewindTo();
                    }
                }
            }
            MDC.remove("stepId");
            MDC.remove("stepIndex");

            // Last chance for an operator to send the job back before publishing.
            ControlSnapshot control = gate.checkpoint(jobId, workerId);
            if (control.pendingRecovery().isPresent()) {
                RecoveryResolver.Resolution resolution =
                        recovery.resolve(job, workerId, steps, steps.size(), control);
                if (resolution.kind() == RecoveryResolver.Kind.REWIND) {
                    rebuilder.rebuild(job, workspaceRef, resolution.targetIndex());
                    index = resolution.targetIndex();
                    continue;
                }
            }
            break;
        }

        // publish
        String published = null;
        if (queueService.markPublished(jobId, workerId)) {
            try {
                published = publisher.publish(job, workspaceRef);
            } catch (RuntimeException e) {
                log.error("Publish failed for job {}: {}", jobId, e.getMessage(), e);
                // Already marked published, so a retry must not publish again.
                return failJob(jobId, workerId, "publish failed: " + e.getMessage(), false);
            }
            telemetry.info(jobId, "publish.finished", Map.of("ref", String.valueOf(published)));
        } else {
            telemetry.info(jobId, "publish.finished", Map.of("skipped", true));
        }

        // done
        String summary = "Completed " + steps.size() + " step(s)"
                + (published == null ? "" : "; published " + published);
        queueService.complete(jobId, workerId, summary);
        return true;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private boolean failJob(UUID jobId, String workerId, String message, boolean retryable) {
        try {
            return queueService.fail(jobId, workerId, message, retryable).getStatus().isTerminal();
        } catch (JobOwnershipException | JobStateException e) {
            log.warn("Could not record failure of job {}: {}", jobId, e.getMessage());
            return false;
        }
    }

    private boolean settle(UUID jobId, Runnable transition) {
        try {
            transition.run();
            return true;
        } catch (JobOwnershipException | JobStateException e) {
            log.warn("Could not settle job {}: {}", jobId, e.getMessage());
            return false;
        }
    }

    private void deleteWorkspace(UUID jobId, String workspaceRef) {
        try {
            workspaces.delete(workspaceRef);
        } catch (RuntimeException e) {
            log.warn("Could not delete workspace {} for job {}; manual cleanup may be needed: {}",
                    workspaceRef, jobId, e.getMessage());
        }
    }
}
