package com.stepwright.orchestrator.heal;

import com.stepwright.orchestrator.checkpoint.CheckpointStore;
import com.stepwright.orchestrator.checkpoint.ContentHash;
import com.stepwright.orchestrator.checkpoint.WorkspaceRebuilder;
import com.stepwright.orchestrator.executor.StepInvocation;
import com.stepwright.orchestrator.executor.StepOutcome;
import com.stepwright.orchestrator.executor.StepRuntime;
import com.stepwright.orchestrator.model.AttemptRecord;
import com.stepwright.orchestrator.model.FailureClass;
import com.stepwright.orchestrator.model.SelfHealStrategy;
import com.stepwright.orchestrator.model.StepCheckpoint;
import com.stepwright.orchestrator.task.InstructionComposer;
import com.stepwright.orchestrator.task.ResolvedStep;
import com.stepwright.orchestrator.task.RetryContext;
import com.stepwright.orchestrator.telemetry.SecretScrubber;
import com.stepwright.orchestrator.telemetry.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives the attempts of one step until it succeeds, fails for good, or an
 * operator sends the job elsewhere.
 *
 * Each iteration: control checkpoint, apply the pending strategy (or the
 * operator's override), run one supervised attempt, then classify a failure
 * and pick the next strategy. Budgets:
 * <ul>
 *   <li>window attempts, reset by a hard reset or operator retry;</li>
 *   <li>job-wide automatic hard resets, counted from attempt records;</li>
 *   <li>the queue attempt budget, only consulted when everything else is spent.</li>
 * </ul>
 */
@Component
public class SelfHealController {

    private static final Logger log = LoggerFactory.getLogger(SelfHealController.class);

    static final int MAX_SUMMARY_CHARS = 600;

    private final SelfHealConfig      config;
    private final FailureClassifier   classifier;
    private final StrategySelector    selector;
    private final AttemptSupervisor   supervisor;
    private final StepRuntime         runtime;
    private final LiveControlGate     gate;
    private final RecoveryResolver    recovery;
    private final AttemptJournal      journal;
    private final WorkspaceRebuilder  rebuilder;
    private final CheckpointStore     checkpoints;
    private final InstructionComposer composer;
    private final SecretScrubber      scrubber;
    private final TelemetrySink       telemetry;

    public SelfHealController(SelfHealConfig config,
                              AttemptSupervisor supervisor,
                              StepRuntime runtime,
                              LiveControlGate gate,
                              RecoveryResolver recovery,
                              AttemptJournal journal,
                              WorkspaceRebuilder rebuilder,
                              CheckpointStore checkpoints,
                              InstructionComposer composer,
                              SecretScrubber scrubber,
                              TelemetrySink telemetry) {
        this.config      = config;
        this.classifier  = new FailureClassifier(config.noProgressLimit());
        this.selector    = new StrategySelector(config);
        this.supervisor  = supervisor;
        this.runtime     = runtime;
        this.gate        = gate;
        this.recovery    = recovery;
        this.journal     = journal;
        this.rebuilder   = rebuilder;
        this.checkpoints = checkpoints;
        this.composer    = composer;
        this.scrubber    = scrubber;
        this.telemetry   = telemetry;
    }

    /**
     * @throws JobCancelledException   cancellation observed at a checkpoint
     * @throws WorkerStoppingException the worker is shutting down
     */
    public StepResult runStep(AttemptContext ctx) {
        UUID jobId = ctx.job().getId();
        ResolvedStep step = ctx.step();

        StepAttemptState state = new StepAttemptState();
        int attempt = journal.nextAttemptNumber(jobId, step.stepIndex());
        int hardResetsUsed = 0;

        StrategySelector.Decision pending = null;
        AttemptRecord lastRecord = null;
        String lastFailureMessage = null;
        RetryContext retry = null;

        while (true) {
            ControlSnapshot control = gate.checkpoint(jobId, ctx.workerId());

            boolean overridden = false;
            if (control.pendingRecovery().isPresent()) {
                RecoveryResolver.Resolution resolution =
                        recovery.resolve(ctx.job(), ctx.workerId(), ctx.steps(), step.stepIndex(), control);
                switch (resolution.kind()) {
                    case REWIND -> {
                        if (lastRecord != null) journal.overrideStrategy(lastRecord, SelfHealStrategy.OPERATOR_REQUEST);
                        return StepResult.rewind(resolution.targetIndex(), hardResetsUsed);
                    }
                    case REBUILD_CURRENT -> {
                        rebuilder.rebuild(ctx.job(), ctx.workspaceRef(), step.stepIndex());
                        state.openWindow();
                        overridden = true;
                    }
                    case RETRY_CURRENT -> {
                        state.openWindow();
                        overridden = true;
                    }
                    case REJECTED -> { }
                }
                if (overridden && lastRecord != null) {
                    journal.overrideStrategy(lastRecord, SelfHealStrategy.OPERATOR_REQUEST);
                }
            }

            if (!overridden && pending != null) {
                if (!pending.retryStep()) {
                    return StepResult.failed(lastFailureMessage, pending.retryable(), hardResetsUsed);
                }
                if (pending.strategy() == SelfHealStrategy.HARD_RESET) {
                    log.warn("Hard reset of job {} before step {} (attempt {})", jobId, step.stepId(), attempt);
                    rebuilder.rebuild(ctx.job(), ctx.workspaceRef(), step.stepIndex());
                    hardResetsUsed++;
                    state.openWindow();
                }
            }
            pending = null;

            // ---- one attempt ----
            state.beginAttempt();
            MDC.put("attempt", String.valueOf(attempt));
            AttemptRecord record = journal.start(jobId, step, attempt, ctx.workerId());
            telemetry.info(jobId, "step.attempt.started", Map.of(
                    "stepId",         step.stepId(),
                    "stepIndex",      step.stepIndex(),
                    "attempt",        attempt,
                    "windowAttempt",  state.windowAttempts(),
                    "retry",          retry != null));

            StepInvocation invocation = new StepInvocation(jobId, ctx.workspaceRef(), step, ctx.stepCount(),
                    attempt, composer.compose(ctx.objective(), step, ctx.stepCount(), retry), retry);

            SupervisedRun run;
            try {
                run = supervisor.run(runtime, invocation, config.stepTimeout(), config.idleTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                journal.finishInterrupted(record, "worker interrupted during attempt");
                throw new WorkerStoppingException("Interrupted during attempt " + attempt
                        + " of step " + step.stepId(), e);
            }

            StepOutcome outcome = run.effectiveOutcome();
            Optional<String> violation = run.completedNormally()
                    ? classifier.contractViolation(outcome)
                    : Optional.empty();

            if (run.completedNormally() && outcome.succeeded() && violation.isEmpty()) {
                journal.finishSucceeded(record, run, outcome);
                telemetry.recordAttempt(null, SelfHealStrategy.NONE, "succeeded");
                telemetry.recordStepDuration(run.elapsed(), "succeeded");
                telemetry.info(jobId, "step.attempt.finished", Map.of(
                        "stepId",           step.stepId(),
                        "attempt",          attempt,
                        "wallClockSeconds", run.elapsed().toSeconds(),
                        "changedFiles",     outcome.changedFiles()));
                return StepResult.succeeded(outcome, attempt, hardResetsUsed);
            }

            // ---- failure ----
            if (!run.terminated()) {
                terminateQuietly(invocation);
            }
            if (run.trip() != WatchdogTrip.NONE) {
                telemetry.recordWatchdogTrip(run.trip().wireName());
                telemetry.warn(jobId, "step.watchdog.tripped", Map.of(
                        "stepId",           step.stepId(),
                        "attempt",          attempt,
                        "kind",             run.trip().wireName(),
                        "wallClockSeconds", run.elapsed().toSeconds(),
                        "idleSeconds",      run.longestIdle().toSeconds()));
            }

            String message = violation.map(v -> "result contract violated: " + v)
                    .orElseGet(() -> describe(outcome));
            FailureSignature signature = FailureSignature.of(step.stepId(), step.skillId(),
                    outcome.exitCode(), outcome.failureHint(), message, scrubber);
            String diffHash = ContentHash.sha256Hex(outcome.diff());
            boolean repeated = state.recordFailure(signature.fingerprint(), diffHash);
            FailureClass cls = classifier.classify(outcome, violation, run.trip(), repeated,
                    state.consecutiveNoProgress());
            int hardResetsRemaining = Math.max(0, ctx.hardResetsRemaining() - hardResetsUsed);
            StrategySelector.Decision decision = selector.select(cls, state, hardResetsRemaining,
                    ctx.job().getAttempt(), ctx.job().getMaxAttempts());

            String summary = summarize(attempt, cls, message, outcome.changedFiles());
            record = journal.finishFailed(record, run, outcome, cls, signature, decision.strategy(), summary, state);

            telemetry.recordAttempt(cls, decision.strategy(), "failed");
            telemetry.recordStepDuration(run.elapsed(), "failed");

            Map<String, Object> failed = new LinkedHashMap<>();
            failed.put("stepId",                step.stepId());
            failed.put("attempt",               attempt);
            failed.put("failureClass",          cls.wireName());
            failed.put("signatureHash",         signature.fingerprint());
            failed.put("repeated",              repeated);
            failed.put("consecutiveNoProgress", state.consecutiveNoProgress());
            failed.put("watchdog",              run.trip().wireName());
            failed.put("attemptRecordId",       record.getId());
            telemetry.warn(jobId, "step.attempt.failed", failed);

            Map<String, Object> heal = new LinkedHashMap<>();
            heal.put("stepId",              step.stepId());
            heal.put("attempt",             attempt);
            heal.put("failureClass",        cls.wireName());
            heal.put("strategy",            decision.strategy().wireName());
            heal.put("windowAttempts",      state.windowAttempts());
            heal.put("hardResetsRemaining", hardResetsRemaining);
            if (decision.retryStep()) {
                log.warn("Step {} attempt {} failed ({}), next: {}",
                        step.stepId(), attempt, cls.wireName(), decision.strategy().wireName());
                telemetry.info(jobId, "self_heal.triggered", heal);
            } else {
                heal.put("retryable", decision.retryable());
                log.error("Step {} attempt {} failed ({}), self-heal exhausted, strategy {}",
                        step.stepId(), attempt, cls.wireName(), decision.strategy().wireName());
                telemetry.recordExhausted(cls);
                telemetry.error(jobId, "self_heal.exhausted", heal);
            }

            lastFailureMessage = failureMessage(ctx, attempt, cls, decision.strategy(), signature, record);
            lastRecord = record;
            retry = new RetryContext(summary, diffHash, outcome.changedFiles());
            pending = decision;
            attempt++;
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void terminateQuietly(StepInvocation invocation) {
        try {
            runtime.terminate(invocation);
        } catch (RuntimeException e) {
            log.warn("Terminating runtime after failed attempt {} of step {} failed: {}",
                    invocation.attempt(), invocation.step().stepId(), e.getMessage());
        }
    }

    private static String describe(StepOutcome outcome) {
        if (outcome.errorMessage() != null && !outcome.errorMessage().isBlank()) {
            return outcome.errorMessage();
        }
        if (outcome.exitCode() != null) {
            return "runtime exited with code " + outcome.exitCode();
        }
        return "runtime reported failure without a message";
    }

    /** One scrubbed paragraph for the next attempt's instruction. */
    String summarize(int attempt, FailureClass cls, String message, List<String> changedFiles) {
        String files = changedFiles.isEmpty() ? "none" : String.join(", ", changedFiles);
        String text = ("Attempt " + attempt + " failed (" + cls.wireName() + "): " + message
                + " Changed files: " + files + ".").replaceAll("\\s+", " ").strip();
        text = scrubber.scrub(text);
        return text.length() > MAX_SUMMARY_CHARS ? text.substring(0, MAX_SUMMARY_CHARS - 3) + "..." : text;
    }

    private String failureMessage(AttemptContext ctx, int attempt, FailureClass cls, SelfHealStrategy strategy,
                                  FailureSignature signature, AttemptRecord record) {
        UUID jobId = ctx.job().getId();
        Entry<Integer, StepCheckpoint> lastCheckpoint = checkpoints.latestByIndex(jobId).lastEntry();
        String sig = signature.normalized();
        if (sig.length() > 300) sig = sig.substring(0, 300) + "...";
        return "step " + ctx.step().stepId() + " failed after attempt " + attempt
                + ": class=" + cls.wireName()
                + " strategy=" + strategy.wireName()
                + " signature=\"" + sig + "\""
                + " attemptRecord=" + record.getId()
                + " attemptArtifact=" + AttemptJournal.artifactPath(jobId, ctx.step().stepIndex(), attempt)
                + " lastCheckpoint=" + (lastCheckpoint == null ? "none" : lastCheckpoint.getValue().getId());
    }
}
