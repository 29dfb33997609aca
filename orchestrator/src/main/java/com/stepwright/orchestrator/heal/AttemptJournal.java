package com.stepwright.orchestrator.heal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwright.orchestrator.checkpoint.ArtifactStorage;
import com.stepwright.orchestrator.checkpoint.ArtifactStorageException;
import com.stepwright.orchestrator.checkpoint.ContentHash;
import com.stepwright.orchestrator.executor.StepOutcome;
import com.stepwright.orchestrator.model.AttemptOutcome;
import com.stepwright.orchestrator.model.AttemptRecord;
import com.stepwright.orchestrator.model.FailureClass;
import com.stepwright.orchestrator.model.SelfHealStrategy;
import com.stepwright.orchestrator.repository.AttemptRecordRepository;
import com.stepwright.orchestrator.task.ResolvedStep;
import com.stepwright.orchestrator.telemetry.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Durable history of step attempts: one {@link AttemptRecord} row per attempt,
 * plus a JSON snapshot of the self-heal state after each finished attempt at
 * {@code {jobId}/attempts/attempt-{step}-{attempt}.json}.
 */
@Component
public class AttemptJournal {

    private static final Logger log = LoggerFactory.getLogger(AttemptJournal.class);

    private final AttemptRecordRepository attempts;
    private final ArtifactStorage         storage;
    private final TelemetrySink           telemetry;
    private final ObjectMapper            json;
    private final Clock                   clock;

    public AttemptJournal(AttemptRecordRepository attempts,
                          ArtifactStorage storage,
                          TelemetrySink telemetry,
                          ObjectMapper objectMapper,
                          Clock clock) {
        this.attempts  = attempts;
        this.storage   = storage;
        this.telemetry = telemetry;
        this.json      = objectMapper;
        this.clock     = clock;
    }

    /** Attempt numbers continue across windows and claims. */
    public int nextAttemptNumber(UUID jobId, int stepIndex) {
        return attempts.findMaxAttempt(jobId, stepIndex) + 1;
    }

    public int hardResetsUsed(UUID jobId) {
        return (int) attempts.countByJobIdAndStrategy(jobId, SelfHealStrategy.HARD_RESET);
    }

    public AttemptRecord start(UUID jobId, ResolvedStep step, int attempt, String workerId) {
        return attempts.save(new AttemptRecord(jobId, step.stepId(), step.stepIndex(),
                attempt, workerId, clock.instant()));
    }

    public AttemptRecord finishSucceeded(AttemptRecord record, SupervisedRun run, StepOutcome outcome) {
        record.setOutcome(AttemptOutcome.SUCCEEDED);
        record.setStrategy(SelfHealStrategy.NONE);
        record.setSummary(telemetry.scrub(outcome.summary()));
        fill(record, run, outcome);
        AttemptRecord saved = attempts.save(record);
        writeArtifact(saved, null);
        return saved;
    }

    public AttemptRecord finishFailed(AttemptRecord record, SupervisedRun run, StepOutcome outcome,
                                      FailureClass cls, FailureSignature signature,
                                      SelfHealStrategy strategy, String summary, StepAttemptState state) {
        record.setOutcome(AttemptOutcome.FAILED);
        record.setFailureClass(cls);
        record.setFailureSignature(signature.normalized());
        record.setSignatureHash(signature.fingerprint());
        record.setStrategy(strategy);
        record.setSummary(summary);
        fill(record, run, outcome);
        AttemptRecord saved = attempts.save(record);
        writeArtifact(saved, state);
        return saved;
    }

    /** The worker stopped mid-attempt; the attempt has no verdict. */
    public AttemptRecord finishInterrupted(AttemptRecord record, String reason) {
        record.setOutcome(AttemptOutcome.INTERRUPTED);
        record.setSummary(telemetry.scrub(reason));
        record.setFinishedAt(clock.instant());
        return attempts.save(record);
    }

    /** An operator request replaced the strategy computed for this attempt. */
    public AttemptRecord overrideStrategy(AttemptRecord record, SelfHealStrategy strategy) {
        record.setStrategy(strategy);
        return attempts.save(record);
    }

    public static String artifactPath(UUID jobId, int stepIndex, int attempt) {
        return "%s/attempts/attempt-%04d-%04d.json".formatted(jobId, stepIndex + 1, attempt);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void fill(AttemptRecord record, SupervisedRun run, StepOutcome outcome) {
        record.setWallClockSeconds(run.elapsed().toMillis() / 1000.0);
        record.setIdleSeconds(run.longestIdle().toMillis() / 1000.0);
        record.setDiffHash(ContentHash.sha256Hex(outcome.diff()));
        record.setChangedFiles(toJson(outcome.changedFiles()));
        record.setFinishedAt(clock.instant());
    }

    private void writeArtifact(AttemptRecord record, StepAttemptState state) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("attemptRecordId", record.getId());
        body.put("jobId",           record.getJobId().toString());
        body.put("stepId",          record.getStepId());
        body.put("stepIndex",       record.getStepIndex());
        body.put("attempt",         record.getAttempt());
        body.put("outcome",         record.getOutcome().name().toLowerCase(Locale.ROOT));
        body.put("failureClass",    record.getFailureClass() == null ? null : record.getFailureClass().wireName());
        body.put("strategy",        record.getStrategy() == null ? null : record.getStrategy().wireName());
        body.put("signatureHash",   record.getSignatureHash());
        body.put("diffHash",        record.getDiffHash());
        body.put("wallClockSeconds", record.getWallClockSeconds());
        body.put("idleSeconds",     record.getIdleSeconds());
        if (state != null) {
            body.put("windowAttempts",        state.windowAttempts());
            body.put("consecutiveNoProgress", state.consecutiveNoProgress());
        }
        try {
            storage.write(artifactPath(record.getJobId(), record.getStepIndex(), record.getAttempt()),
                    json.writeValueAsBytes(body));
        } catch (JsonProcessingException | ArtifactStorageException e) {
            // Best effort; the row is authoritative.
            log.warn("Could not write attempt artifact for job {} step {} attempt {}: {}",
                    record.getJobId(), record.getStepId(), record.getAttempt(), e.getMessage());
        }
    }

    private String toJson(List<String> values) {
        try {
            return json.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize changed files", e);
        }
    }
}
