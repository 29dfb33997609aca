package com.stepwright.orchestrator.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwright.orchestrator.executor.StepOutcome;
import com.stepwright.orchestrator.model.StepCheckpoint;
import com.stepwright.orchestrator.repository.StepCheckpointRepository;
import com.stepwright.orchestrator.task.ResolvedStep;
import com.stepwright.orchestrator.telemetry.TelemetrySink;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Persists and reads step checkpoints.
 *
 * Each successful step produces an artifact pair plus a DB row:
 * <pre>
 *   {jobId}/checkpoints/step-0001/attempt-0002.patch   raw diff
 *   {jobId}/checkpoints/step-0001/attempt-0002.json    checkpoint fields
 * </pre>
 * Step and attempt numbers in paths are 1-based and zero-padded.
 */
@Component
public class CheckpointStore {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final StepCheckpointRepository checkpoints;
    private final ArtifactStorage          storage;
    private final TelemetrySink            telemetry;
    private final ObjectMapper             json;
    private final Clock                    clock;

    public CheckpointStore(StepCheckpointRepository checkpoints,
                           ArtifactStorage storage,
                           TelemetrySink telemetry,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.checkpoints = checkpoints;
        this.storage     = storage;
        this.telemetry   = telemetry;
        this.json        = objectMapper;
        this.clock       = clock;
    }

    // ------------------------------------------------------------------
    // Write
    // ------------------------------------------------------------------

    public StepCheckpoint record(UUID jobId, ResolvedStep step, int attempt, StepOutcome outcome) {
        byte[] patch = outcome.diff().getBytes(StandardCharsets.UTF_8);
        String diffHash = ContentHash.sha256Hex(patch);
        List<String> changedFiles = dedupe(outcome.changedFiles());
        String summary = telemetry.scrub(outcome.summary());
        Instant finishedAt = clock.instant();

        String base = "%s/checkpoints/step-%04d/attempt-%04d".formatted(jobId, step.stepIndex() + 1, attempt);
        String patchPath    = base + ".patch";
        String metadataPath = base + ".json";

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("jobId",        jobId.toString());
        metadata.put("stepId",       step.stepId());
        metadata.put("stepIndex",    step.stepIndex());
        metadata.put("attempt",      attempt);
        metadata.put("diffHash",     diffHash);
        metadata.put("changedFiles", changedFiles);
        metadata.put("summary",      summary);
        metadata.put("finishedAt",   finishedAt.toString());

        storage.write(patchPath, patch);
        storage.write(metadataPath, toJsonBytes(metadata));

        StepCheckpoint saved = checkpoints.save(new StepCheckpoint(jobId, step.stepId(), step.stepIndex(),
                attempt, diffHash, toJson(changedFiles), summary, patchPath, metadataPath, finishedAt));

        telemetry.info(jobId, "checkpoint.recorded", Map.of(
                "stepId",       step.stepId(),
                "stepIndex",    step.stepIndex(),
                "attempt",      attempt,
                "checkpointId", saved.getId() == null ? -1L : saved.getId(),
                "diffHash",     diffHash,
                "changedFiles", changedFiles));
        return saved;
    }

    // ------------------------------------------------------------------
    // Read
    // ------------------------------------------------------------------

    /** Newest checkpoint per step index, ordered by index. */
    public NavigableMap<Integer, StepCheckpoint> latestByIndex(UUID jobId) {
        NavigableMap<Integer, StepCheckpoint> latest = new TreeMap<>();
        for (StepCheckpoint cp : checkpoints.findByJobIdOrderByStepIndexAscIdAsc(jobId)) {
            latest.put(cp.getStepIndex(), cp);
        }
        return latest;
    }

    /** First step index in [0, stepCount) without a checkpoint; stepCount if all have one. */
    public int firstIncompleteStep(UUID jobId, int stepCount) {
        NavigableMap<Integer, StepCheckpoint> latest = latestByIndex(jobId);
        for (int i = 0; i < stepCount; i++) {
            if (!latest.containsKey(i)) return i;
        }
        return stepCount;
    }

    /** True if every index below {@code stepIndex} has a checkpoint, i.e. the step can be rebuilt to. */
    public boolean canRebuildTo(UUID jobId, int stepIndex) {
        return firstIncompleteStep(jobId, stepIndex) >= stepIndex;
    }

    public byte[] readPatch(StepCheckpoint checkpoint) {
        return storage.read(checkpoint.getPatchPath());
    }

    public List<String> changedFiles(StepCheckpoint checkpoint) {
        try {
            return json.readValue(checkpoint.getChangedFiles(), STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new ArtifactStorageException("Checkpoint " + checkpoint.getId() + " has corrupt changed_files", e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static List<String> dedupe(List<String> files) {
        LinkedHashSet<String> ordered = new LinkedHashSet<>();
        for (String f : files) {
            if (f != null && !f.isBlank()) ordered.add(f.strip());
        }
        return new ArrayList<>(ordered);
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ArtifactStorageException("Could not serialize checkpoint data", e);
        }
    }

    private byte[] toJsonBytes(Object value) {
        return toJson(value).getBytes(StandardCharsets.UTF_8);
    }
}
