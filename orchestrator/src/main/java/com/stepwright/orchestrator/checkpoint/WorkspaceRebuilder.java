package com.stepwright.orchestrator.checkpoint;

import com.stepwright.orchestrator.executor.Baseline;
import com.stepwright.orchestrator.executor.ExecutorException;
import com.stepwright.orchestrator.executor.WorkspaceManager;
import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.model.StepCheckpoint;
import com.stepwright.orchestrator.task.TaskDocument;
import com.stepwright.orchestrator.task.TaskDocumentReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.NavigableMap;

/**
 * Hard reset / resume: rebuild a job's workspace from its baseline plus the
 * checkpoints of every step before the target.
 *
 * Each patch is hashed and compared to the checkpoint's diff_hash before it
 * is applied. A mismatch aborts the rebuild with
 * {@link CheckpointIntegrityException}; it is never skipped.
 * Running the same rebuild twice yields the same workspace.
 */
@Component
public class WorkspaceRebuilder {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceRebuilder.class);

    private final WorkspaceManager   workspaces;
    private final CheckpointStore    checkpoints;
    private final TaskDocumentReader tasks;

    public WorkspaceRebuilder(WorkspaceManager workspaces,
                              CheckpointStore checkpoints,
                              TaskDocumentReader tasks) {
        this.workspaces  = workspaces;
        this.checkpoints = checkpoints;
        this.tasks       = tasks;
    }

    public Baseline baselineOf(Job job) {
        TaskDocument doc = tasks.read(job.getPayload());
        return new Baseline(doc.repository(), doc.baseRef());
    }

    /**
     * Reset the workspace to the baseline, then replay the newest checkpoint
     * of every step index below {@code upToStepIndex}, in index order.
     *
     * @return number of patches applied (empty patches are verified but not applied)
     */
    public int rebuild(Job job, String workspaceRef, int upToStepIndex) {
        NavigableMap<Integer, StepCheckpoint> latest = checkpoints.latestByIndex(job.getId());
        for (int i = 0; i < upToStepIndex; i++) {
            if (!latest.containsKey(i)) {
                throw new WorkspaceReplayException("Job " + job.getId() + " has no checkpoint for step index "
                        + i + "; cannot rebuild up to step index " + upToStepIndex);
            }
        }

        log.info("Rebuilding workspace '{}' for job {} up to step index {}", workspaceRef, job.getId(), upToStepIndex);
        try {
            workspaces.reset(workspaceRef, baselineOf(job));
        } catch (ExecutorException e) {
            throw new WorkspaceReplayException("Could not reset workspace " + workspaceRef + " to baseline", e);
        }

        int applied = 0;
        for (StepCheckpoint cp : latest.headMap(upToStepIndex, false).values()) {
            byte[] patch = checkpoints.readPatch(cp);
            String actual = ContentHash.sha256Hex(patch);
            if (!actual.equals(cp.getDiffHash())) {
                log.error("CHECKPOINT INTEGRITY FAILURE job={} checkpoint={} step={} (index {}) expected={} actual={}",
                        job.getId(), cp.getId(), cp.getStepId(), cp.getStepIndex(), cp.getDiffHash(), actual);
                long checkpointId = cp.getId() == null ? -1L : cp.getId();
                throw new CheckpointIntegrityException(checkpointId, cp.getStepIndex(), cp.getDiffHash(), actual);
            }
            if (patch.length == 0) {
                log.debug("Checkpoint {} (step {}) has an empty patch; nothing to apply", cp.getId(), cp.getStepId());
                continue;
            }
            try {
                workspaces.applyPatch(workspaceRef, new String(patch, StandardCharsets.UTF_8));
            } catch (ExecutorException e) {
                throw new WorkspaceReplayException("Patch of checkpoint " + cp.getId() + " (step "
                        + cp.getStepId() + ") did not apply", e);
            }
            applied++;
        }
        log.info("Workspace '{}' rebuilt: {} patch(es) applied", workspaceRef, applied);
        return applied;
    }
}
