package com.stepwright.orchestrator.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwright.orchestrator.TestJobs;
import com.stepwright.orchestrator.executor.Baseline;
import com.stepwright.orchestrator.executor.StepOutcome;
import com.stepwright.orchestrator.executor.WorkspaceManager;
import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.model.StepCheckpoint;
import com.stepwright.orchestrator.repository.StepCheckpointRepository;
import com.stepwright.orchestrator.task.ResolvedStep;
import com.stepwright.orchestrator.task.TaskDocumentReader;
import com.stepwright.orchestrator.telemetry.TelemetrySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

/**
 * Rebuild tests against real checkpoint artifacts on disk and an in-memory
 * workspace that records what was reset and applied.
 */
@ExtendWith(MockitoExtension.class)
class WorkspaceRebuilderTest {

    @Mock StepCheckpointRepository repo;
    @Mock TelemetrySink            telemetry;
    @TempDir Path                  root;

    final List<StepCheckpoint> saved = new ArrayList<>();
    final AtomicLong           ids   = new AtomicLong();

    RecordingWorkspace workspace;
    CheckpointStore    store;
    WorkspaceRebuilder rebuilder;
    Job                job;

    /** Workspace state is the baseline plus the list of patches applied since the last reset. */
    static class RecordingWorkspace implements WorkspaceManager {
        Baseline     baseline;
        int          resets;
        List<String> applied = new ArrayList<>();

        @Override public void prepare(String ref, Baseline baseline) { this.baseline = baseline; }

        @Override public void reset(String ref, Baseline baseline) {
            this.baseline = baseline;
            this.applied = new ArrayList<>();
            resets++;
        }

        @Override public void applyPatch(String ref, String patch) { applied.add(patch); }

        @Override public void delete(String ref) { }
    }

    @BeforeEach
    void setUp() {
        store = new CheckpointStore(repo, new FilesystemArtifactStorage(root), telemetry, new ObjectMapper(),
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
        workspace = new RecordingWorkspace();
        TaskDocumentReader tasks = new TaskDocumentReader(new ObjectMapper());
        rebuilder = new WorkspaceRebuilder(workspace, store, tasks);
        job = TestJobs.running(TestJobs.THREE_STEP_PAYLOAD, "w1", Instant.now().plusSeconds(60));

        lenient().when(telemetry.scrub(any())).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(repo.save(any(StepCheckpoint.class))).thenAnswer(inv -> {
            StepCheckpoint cp = inv.getArgument(0);
            ReflectionTestUtils.setField(cp, "id", ids.incrementAndGet());
            saved.add(cp);
            return cp;
        });
        lenient().when(repo.findByJobIdOrderByStepIndexAscIdAsc(job.getId())).thenAnswer(inv -> List.copyOf(saved));
    }

    private StepCheckpoint checkpoint(int stepIndex, int attempt, String diff) {
        ResolvedStep step = new ResolvedStep(stepIndex, "step-" + (stepIndex + 1), null, null, "auto");
        return store.record(job.getId(), step, attempt, StepOutcome.success("done", diff, List.of("f" + stepIndex)));
    }

    @Test
    void rebuild_replaysOnlyCheckpointsBelowTarget_inOrder() {
        checkpoint(0, 1, "patch-0");
        checkpoint(1, 1, "patch-1");
        checkpoint(2, 1, "patch-2");

        int applied = rebuilder.rebuild(job, job.getWorkspaceRef(), 2);

        assertThat(applied).isEqualTo(2);
        assertThat(workspace.applied).containsExactly("patch-0", "patch-1");
        assertThat(workspace.baseline).isEqualTo(new Baseline("https://github.com/acme/app.git", "main"));
    }

    @Test
    void rebuild_usesNewestCheckpointOfAStep() {
        checkpoint(0, 1, "old-patch-0");
        checkpoint(0, 3, "new-patch-0");

        rebuilder.rebuild(job, job.getWorkspaceRef(), 1);

        assertThat(workspace.applied).containsExactly("new-patch-0");
    }

    @Test
    void rebuild_twice_sameWorkspace() {
        checkpoint(0, 1, "patch-0");
        checkpoint(1, 2, "patch-1");

        rebuilder.rebuild(job, job.getWorkspaceRef(), 2);
        List<String> first = List.copyOf(workspace.applied);
        rebuilder.rebuild(job, job.getWorkspaceRef(), 2);

        assertThat(workspace.applied).isEqualTo(first);
        assertThat(workspace.resets).isEqualTo(2);
    }

    @Test
    void rebuild_toFirstStep_onlyResets() {
        checkpoint(0, 1, "patch-0");

        assertThat(rebuilder.rebuild(job, job.getWorkspaceRef(), 0)).isZero();
        assertThat(workspace.resets).isEqualTo(1);
        assertThat(workspace.applied).isEmpty();
    }

    @Test
    void rebuild_emptyPatch_verifiedButNotApplied() {
        checkpoint(0, 1, "");
        checkpoint(1, 1, "patch-1");

        assertThat(rebuilder.rebuild(job, job.getWorkspaceRef(), 2)).isEqualTo(1);
        assertThat(workspace.applied).containsExactly("patch-1");
    }

    @Test
    void rebuild_tamperedPatch_failsLoudlyBeforeApplying() throws Exception {
        checkpoint(0, 1, "patch-0");
        StepCheckpoint tampered = checkpoint(1, 1, "patch-1");
        new FilesystemArtifactStorage(root).write(tampered.getPatchPath(),
                "patch-1 plus something else".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> rebuilder.rebuild(job, job.getWorkspaceRef(), 2))
                .isInstanceOfSatisfying(CheckpointIntegrityException.class, e -> {
                    assertThat(e.getCheckpointId()).isEqualTo(tampered.getId());
                    assertThat(e.getStepIndex()).isEqualTo(1);
                });
        assertThat(workspace.applied).containsExactly("patch-0");
    }

    @Test
    void rebuild_missingEarlierCheckpoint_rejectedBeforeReset() {
        checkpoint(0, 1, "patch-0");
        checkpoint(2, 1, "patch-2");

        assertThatThrownBy(() -> rebuilder.rebuild(job, job.getWorkspaceRef(), 3))
                .isInstanceOf(WorkspaceReplayException.class)
                .hasMessageContaining("step index 1");
        assertThat(workspace.resets).isZero();
    }

    @Test
    void baselineOf_defaultsRefToMain() {
        Job noRef = TestJobs.queued("{\"repository\":\"acme/lib\",\"task\":{\"instructions\":\"x\"}}");

        assertThat(rebuilder.baselineOf(noRef)).isEqualTo(new Baseline("acme/lib", "main"));
    }
}
