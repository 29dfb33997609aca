package com.stepwright.orchestrator.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwright.orchestrator.TestJobs;
import com.stepwright.orchestrator.checkpoint.CheckpointIntegrityException;
import com.stepwright.orchestrator.checkpoint.CheckpointStore;
import com.stepwright.orchestrator.checkpoint.WorkspaceRebuilder;
import com.stepwright.orchestrator.executor.Baseline;
import com.stepwright.orchestrator.executor.ExecutorException;
import com.stepwright.orchestrator.executor.Publisher;
import com.stepwright.orchestrator.executor.StepOutcome;
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
import com.stepwright.orchestrator.model.JobStatus;
import com.stepwright.orchestrator.model.RecoveryAction;
import com.stepwright.orchestrator.model.RecoveryRequest;
import com.stepwright.orchestrator.model.StepCheckpoint;
import com.stepwright.orchestrator.service.JobOwnershipException;
import com.stepwright.orchestrator.service.QueueService;
import com.stepwright.orchestrator.task.TaskDocumentReader;
import com.stepwright.orchestrator.telemetry.TelemetrySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the JobRunner state machine. The self-heal controller is
 * mocked, so each test scripts step results directly.
 */
@ExtendWith(MockitoExtension.class)
class JobRunnerTest {

    static final String WORKER = "w1";

    @Mock QueueService       queueService;
    @Mock WorkspaceManager   workspaces;
    @Mock Publisher          publisher;
    @Mock CheckpointStore    checkpoints;
    @Mock WorkspaceRebuilder rebuilder;
    @Mock SelfHealController selfHeal;
    @Mock AttemptJournal     journal;
    @Mock LiveControlGate    gate;
    @Mock RecoveryResolver   recovery;
    @Mock HeartbeatPump      heartbeats;
    @Mock TelemetrySink      telemetry;

    JobRunner runner;
    Job       job;

    @BeforeEach
    void setUp() {
        runner = new JobRunner(queueService, new TaskDocumentReader(new ObjectMapper()), workspaces, publisher,
                checkpoints, rebuilder, selfHeal, SelfHealConfig.defaults(), journal, gate, recovery,
                heartbeats, telemetry);
        job = TestJobs.running(TestJobs.THREE_STEP_PAYLOAD, WORKER, Instant.now().plusSeconds(120));

        lenient().when(heartbeats.start(job.getId(), WORKER, 120)).thenReturn(new HeartbeatPump.Handle());
        lenient().when(rebuilder.baselineOf(job)).thenReturn(new Baseline("https://github.com/acme/app.git", "main"));
        lenient().when(checkpoints.firstIncompleteStep(job.getId(), 3)).thenReturn(0);
        lenient().when(checkpoints.record(eq(job.getId()), any(), anyInt(), any()))
                .thenReturn(new StepCheckpoint(job.getId(), "x", 0, 1, "h", "[]", "ok", "p", "m", Instant.now()));
        lenient().when(gate.checkpoint(job.getId(), WORKER)).thenReturn(new ControlSnapshot(null, 0));
        lenient().when(queueService.markPublished(job.getId(), WORKER)).thenReturn(true);
        lenient().when(publisher.publish(job, job.getWorkspaceRef())).thenReturn("branch stepwright/" + job.getId());
    }

    private static StepResult success(int attempt) {
        return StepResult.succeeded(StepOutcome.success("ok", "diff", List.of("a")), attempt, 0);
    }

    private Job withStatus(JobStatus status) {
        Job copy = TestJobs.queued(TestJobs.THREE_STEP_PAYLOAD);
        copy.setStatus(status);
        return copy;
    }

    private List<String> stepsRun() {
        ArgumentCaptor<AttemptContext> captor = ArgumentCaptor.forClass(AttemptContext.class);
        verify(selfHeal, atLeast(0)).runStep(captor.capture());
        return captor.getAllValues().stream().map(c -> c.step().stepId()).toList();
    }

    // ------------------------------------------------------------------
    // Happy path / publish guard
    // ------------------------------------------------------------------

    @Test
    void run_allStepsSucceed_checkpointsPublishesOnceAndCompletes() {
        when(selfHeal.runStep(any())).thenReturn(success(1));

        runner.run(job, WORKER, 120);

        assertThat(stepsRun()).containsExactly("diagnose", "fix", "verify");
        verify(checkpoints, times(3)).record(eq(job.getId()), any(), eq(1), any());
        verify(publisher, times(1)).publish(job, job.getWorkspaceRef());
        verify(queueService).complete(eq(job.getId()), eq(WORKER),
                eq("Completed 3 step(s); published branch stepwright/" + job.getId()));
        verify(workspaces).delete(job.getWorkspaceRef());
    }

    @Test
    void run_passesRemainingHardResetBudgetToEachStep() {
        when(journal.hardResetsUsed(job.getId())).thenReturn(1);
        when(selfHeal.runStep(any())).thenReturn(success(1));

        runner.run(job, WORKER, 120);

        ArgumentCaptor<AttemptContext> captor = ArgumentCaptor.forClass(AttemptContext.class);
        verify(selfHeal, times(3)).runStep(captor.capture());
        assertThat(captor.getAllValues()).allMatch(c -> c.hardResetsRemaining() == 0);
    }

    @Test
    void run_alreadyPublished_skipsPublishButCompletes() {
        when(selfHeal.runStep(any())).thenReturn(success(1));
        when(queueService.markPublished(job.getId(), WORKER)).thenReturn(false);

        runner.run(job, WORKER, 120);

        verify(publisher, never()).publish(any(), any());
        verify(queueService).complete(job.getId(), WORKER, "Completed 3 step(s)");
    }

    @Test
    void run_publishFails_failsWithoutRetry() {
        when(selfHeal.runStep(any())).thenReturn(success(1));
        when(publisher.publish(job, job.getWorkspaceRef())).thenThrow(new ExecutorException("push rejected"));
        when(queueService.fail(eq(job.getId()), eq(WORKER), contains("push rejected"), eq(false)))
                .thenReturn(withStatus(JobStatus.FAILED));

        runner.run(job, WORKER, 120);

        verify(queueService, never()).complete(any(), any(), any());
    }

    // ------------------------------------------------------------------
    // Resume / rewind
    // ------------------------------------------------------------------

    @Test
    void run_reclaimedJob_resumesAfterLastCheckpoint() {
        when(checkpoints.firstIncompleteStep(job.getId(), 3)).thenReturn(2);
        when(selfHeal.runStep(any())).thenReturn(success(1));

        runner.run(job, WORKER, 120);

        verify(rebuilder).rebuild(job, job.getWorkspaceRef(), 2);
        assertThat(stepsRun()).containsExactly("verify");
        verify(telemetry).info(eq(job.getId()), eq("resume.from_step"), anyMap());
    }

    @Test
    void run_stepRewinds_rebuildsAndRunsFromTarget() {
        when(selfHeal.runStep(any())).thenReturn(success(1), success(1), StepResult.rewind(0, 0),
                success(1), success(1), success(1));

        runner.run(job, WORKER, 120);

        verify(rebuilder).rebuild(job, job.getWorkspaceRef(), 0);
        assertThat(stepsRun()).containsExactly("diagnose", "fix", "verify", "diagnose", "fix", "verify");
        verify(queueService).complete(eq(job.getId()), eq(WORKER), anyString());
    }

    @Test
    void run_operatorRewindBeforePublish_rerunsSteps() {
        RecoveryRequest request = new RecoveryRequest(RecoveryAction.RESUME_FROM_STEP, "fix", null, "alice", null,
                Instant.now());
        ControlSnapshot pending = new ControlSnapshot(request, 3);
        when(gate.checkpoint(job.getId(), WORKER)).thenReturn(pending, new ControlSnapshot(null, 3));
        when(recovery.resolve(eq(job), eq(WORKER), any(), eq(3), eq(pending)))
                .thenReturn(new RecoveryResolver.Resolution(RecoveryResolver.Kind.REWIND, 1, request, "rebuilding"));
        when(selfHeal.runStep(any())).thenReturn(success(1));

        runner.run(job, WORKER, 120);

        verify(rebuilder).rebuild(job, job.getWorkspaceRef(), 1);
        assertThat(stepsRun()).containsExactly("diagnose", "fix", "verify", "fix", "verify");
        verify(publisher, times(1)).publish(any(), any());
    }

    // ------------------------------------------------------------------
    // Failure and interruption paths
    // ------------------------------------------------------------------

    @Test
    void run_stepFailsRetryable_requeuedAndWorkspaceKept() {
        when(selfHeal.runStep(any())).thenReturn(success(1), StepResult.failed("step fix failed", true, 1));
        when(queueService.fail(job.getId(), WORKER, "step fix failed", true)).thenReturn(withStatus(JobStatus.QUEUED));

        runner.run(job, WORKER, 120);

        verify(publisher, never()).publish(any(), any());
        verify(queueService, never()).complete(any(), any(), any());
        verify(workspaces, never()).delete(any());
    }

    @Test
    void run_stepFailsTerminally_workspaceDeleted() {
        when(selfHeal.runStep(any())).thenReturn(StepResult.failed("policy", false, 0));
        when(queueService.fail(job.getId(), WORKER, "policy", false)).thenReturn(withStatus(JobStatus.FAILED));

        runner.run(job, WORKER, 120);

        verify(workspaces).delete(job.getWorkspaceRef());
    }

    @Test
    void run_cancelled_acknowledged() {
        when(selfHeal.runStep(any())).thenThrow(new JobCancelledException(job.getId(), "wrong branch"));

        runner.run(job, WORKER, 120);

        verify(queueService).ackCancel(eq(job.getId()), eq(WORKER), anyString());
        verify(workspaces).delete(job.getWorkspaceRef());
    }

    @Test
    void run_workerStopping_releasesJobWithoutVerdict() {
        when(selfHeal.runStep(any())).thenThrow(new WorkerStoppingException("shutdown"));

        runner.run(job, WORKER, 120);

        verify(queueService).release(job.getId(), WORKER, "shutdown");
        verify(queueService, never()).fail(any(), any(), any(), anyBoolean());
        verify(workspaces, never()).delete(any());
    }

    @Test
    void run_leaseLost_leavesJobAlone() {
        when(selfHeal.runStep(any())).thenThrow(new JobOwnershipException(job.getId(), "lease expired"));

        runner.run(job, WORKER, 120);

        verify(queueService, never()).fail(any(), any(), any(), anyBoolean());
        verify(queueService, never()).release(any(), any(), any());
        verify(workspaces, never()).delete(any());
    }

    @Test
    void run_checkpointIntegrityFailure_failsNotRetryable() {
        when(checkpoints.firstIncompleteStep(job.getId(), 3)).thenReturn(1);
        when(rebuilder.rebuild(job, job.getWorkspaceRef(), 1))
                .thenThrow(new CheckpointIntegrityException(7L, 0, "aaa", "bbb"));
        when(queueService.fail(eq(job.getId()), eq(WORKER), anyString(), eq(false)))
                .thenReturn(withStatus(JobStatus.FAILED));

        runner.run(job, WORKER, 120);

        verify(selfHeal, never()).runStep(any());
        verify(queueService).fail(eq(job.getId()), eq(WORKER), anyString(), eq(false));
    }

    @Test
    void run_executorError_failsRetryable() {
        doThrow(new ExecutorException("executor unreachable"))
                .when(workspaces).prepare(eq(job.getWorkspaceRef()), any());
        when(queueService.fail(eq(job.getId()), eq(WORKER), contains("executor unreachable"), eq(true)))
                .thenReturn(withStatus(JobStatus.QUEUED));

        runner.run(job, WORKER, 120);

        verify(selfHeal, never()).runStep(any());
    }
}
