package com.stepwright.orchestrator.heal;

import com.stepwright.orchestrator.TestJobs;
import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.model.RecoveryAction;
import com.stepwright.orchestrator.model.WorkerPauseMode;
import com.stepwright.orchestrator.model.WorkerPauseState;
import com.stepwright.orchestrator.service.JobOwnershipException;
import com.stepwright.orchestrator.service.QueueService;
import com.stepwright.orchestrator.service.WorkerPauseService;
import com.stepwright.orchestrator.telemetry.TelemetrySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LiveControlGateTest {

    static final String WORKER = "w1";

    @Mock QueueService       queueService;
    @Mock WorkerPauseService workerPause;
    @Mock TelemetrySink      telemetry;

    LiveControlGate gate;
    Job             job;
    UUID            jobId;

    @BeforeEach
    void setUp() {
        gate = new LiveControlGate(queueService, workerPause, telemetry, 120, 10);
        job = TestJobs.running(TestJobs.THREE_STEP_PAYLOAD, WORKER, Instant.now().plusSeconds(120));
        jobId = job.getId();
        lenient().when(workerPause.current()).thenReturn(new WorkerPauseState());
    }

    private Job copyWithSameId() {
        Job other = TestJobs.running(TestJobs.THREE_STEP_PAYLOAD, WORKER, Instant.now().plusSeconds(120));
        ReflectionTestUtils.setField(other, "id", jobId);
        return other;
    }

    // ------------------------------------------------------------------
    // Pass-through
    // ------------------------------------------------------------------

    @Test
    void checkpoint_nothingPending_renewsLeaseAndReturnsEmptySnapshot() {
        when(queueService.heartbeat(jobId, WORKER, 120)).thenReturn(job);

        ControlSnapshot snapshot = gate.checkpoint(jobId, WORKER);

        assertThat(snapshot.pendingRecovery()).isEmpty();
        assertThat(snapshot.recoveryVersion()).isZero();
        verify(queueService).heartbeat(jobId, WORKER, 120);
    }

    @Test
    void checkpoint_pendingRecovery_returnsRequestWithVersion() {
        job.getLiveControl().bumpVersion();
        job.getLiveControl().requestRecovery(RecoveryAction.RETRY_STEP, "fix", null, "alice", "flaky",
                Instant.now(), job.getLiveControl().bumpVersion());
        job.getLiveControl().bumpVersion();
        when(queueService.heartbeat(jobId, WORKER, 120)).thenReturn(job);

        ControlSnapshot snapshot = gate.checkpoint(jobId, WORKER);

        assertThat(snapshot.pendingRecovery()).hasValueSatisfying(r -> {
            assertThat(r.action()).isEqualTo(RecoveryAction.RETRY_STEP);
            assertThat(r.stepId()).isEqualTo("fix");
        });
        assertThat(snapshot.recoveryVersion()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // Hold
    // ------------------------------------------------------------------

    @Test
    void checkpoint_pausedJob_holdsUntilResumed() {
        Job paused = copyWithSameId();
        paused.getLiveControl().setPaused(true);
        when(queueService.heartbeat(jobId, WORKER, 120)).thenReturn(paused, paused, job);

        ControlSnapshot snapshot = gate.checkpoint(jobId, WORKER);

        assertThat(snapshot.pendingRecovery()).isEmpty();
        verify(queueService, times(3)).heartbeat(jobId, WORKER, 120);
        verify(telemetry).info(eq(jobId), eq("task.control.pause.active"), any());
        verify(telemetry).info(eq(jobId), eq("task.control.pause.cleared"), any());
    }

    @Test
    void checkpoint_workersQuiesced_holdsEvenWhenJobIsNotPaused() {
        WorkerPauseState quiesced = new WorkerPauseState();
        quiesced.apply(true, WorkerPauseMode.QUIESCE, "db maintenance", "ops", Instant.now());
        when(workerPause.current()).thenReturn(quiesced, new WorkerPauseState());
        when(queueService.heartbeat(jobId, WORKER, 120)).thenReturn(job);

        gate.checkpoint(jobId, WORKER);

        verify(queueService, times(2)).heartbeat(jobId, WORKER, 120);
        verify(telemetry).info(eq(jobId), eq("task.control.pause.active"), any());
    }

    @Test
    void checkpoint_drainPause_doesNotHoldRunningJob() {
        WorkerPauseState drain = new WorkerPauseState();
        drain.apply(true, WorkerPauseMode.DRAIN, "deploy", "ops", Instant.now());
        when(workerPause.current()).thenReturn(drain);
        when(queueService.heartbeat(jobId, WORKER, 120)).thenReturn(job);

        gate.checkpoint(jobId, WORKER);

        verify(queueService, times(1)).heartbeat(jobId, WORKER, 120);
        verify(telemetry, never()).info(any(), eq("task.control.pause.active"), any());
    }

    // ------------------------------------------------------------------
    // Exits
    // ------------------------------------------------------------------

    @Test
    void checkpoint_cancelRequested_throwsJobCancelled() {
        job.requestCancel("alice", "wrong repo", Instant.now());
        when(queueService.heartbeat(jobId, WORKER, 120)).thenReturn(job);

        assertThatThrownBy(() -> gate.checkpoint(jobId, WORKER))
                .isInstanceOf(JobCancelledException.class);
    }

    @Test
    void checkpoint_afterRequestStop_throwsWithoutTouchingQueue() {
        gate.requestStop();

        assertThat(gate.isStopping()).isTrue();
        assertThatThrownBy(() -> gate.checkpoint(jobId, WORKER))
                .isInstanceOf(WorkerStoppingException.class);
        verifyNoInteractions(queueService);
    }

    @Test
    void checkpoint_leaseLost_propagatesOwnershipError() {
        when(queueService.heartbeat(jobId, WORKER, 120))
                .thenThrow(new JobOwnershipException(jobId, WORKER));

        assertThatThrownBy(() -> gate.checkpoint(jobId, WORKER))
                .isInstanceOf(JobOwnershipException.class);
    }

    @Test
    void checkpoint_stopRequestedWhileHeld_throwsOnNextPoll() {
        Job paused = copyWithSameId();
        paused.getLiveControl().setPaused(true);
        when(queueService.heartbeat(any(UUID.class), anyString(), anyInt())).thenAnswer(inv -> {
            gate.requestStop();
            return paused;
        });

        assertThatThrownBy(() -> gate.checkpoint(jobId, WORKER))
                .isInstanceOf(WorkerStoppingException.class);
        verify(queueService, times(1)).heartbeat(jobId, WORKER, 120);
    }
}
