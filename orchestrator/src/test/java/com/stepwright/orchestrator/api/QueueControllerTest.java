package com.stepwright.orchestrator.api;

import com.stepwright.orchestrator.TestJobs;
import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.model.JobStatus;
import com.stepwright.orchestrator.model.WorkerPauseMode;
import com.stepwright.orchestrator.model.WorkerPauseState;
import com.stepwright.orchestrator.service.ClaimResult;
import com.stepwright.orchestrator.service.JobOwnershipException;
import com.stepwright.orchestrator.service.QueueService;
import com.stepwright.orchestrator.service.WorkerPauseService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QueueController.class)
class QueueControllerTest {

    @Autowired MockMvc              mockMvc;
    @MockitoBean QueueService       queueService;
    @MockitoBean WorkerPauseService workerPause;

    // ------------------------------------------------------------------
    // POST /queue/claim
    // ------------------------------------------------------------------

    @Test
    void claim_eligibleJob_returnsJobAndSystemState() throws Exception {
        Job job = TestJobs.running(TestJobs.THREE_STEP_PAYLOAD, "w1", Instant.now().plusSeconds(60));
        when(queueService.claim("w1", 60, List.of("repair"), List.of()))
                .thenReturn(new ClaimResult(job, new WorkerPauseState()));

        mockMvc.perform(post("/queue/claim")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workerId":"w1","leaseSeconds":60,"allowedTypes":["repair"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job.id").value(job.getId().toString()))
                .andExpect(jsonPath("$.job.status").value("running"))
                .andExpect(jsonPath("$.job.claimedBy").value("w1"))
                .andExpect(jsonPath("$.system.paused").value(false));
    }

    @Test
    void claim_workersPaused_returnsNullJobWithPauseState() throws Exception {
        WorkerPauseState paused = new WorkerPauseState();
        paused.apply(true, WorkerPauseMode.QUIESCE, "db maintenance", "ops", Instant.now());
        when(queueService.claim(eq("w1"), eq(60), eq(List.of()), eq(List.of())))
                .thenReturn(new ClaimResult(null, paused));

        mockMvc.perform(post("/queue/claim")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workerId":"w1","leaseSeconds":60}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job").doesNotExist())
                .andExpect(jsonPath("$.system.paused").value(true))
                .andExpect(jsonPath("$.system.mode").value("quiesce"));
    }

    @Test
    void claim_blankWorkerId_returns400() throws Exception {
        mockMvc.perform(post("/queue/claim")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workerId":" ","leaseSeconds":60}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation"));
        verifyNoInteractions(queueService);
    }

    // ------------------------------------------------------------------
    // Lease and outcome
    // ------------------------------------------------------------------

    @Test
    void heartbeat_returnsLiveControlAndSystemState() throws Exception {
        Job job = TestJobs.running(TestJobs.THREE_STEP_PAYLOAD, "w1", Instant.now().plusSeconds(60));
        job.getLiveControl().setPaused(true);
        job.getLiveControl().bumpVersion();
        when(queueService.heartbeat(job.getId(), "w1", 60)).thenReturn(job);
        when(workerPause.current()).thenReturn(new WorkerPauseState());

        mockMvc.perform(post("/queue/jobs/{id}/heartbeat", job.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workerId":"w1","leaseSeconds":60}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.liveControl.paused").value(true))
                .andExpect(jsonPath("$.liveControl.controlVersion").value(1))
                .andExpect(jsonPath("$.system.mode").value("drain"));
    }

    @Test
    void heartbeat_notOwner_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(queueService.heartbeat(eq(id), anyString(), anyInt()))
                .thenThrow(new JobOwnershipException(id, "job is owned by w2"));

        mockMvc.perform(post("/queue/jobs/{id}/heartbeat", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workerId":"w1","leaseSeconds":60}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ownership"));
    }

    @Test
    void fail_retryable_returnsRequeuedJob() throws Exception {
        Job job = TestJobs.queued(TestJobs.THREE_STEP_PAYLOAD);
        job.setStatus(JobStatus.QUEUED);
        when(queueService.fail(job.getId(), "w1", "step fix failed", true)).thenReturn(job);

        mockMvc.perform(post("/queue/jobs/{id}/fail", job.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workerId":"w1","error":"step fix failed","retryable":true}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("queued"));
    }

    @Test
    void complete_returnsSucceededJob() throws Exception {
        Job job = TestJobs.queued(TestJobs.THREE_STEP_PAYLOAD);
        job.setStatus(JobStatus.SUCCEEDED);
        when(queueService.complete(job.getId(), "w1", "Completed 3 step(s)")).thenReturn(job);

        mockMvc.perform(post("/queue/jobs/{id}/complete", job.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workerId":"w1","result":"Completed 3 step(s)"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("succeeded"));
    }

    @Test
    void ackCancel_returnsCancelledJob() throws Exception {
        Job job = TestJobs.queued(TestJobs.THREE_STEP_PAYLOAD);
        job.setStatus(JobStatus.CANCELLED);
        when(queueService.ackCancel(job.getId(), "w1", "stopped at step 2")).thenReturn(job);

        mockMvc.perform(post("/queue/jobs/{id}/cancel/ack", job.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workerId":"w1","message":"stopped at step 2"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cancelled"));
    }
}
