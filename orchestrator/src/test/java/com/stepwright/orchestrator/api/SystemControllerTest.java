package com.stepwright.orchestrator.api;

import com.stepwright.orchestrator.model.WorkerPauseMode;
import com.stepwright.orchestrator.model.WorkerPauseState;
import com.stepwright.orchestrator.service.QueueValidationException;
import com.stepwright.orchestrator.service.WorkerPauseService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SystemController.class)
class SystemControllerTest {

    @Autowired MockMvc              mockMvc;
    @MockitoBean WorkerPauseService workerPause;

    @Test
    void current_notPaused_returnsDrainDefault() throws Exception {
        when(workerPause.current()).thenReturn(new WorkerPauseState());

        mockMvc.perform(get("/system/worker-pause"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paused").value(false))
                .andExpect(jsonPath("$.mode").value("drain"))
                .andExpect(jsonPath("$.version").value(0));
    }

    @Test
    void update_pauseQuiesce_returnsNewState() throws Exception {
        WorkerPauseState state = new WorkerPauseState();
        state.apply(true, WorkerPauseMode.QUIESCE, "db maintenance", "ops", Instant.now());
        when(workerPause.pause(WorkerPauseMode.QUIESCE, "db maintenance", "ops")).thenReturn(state);

        mockMvc.perform(post("/system/worker-pause")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"action":"pause","mode":"Quiesce","reason":"db maintenance","actor":"ops"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paused").value(true))
                .andExpect(jsonPath("$.mode").value("quiesce"))
                .andExpect(jsonPath("$.requestedBy").value("ops"))
                .andExpect(jsonPath("$.version").value(1));
    }

    @Test
    void update_pauseWithoutMode_defaultsToDrain() throws Exception {
        WorkerPauseState state = new WorkerPauseState();
        state.apply(true, WorkerPauseMode.DRAIN, "deploy", "operator", Instant.now());
        when(workerPause.pause(WorkerPauseMode.DRAIN, "deploy", "operator")).thenReturn(state);

        mockMvc.perform(post("/system/worker-pause")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"action":"pause","reason":"deploy"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("drain"));
    }

    @Test
    void update_pauseWithoutReason_returns400FromService() throws Exception {
        when(workerPause.pause(any(), isNull(), anyString()))
                .thenThrow(new QueueValidationException("A reason is required to pause workers"));

        mockMvc.perform(post("/system/worker-pause")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"action":"pause"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("A reason is required to pause workers"));
    }

    @Test
    void update_unknownAction_returns400() throws Exception {
        mockMvc.perform(post("/system/worker-pause")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"action":"reboot"}
                                """))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(workerPause);
    }

    @Test
    void update_unknownMode_returns400() throws Exception {
        mockMvc.perform(post("/system/worker-pause")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"action":"pause","mode":"freeze","reason":"x"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown worker-pause mode 'freeze'"));
    }
}
