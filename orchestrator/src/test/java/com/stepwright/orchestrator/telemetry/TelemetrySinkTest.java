package com.stepwright.orchestrator.telemetry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwright.orchestrator.model.EventLevel;
import com.stepwright.orchestrator.model.FailureClass;
import com.stepwright.orchestrator.model.JobEvent;
import com.stepwright.orchestrator.model.SelfHealStrategy;
import com.stepwright.orchestrator.repository.JobEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelemetrySinkTest {

    @Mock JobEventRepository events;

    SimpleMeterRegistry registry;
    TelemetrySink       sink;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        sink = new TelemetrySink(events, registry, new SecretScrubber(Map.of(), List.of("sekrit-value")),
                new ObjectMapper(), Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void event_persistedScrubbedAndCounted() {
        UUID jobId = UUID.randomUUID();

        sink.warn(jobId, "step.attempt.failed", Map.of("error", "auth failed for sekrit-value"));

        ArgumentCaptor<JobEvent> captor = ArgumentCaptor.forClass(JobEvent.class);
        verify(events).save(captor.capture());
        JobEvent saved = captor.getValue();
        assertThat(saved.getJobId()).isEqualTo(jobId);
        assertThat(saved.getLevel()).isEqualTo(EventLevel.WARN);
        assertThat(saved.getPayload()).contains(SecretScrubber.REDACTED).doesNotContain("sekrit-value");
        assertThat(registry.counter("stepwright.events", "event", "step.attempt.failed").count()).isEqualTo(1.0);
    }

    @Test
    void event_persistenceFailure_doesNotPropagate() {
        when(events.save(any())).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> sink.info(UUID.randomUUID(), "job.claimed", Map.of()))
                .doesNotThrowAnyException();
    }

    @Test
    void recordAttempt_successTaggedWithNoneClass() {
        sink.recordAttempt(null, SelfHealStrategy.NONE, "succeeded");
        sink.recordAttempt(FailureClass.TRANSIENT_RUNTIME, SelfHealStrategy.SOFT_RESET, "failed");

        assertThat(registry.counter("stepwright.self_heal.attempts",
                "class", "none", "strategy", "none", "outcome", "succeeded").count()).isEqualTo(1.0);
        assertThat(registry.counter("stepwright.self_heal.attempts",
                "class", "transient_runtime", "strategy", "soft_reset", "outcome", "failed").count()).isEqualTo(1.0);
    }
}
