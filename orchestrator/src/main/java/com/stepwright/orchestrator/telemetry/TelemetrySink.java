package com.stepwright.orchestrator.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwright.orchestrator.model.EventLevel;
import com.stepwright.orchestrator.model.FailureClass;
import com.stepwright.orchestrator.model.JobEvent;
import com.stepwright.orchestrator.model.SelfHealStrategy;
import com.stepwright.orchestrator.repository.JobEventRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Single exit point for job telemetry.
 *
 * Every event is scrubbed, persisted as a {@link JobEvent} row (visible via
 * GET /jobs/{id}/events), logged, and counted:
 * <pre>
 *   stepwright.events{event}
 *   stepwright.self_heal.attempts{class, strategy, outcome}
 *   stepwright.self_heal.exhausted{class}
 *   stepwright.watchdog.trips{kind}
 *   stepwright.step.duration{outcome}
 *   stepwright.jobs.claimed{type}
 * </pre>
 */
@Component
public class TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(TelemetrySink.class);

    private final JobEventRepository events;
    private final MeterRegistry      meterRegistry;
    private final SecretScrubber     scrubber;
    private final ObjectMapper       json;
    private final Clock              clock;

    public TelemetrySink(JobEventRepository events,
                         MeterRegistry meterRegistry,
                         SecretScrubber scrubber,
                         ObjectMapper objectMapper,
                         Clock clock) {
        this.events        = events;
        this.meterRegistry = meterRegistry;
        this.scrubber      = scrubber;
        this.json          = objectMapper;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Events
    // ------------------------------------------------------------------

    public void info(UUID jobId, String event, Map<String, ?> payload) {
        record(jobId, EventLevel.INFO, event, payload);
    }

    public void warn(UUID jobId, String event, Map<String, ?> payload) {
        record(jobId, EventLevel.WARN, event, payload);
    }

    public void error(UUID jobId, String event, Map<String, ?> payload) {
        record(jobId, EventLevel.ERROR, event, payload);
    }

    private void record(UUID jobId, EventLevel level, String event, Map<String, ?> payload) {
        String body = toJson(scrubber.scrubPayload(payload));
        switch (level) {
            case INFO  -> log.info("event={} job={} {}", event, jobId, body);
            case WARN  -> log.warn("event={} job={} {}", event, jobId, body);
            case ERROR -> log.error("event={} job={} {}", event, jobId, body);
        }
        meterRegistry.counter("stepwright.events", "event", event).increment();
        try {
            events.save(new JobEvent(jobId, level, event, body, clock.instant()));
        } catch (RuntimeException e) {
            // The log line above is the fallback record.
            log.warn("Could not persist event {} for job {}: {}", event, jobId, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Metrics
    // ------------------------------------------------------------------

    public void recordClaim(String jobType) {
        meterRegistry.counter("stepwright.jobs.claimed", "type", jobType).increment();
    }

    /** outcome: succeeded | failed. cls is null for successful attempts. */
    public void recordAttempt(FailureClass cls, SelfHealStrategy strategy, String outcome) {
        meterRegistry.counter("stepwright.self_heal.attempts",
                "class",    cls == null ? "none" : cls.wireName(),
                "strategy", strategy.wireName(),
                "outcome",  outcome).increment();
    }

    public void recordExhausted(FailureClass cls) {
        meterRegistry.counter("stepwright.self_heal.exhausted", "class", cls.wireName()).increment();
    }

    /** kind: wall_clock | idle */
    public void recordWatchdogTrip(String kind) {
        meterRegistry.counter("stepwright.watchdog.trips", "kind", kind).increment();
    }

    public void recordStepDuration(Duration duration, String outcome) {
        meterRegistry.timer("stepwright.step.duration", "outcome", outcome)
                .record(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    public String scrub(String text) {
        return scrubber.scrub(text);
    }

    private String toJson(Object payload) {
        try {
            return json.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Event payload is not serializable: {}", e.getMessage());
            return "{}";
        }
    }
}
