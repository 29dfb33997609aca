package com.stepwright.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Structured telemetry event attached to a job (job.claimed,
 * step.attempt.failed, self_heal.triggered, ...). Payload is scrubbed JSON.
 */
@Entity
@Table(name = "job_events")
public class JobEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private EventLevel level;

    @Column(nullable = false, updatable = false)
    private String event;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected JobEvent() {}   // required by JPA

    public JobEvent(UUID jobId, EventLevel level, String event, String payload, Instant createdAt) {
        this.jobId     = jobId;
        this.level     = level;
        this.event     = event;
        this.payload   = payload;
        this.createdAt = createdAt;
    }

    public Long       getId()        { return id; }
    public UUID       getJobId()     { return jobId; }
    public EventLevel getLevel()     { return level; }
    public String     getEvent()     { return event; }
    public String     getPayload()   { return payload; }
    public Instant    getCreatedAt() { return createdAt; }
}
