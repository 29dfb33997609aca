package com.stepwright.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit row for operator control writes and worker acknowledgements.
 * jobId is null for system-wide events (global worker pause).
 */
@Entity
@Table(name = "control_events")
public class ControlEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", updatable = false)
    private UUID jobId;

    @Column(nullable = false, updatable = false)
    private String action;

    @Column(name = "step_id", updatable = false)
    private String stepId;

    @Column(updatable = false)
    private String strategy;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String reason;

    @Column(updatable = false)
    private String actor;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ControlEvent() {}   // required by JPA

    public ControlEvent(UUID jobId, String action, String stepId, String strategy,
                        String reason, String actor, Instant createdAt) {
        this.jobId     = jobId;
        this.action    = action;
        this.stepId    = stepId;
        this.strategy  = strategy;
        this.reason    = reason;
        this.actor     = actor;
        this.createdAt = createdAt;
    }

    public Long    getId()        { return id; }
    public UUID    getJobId()     { return jobId; }
    public String  getAction()    { return action; }
    public String  getStepId()    { return stepId; }
    public String  getStrategy()  { return strategy; }
    public String  getReason()    { return reason; }
    public String  getActor()     { return actor; }
    public Instant getCreatedAt() { return createdAt; }
}
