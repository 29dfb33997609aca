package com.stepwright.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Single-row global switch that stops workers from claiming (DRAIN) or also
 * holds running jobs at their next checkpoint (QUIESCE).
 *
 * DB table: system_worker_pause  (row id 1 seeded by Flyway V1)
 */
@Entity
@Table(name = "system_worker_pause")
public class WorkerPauseState {

    public static final int SINGLETON_ID = 1;

    @Id
    private Integer id = SINGLETON_ID;

    @Column(nullable = false)
    private boolean paused = false;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkerPauseMode mode = WorkerPauseMode.DRAIN;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "requested_by")
    private String requestedBy;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // Bumped on every change; lets callers tell two reads apart.
    @Column(nullable = false)
    private long version = 0;

    public WorkerPauseState() {}

    public boolean isQuiescing() {
        return paused && mode == WorkerPauseMode.QUIESCE;
    }

    public Integer         getId()          { return id; }
    public boolean         isPaused()       { return paused; }
    public WorkerPauseMode getMode()        { return mode; }
    public String          getReason()      { return reason; }
    public String          getRequestedBy() { return requestedBy; }
    public Instant         getUpdatedAt()   { return updatedAt; }
    public long            getVersion()     { return version; }

    public void apply(boolean paused, WorkerPauseMode mode, String reason,
                      String requestedBy, Instant now) {
        this.paused      = paused;
        this.mode        = mode;
        this.reason      = reason;
        this.requestedBy = requestedBy;
        this.updatedAt   = now;
        this.version++;
    }
}
