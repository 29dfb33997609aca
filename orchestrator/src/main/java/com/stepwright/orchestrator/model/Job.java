package com.stepwright.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One unit of queued work: an ordered list of steps executed in a single
 * workspace by whichever worker holds the lease.
 *
 * Invariant: status == RUNNING ⇔ claimedBy != null and leaseExpiresAt != null.
 * Only the lease holder (or the lease-reclaim sweep) mutates execution fields;
 * {@link LiveControlState} is the one part operators write concurrently.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.QUEUED;

    // Higher runs first.
    @Column(nullable = false)
    private int priority = 0;

    // Task document as submitted (JSON text).
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    // Ordered step list, fixed the first time the job is claimed (JSON text).
    @Column(name = "resolved_steps", columnDefinition = "TEXT")
    private String resolvedSteps;

    @Column(nullable = false)
    private int attempt = 1;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts = 3;

    // ── Lease ───────────────────────────────────────────────────────────
    @Column(name = "claimed_by")
    private String claimedBy;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    // Earliest time a retried job may be claimed again (backoff).
    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    // ── Outcome ─────────────────────────────────────────────────────────
    @Column(nullable = false)
    private boolean retryable = false;

    @Column(name = "result_summary", columnDefinition = "TEXT")
    private String resultSummary;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // ── Cooperative cancellation ────────────────────────────────────────
    @Column(name = "cancel_requested_at")
    private Instant cancelRequestedAt;

    @Column(name = "cancel_requested_by")
    private String cancelRequestedBy;

    @Column(name = "cancel_reason", columnDefinition = "TEXT")
    private String cancelReason;

    // Set once, the first time the job's result is published.
    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "workspace_ref")
    private String workspaceRef;

    @Embedded
    private LiveControlState liveControl = new LiveControlState();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // Called automatically by JPA before every UPDATE.
    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String type, String payload, int priority, int maxAttempts) {
        this.type        = type;
        this.payload     = payload;
        this.priority    = priority;
        this.maxAttempts = maxAttempts;
    }

    // ------------------------------------------------------------------
    // Lease helpers
    // ------------------------------------------------------------------

    public boolean isOwnedBy(String workerId) {
        return status == JobStatus.RUNNING && workerId != null && workerId.equals(claimedBy);
    }

    public boolean isCancelRequested() {
        return cancelRequestedAt != null;
    }

    /** Drop ownership; used on every transition out of RUNNING. */
    public void releaseLease() {
        this.claimedBy      = null;
        this.leaseExpiresAt = null;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID      getId()             { return id; }
    public String    getType()           { return type; }
    public JobStatus getStatus()         { return status; }
    public int       getPriority()       { return priority; }
    public String    getPayload()        { return payload; }
    public String    getResolvedSteps()  { return resolvedSteps; }
    public int       getAttempt()        { return attempt; }
    public int       getMaxAttempts()    { return maxAttempts; }
    public String    getClaimedBy()      { return claimedBy; }
    public Instant   getLeaseExpiresAt() { return leaseExpiresAt; }
    public Instant   getNextAttemptAt()  { return nextAttemptAt; }
    public boolean   isRetryable()       { return retryable; }
    public String    getResultSummary()  { return resultSummary; }
    public String    getErrorMessage()   { return errorMessage; }
    public String    getWorkspaceRef()   { return workspaceRef; }
    public Instant   getPublishedAt()    { return publishedAt; }
    public Instant   getCreatedAt()      { return createdAt; }
    public Instant   getUpdatedAt()      { return updatedAt; }
    public Instant   getStartedAt()      { return startedAt; }
    public Instant   getFinishedAt()     { return finishedAt; }

    public LiveControlState getLiveControl() { return liveControl; }

    public Instant getCancelRequestedAt()    { return cancelRequestedAt; }
    public String  getCancelRequestedBy()    { return cancelRequestedBy; }
    public String  getCancelReason()         { return cancelReason; }

    public void setStatus(JobStatus status)              { this.status = status; }
    public void setResolvedSteps(String resolvedSteps)   { this.resolvedSteps = resolvedSteps; }
    public void setAttempt(int attempt)                  { this.attempt = attempt; }
    public void setClaimedBy(String claimedBy)           { this.claimedBy = claimedBy; }
    public void setLeaseExpiresAt(Instant v)             { this.leaseExpiresAt = v; }
    public void setNextAttemptAt(Instant v)              { this.nextAttemptAt = v; }
    public void setRetryable(boolean retryable)          { this.retryable = retryable; }
    public void setResultSummary(String v)               { this.resultSummary = v; }
    public void setErrorMessage(String v)                { this.errorMessage = v; }
    public void setWorkspaceRef(String workspaceRef)     { this.workspaceRef = workspaceRef; }
    public void setPublishedAt(Instant publishedAt)      { this.publishedAt = publishedAt; }
    public void setStartedAt(Instant startedAt)          { this.startedAt = startedAt; }
    public void setFinishedAt(Instant finishedAt)        { this.finishedAt = finishedAt; }

    public void requestCancel(String actor, String reason, Instant now) {
        this.cancelRequestedAt = now;
        this.cancelRequestedBy = actor;
        this.cancelReason      = reason;
    }
}
