package com.stepwright.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One step attempt, successful or not.
 *
 * Inserted with outcome RUNNING when the attempt starts and finalized when it
 * ends, so a worker crash mid-attempt still leaves a trace.
 */
@Entity
@Table(name = "attempt_records")
public class AttemptRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "step_id", nullable = false, updatable = false)
    private String stepId;

    @Column(name = "step_index", nullable = false, updatable = false)
    private int stepIndex;

    @Column(nullable = false, updatable = false)
    private int attempt;

    @Column(name = "worker_id")
    private String workerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AttemptOutcome outcome = AttemptOutcome.RUNNING;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_class")
    private FailureClass failureClass;

    // Normalized and scrubbed; never raw runtime output.
    @Column(name = "failure_signature", columnDefinition = "TEXT")
    private String failureSignature;

    @Column(name = "signature_hash")
    private String signatureHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SelfHealStrategy strategy = SelfHealStrategy.NONE;

    @Column(name = "wall_clock_seconds")
    private Double wallClockSeconds;

    @Column(name = "idle_seconds")
    private Double idleSeconds;

    @Column(name = "diff_hash")
    private String diffHash;

    @Column(name = "changed_files", columnDefinition = "TEXT")
    private String changedFiles;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    protected AttemptRecord() {}   // required by JPA

    public AttemptRecord(UUID jobId, String stepId, int stepIndex, int attempt,
                         String workerId, Instant startedAt) {
        this.jobId     = jobId;
        this.stepId    = stepId;
        this.stepIndex = stepIndex;
        this.attempt   = attempt;
        this.workerId  = workerId;
        this.startedAt = startedAt;
    }

    public Long             getId()               { return id; }
    public UUID             getJobId()            { return jobId; }
    public String           getStepId()           { return stepId; }
    public int              getStepIndex()        { return stepIndex; }
    public int              getAttempt()          { return attempt; }
    public String           getWorkerId()         { return workerId; }
    public AttemptOutcome   getOutcome()          { return outcome; }
    public FailureClass     getFailureClass()     { return failureClass; }
    public String           getFailureSignature() { return failureSignature; }
    public String           getSignatureHash()    { return signatureHash; }
    public SelfHealStrategy getStrategy()         { return strategy; }
    public Double           getWallClockSeconds() { return wallClockSeconds; }
    public Double           getIdleSeconds()      { return idleSeconds; }
    public String           getDiffHash()         { return diffHash; }
    public String           getChangedFiles()     { return changedFiles; }
    public String           getSummary()          { return summary; }
    public Instant          getStartedAt()        { return startedAt; }
    public Instant          getFinishedAt()       { return finishedAt; }

    public void setOutcome(AttemptOutcome outcome)         { this.outcome = outcome; }
    public void setFailureClass(FailureClass v)            { this.failureClass = v; }
    public void setFailureSignature(String v)              { this.failureSignature = v; }
    public void setSignatureHash(String v)                 { this.signatureHash = v; }
    public void setStrategy(SelfHealStrategy strategy)     { this.strategy = strategy; }
    public void setWallClockSeconds(Double v)              { this.wallClockSeconds = v; }
    public void setIdleSeconds(Double v)                   { this.idleSeconds = v; }
    public void setDiffHash(String diffHash)               { this.diffHash = diffHash; }
    public void setChangedFiles(String changedFiles)       { this.changedFiles = changedFiles; }
    public void setSummary(String summary)                 { this.summary = summary; }
    public void setFinishedAt(Instant finishedAt)          { this.finishedAt = finishedAt; }
}
