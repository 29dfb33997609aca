package com.stepwright.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of one successfully completed step. Append-only.
 *
 * The raw patch and a JSON copy of these fields live in artifact storage
 * (patchPath / metadataPath); diffHash is the SHA-256 of the patch bytes and
 * is re-verified before every replay.
 *
 * If an operator rewinds a job, the re-executed step gets a newer row for the
 * same stepIndex; replay always uses the newest one.
 */
@Entity
@Table(name = "step_checkpoints")
public class StepCheckpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "step_id", nullable = false, updatable = false)
    private String stepId;

    @Column(name = "step_index", nullable = false, updatable = false)
    private int stepIndex;

    // The attempt number that succeeded.
    @Column(nullable = false, updatable = false)
    private int attempt;

    @Column(name = "diff_hash", nullable = false, updatable = false)
    private String diffHash;

    // Ordered, de-duplicated relative paths as a JSON array.
    @Column(name = "changed_files", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String changedFiles;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String summary;

    @Column(name = "patch_path", nullable = false, updatable = false)
    private String patchPath;

    @Column(name = "metadata_path", nullable = false, updatable = false)
    private String metadataPath;

    @Column(name = "finished_at", nullable = false, updatable = false)
    private Instant finishedAt;

    protected StepCheckpoint() {}   // required by JPA

    public StepCheckpoint(UUID jobId, String stepId, int stepIndex, int attempt,
                          String diffHash, String changedFiles, String summary,
                          String patchPath, String metadataPath, Instant finishedAt) {
        this.jobId        = jobId;
        this.stepId       = stepId;
        this.stepIndex    = stepIndex;
        this.attempt      = attempt;
        this.diffHash     = diffHash;
        this.changedFiles = changedFiles;
        this.summary      = summary;
        this.patchPath    = patchPath;
        this.metadataPath = metadataPath;
        this.finishedAt   = finishedAt;
    }

    public Long    getId()           { return id; }
    public UUID    getJobId()        { return jobId; }
    public String  getStepId()       { return stepId; }
    public int     getStepIndex()    { return stepIndex; }
    public int     getAttempt()      { return attempt; }
    public String  getDiffHash()     { return diffHash; }
    public String  getChangedFiles() { return changedFiles; }
    public String  getSummary()      { return summary; }
    public String  getPatchPath()    { return patchPath; }
    public String  getMetadataPath() { return metadataPath; }
    public Instant getFinishedAt()   { return finishedAt; }
}
