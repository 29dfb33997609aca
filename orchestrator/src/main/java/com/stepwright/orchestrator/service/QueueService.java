package com.stepwright.orchestrator.service;

import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.model.JobStatus;
import com.stepwright.orchestrator.model.WorkerPauseState;
import com.stepwright.orchestrator.repository.ClaimCandidate;
import com.stepwright.orchestrator.repository.JobRepository;
import com.stepwright.orchestrator.task.InvalidTaskException;
import com.stepwright.orchestrator.task.TaskDocument;
import com.stepwright.orchestrator.task.TaskDocumentReader;
import com.stepwright.orchestrator.telemetry.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The claim engine: job creation, lease-based claiming and every lifecycle
 * transition of the jobs table.
 *
 * All mutating methods are @Transactional and take a row lock on the job
 * first, so lease-holder writes, operator writes and the lease sweep are
 * serialized per job.
 */
@Service
public class QueueService {

    private static final Logger log = LoggerFactory.getLogger(QueueService.class);

    private final JobRepository      jobRepo;
    private final TaskDocumentReader tasks;
    private final WorkerPauseService workerPause;
    private final TelemetrySink      telemetry;
    private final QueueSettings      settings;
    private final Clock              clock;

    public QueueService(JobRepository jobRepo,
                        TaskDocumentReader tasks,
                        WorkerPauseService workerPause,
                        TelemetrySink telemetry,
                        QueueSettings settings,
                        Clock clock) {
        this.jobRepo     = jobRepo;
        this.tasks       = tasks;
        this.workerPause = workerPause;
        this.telemetry   = telemetry;
        this.settings    = settings;
        this.clock       = clock;
    }

    // ------------------------------------------------------------------
    // Producers
    // ------------------------------------------------------------------

    /**
     * Enqueue a new job. The payload is parsed up front so a malformed task
     * document, or one without a repository to build the workspace from, is
     * rejected here rather than at claim time.
     */
    @Transactional
    public Job createJob(String type, String payload, int priority, int maxAttempts) {
        if (type == null || type.isBlank()) {
            throw new QueueValidationException("Job type is required");
        }
        if (maxAttempts < 1) {
            throw new QueueValidationException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        TaskDocument doc = tasks.read(payload);
        if (doc.repository() == null) {
            throw new QueueValidationException("Job payload must name a repository; workspaces are built from it");
        }
        Job job = jobRepo.save(new Job(type.strip(), payload, priority, maxAttempts));
        log.info("Job {} queued (type={}, priority={}, steps={})",
                job.getId(), job.getType(), priority, doc.steps().size());
        return job;
    }

    // ------------------------------------------------------------------
    // Claiming
    // ------------------------------------------------------------------

    /**
     * Claim the best eligible queued job for this worker.
     *
     *  1. Sweep expired leases back to QUEUED (or FAILED once attempts are used up).
     *  2. Return nothing while the global worker pause is active.
     *  3. Walk queued jobs by priority DESC, created_at ASC, id ASC in batches
     *     keyed on the last candidate seen, skipping jobs of other types and
     *     jobs whose required capabilities the worker lacks.
     *  4. Lock the first eligible row with SKIP LOCKED. A row held by a
     *     concurrent claimer is skipped, never waited on.
     *
     * The row lock is held until this transaction commits, so two concurrent
     * calls can never return the same job. An empty result is the normal idle case.
     */
    @Transactional
    public ClaimResult claim(String workerId, int leaseSeconds,
                             Collection<String> allowedTypes,
                             Collection<String> capabilities) {
        requireWorker(workerId);
        requireLease(leaseSeconds);
        Instant now = clock.instant();

        sweepExpiredLeases(now);

        WorkerPauseState system = workerPause.current();
        if (system.isPaused()) {
            log.debug("Claim by '{}' skipped: workers paused ({})", workerId, system.getMode());
            return new ClaimResult(null, system);
        }

        Set<String> types = normalized(allowedTypes, false);
        Set<String> caps  = normalized(capabilities, true);
        int batchSize = settings.claimBatchSize();

        Pageable batchPage = PageRequest.ofSize(batchSize);
        List<ClaimCandidate> batch = jobRepo.findClaimCandidates(now, batchPage);
        while (true) {
            for (ClaimCandidate candidate : batch) {
                if (!types.isEmpty() && !types.contains(candidate.type())) continue;

                TaskDocument doc;
                try {
                    doc = tasks.read(candidate.payload());
                } catch (InvalidTaskException e) {
                    log.warn("Skipping job {} with unreadable payload: {}", candidate.id(), e.getMessage());
                    continue;
                }
                if (!caps.containsAll(doc.requiredCapabilities())) continue;

                Optional<Job> locked = jobRepo.lockQueuedForClaim(candidate.id());
                if (locked.isEmpty() || locked.get().getStatus() != JobStatus.QUEUED) continue;

                Job job = markClaimed(locked.get(), workerId, leaseSeconds, doc, now);
                return new ClaimResult(job, system);
            }
            if (batch.size() < batchSize) {
                return new ClaimResult(null, system);
            }
            ClaimCandidate last = batch.get(batch.size() - 1);
            batch = jobRepo.findClaimCandidatesAfter(now, last.priority(), last.createdAt(), last.id(), batchPage);
        }
    }

    private Job markClaimed(Job job, String workerId, int leaseSeconds, TaskDocument doc, Instant now) {
        job.setStatus(JobStatus.RUNNING);
        job.setClaimedBy(workerId);
        job.setLeaseExpiresAt(now.plusSeconds(leaseSeconds));
        job.setNextAttemptAt(null);
        if (job.getStartedAt() == null) job.setStartedAt(now);
        // Fixed on first claim; re-claims keep the original list.
        if (job.getResolvedSteps() == null) job.setResolvedSteps(tasks.writeSteps(doc.steps()));
        if (job.getWorkspaceRef() == null) job.setWorkspaceRef(job.getId().toString());
        jobRepo.save(job);

        log.info("Worker '{}' claimed job {} (type={}, attempt {}/{})",
                workerId, job.getId(), job.getType(), job.getAttempt(), job.getMaxAttempts());
        telemetry.recordClaim(job.getType());
        telemetry.info(job.getId(), "job.claimed", Map.of(
                "workerId",       workerId,
                "type",           job.getType(),
                "attempt",        job.getAttempt(),
                "priority",       job.getPriority(),
                "leaseExpiresAt", job.getLeaseExpiresAt().toString()));
        return job;
    }

    /**
     * Move RUNNING jobs with an expired lease back to QUEUED. Lease expiry is
     * not a failure, so attempt is not incremented; a job already on its last
     * attempt goes to FAILED with retryable=false instead.
     *
     * Also run on a timer by the worker process.
     */
    @Transactional
    public int reclaimExpiredLeases() {
        return sweepExpiredLeases(clock.instant());
    }

    private int sweepExpiredLeases(Instant now) {
        List<Job> expired = jobRepo.lockExpiredLeases(now);
        for (Job job : expired) {
            String previousOwner = job.getClaimedBy();
            boolean exhausted = job.getAttempt() >= job.getMaxAttempts();
            job.releaseLease();
            if (exhausted) {
                job.setStatus(JobStatus.FAILED);
                job.setRetryable(false);
                job.setFinishedAt(now);
                job.setErrorMessage("Lease held by '" + previousOwner + "' expired on attempt "
                        + job.getAttempt() + "/" + job.getMaxAttempts() + "; no attempts left");
            } else {
                job.setStatus(JobStatus.QUEUED);
            }
            jobRepo.save(job);
            log.warn("Lease of job {} held by '{}' expired, now {}", job.getId(), previousOwner, job.getStatus());
            telemetry.warn(job.getId(), "job.lease_expired", Map.of(
                    "previousOwner", String.valueOf(previousOwner),
                    "status",        job.getStatus().name(),
                    "attempt",       job.getAttempt()));
        }
        return expired.size();
    }

    // ------------------------------------------------------------------
    // Lease holder operations
    // ------------------------------------------------------------------

    /**
     * Extend the lease and return the fresh job row, live control state
     * included. The lease only ever moves forward: max(current, now + leaseSeconds).
     *
     * @throws JobOwnershipException if the caller does not own the job or it is not RUNNING
     */
    @Transactional
    public Job heartbeat(UUID jobId, String workerId, int leaseSeconds) {
        requireLease(leaseSeconds);
        Job job = lockJob(jobId);
        if (!job.isOwnedBy(workerId)) {
            throw new JobOwnershipException(jobId, "Worker '" + workerId + "' does not hold job "
                    + jobId + " (status=" + job.getStatus() + ", owner=" + job.getClaimedBy() + ")");
        }
        Instant extended = clock.instant().plusSeconds(leaseSeconds);
        Instant current  = job.getLeaseExpiresAt();
        if (current == null || extended.isAfter(current)) {
            job.setLeaseExpiresAt(extended);
        }
        return jobRepo.save(job);
    }

    @Transactional
    public Job complete(UUID jobId, String workerId, String resultSummary) {
        Job job = lockOwnedJob(jobId, workerId);
        job.setStatus(JobStatus.SUCCEEDED);
        job.setRetryable(false);
        job.setResultSummary(telemetry.scrub(resultSummary));
        job.setFinishedAt(clock.instant());
        job.releaseLease();
        jobRepo.save(job);
        log.info("Job {} SUCCEEDED", jobId);
        telemetry.info(jobId, "job.completed", Map.of("workerId", workerId));
        return job;
    }

    /**
     * Report a failed run. retryable with attempts left → back to QUEUED
     * with attempt+1 and an exponential backoff; otherwise FAILED, keeping
     * the retryable flag so an operator can still re-queue it.
     */
    @Transactional
    public Job fail(UUID jobId, String workerId, String error, boolean retryable) {
        Job job = lockOwnedJob(jobId, workerId);
        Instant now = clock.instant();
        String message = telemetry.scrub(error);
        job.setErrorMessage(message);
        job.setRetryable(retryable);
        job.releaseLease();

        if (retryable && job.getAttempt() < job.getMaxAttempts()) {
            int failedAttempt = job.getAttempt();
            job.setStatus(JobStatus.QUEUED);
            job.setAttempt(failedAttempt + 1);
            job.setNextAttemptAt(now.plus(settings.backoffFor(failedAttempt)));
            jobRepo.save(job);
            log.warn("Job {} failed on attempt {}/{}, re-queued until {}: {}",
                    jobId, failedAttempt, job.getMaxAttempts(), job.getNextAttemptAt(), message);
            telemetry.warn(jobId, "job.retry_scheduled", Map.of(
                    "attempt",       job.getAttempt(),
                    "nextAttemptAt", job.getNextAttemptAt().toString(),
                    "error",         String.valueOf(message)));
        } else {
            job.setStatus(JobStatus.FAILED);
            job.setFinishedAt(now);
            jobRepo.save(job);
            log.error("Job {} FAILED (retryable={}): {}", jobId, retryable, message);
            telemetry.error(jobId, "job.failed", Map.of(
                    "retryable", retryable,
                    "attempt",   job.getAttempt(),
                    "error",     String.valueOf(message)));
        }
        return job;
    }

    /**
     * Give a job back without a verdict (worker shutting down). The job returns
     * to QUEUED with its attempt counter untouched.
     */
    @Transactional
    public Job release(UUID jobId, String workerId, String reason) {
        Job job = lockOwnedJob(jobId, workerId);
        job.setStatus(JobStatus.QUEUED);
        job.releaseLease();
        jobRepo.save(job);
        log.info("Worker '{}' released job {}: {}", workerId, jobId, reason);
        telemetry.info(jobId, "job.released", Map.of("workerId", workerId, "reason", String.valueOf(reason)));
        return job;
    }

    /**
     * Owner acknowledges an operator cancel request observed at a checkpoint.
     */
    @Transactional
    public Job ackCancel(UUID jobId, String workerId, String message) {
        Job job = lockOwnedJob(jobId, workerId);
        if (!job.isCancelRequested()) {
            throw new JobStateException(jobId, "No cancellation was requested for job " + jobId);
        }
        job.setStatus(JobStatus.CANCELLED);
        job.setResultSummary(telemetry.scrub(message));
        job.setFinishedAt(clock.instant());
        job.releaseLease();
        jobRepo.save(job);
        log.info("Job {} CANCELLED (acknowledged by '{}')", jobId, workerId);
        telemetry.info(jobId, "job.cancelled", Map.of("workerId", workerId, "acknowledged", true));
        return job;
    }

    /**
     * Durable publish-once guard. Returns true exactly once per job; the
     * caller publishes only when it gets true.
     */
    @Transactional
    public boolean markPublished(UUID jobId, String workerId) {
        Job job = lockOwnedJob(jobId, workerId);
        if (job.getPublishedAt() != null) {
            log.warn("Job {} was already published at {}; not publishing again", jobId, job.getPublishedAt());
            return false;
        }
        job.setPublishedAt(clock.instant());
        jobRepo.save(job);
        return true;
    }

    // ------------------------------------------------------------------
    // Operator operations
    // ------------------------------------------------------------------

    /**
     * QUEUED jobs are cancelled at once; RUNNING jobs are flagged and the
     * owner stops at its next control checkpoint. Terminal jobs are left alone.
     */
    @Transactional
    public Job requestCancel(UUID jobId, String actor, String reason) {
        Job job = lockJob(jobId);
        Instant now = clock.instant();
        switch (job.getStatus()) {
            case QUEUED -> {
                job.requestCancel(actor, reason, now);
                job.setStatus(JobStatus.CANCELLED);
                job.setFinishedAt(now);
                jobRepo.save(job);
                log.info("Job {} CANCELLED while queued (by {})", jobId, actor);
                telemetry.info(jobId, "job.cancelled", Map.of("actor", String.valueOf(actor), "acknowledged", false));
            }
            case RUNNING -> {
                if (!job.isCancelRequested()) {
                    job.requestCancel(actor, reason, now);
                    jobRepo.save(job);
                    log.info("Cancellation of running job {} requested by {}", jobId, actor);
                    telemetry.info(jobId, "job.cancel_requested", Map.of(
                            "actor",  String.valueOf(actor),
                            "reason", String.valueOf(reason)));
                }
            }
            default -> log.debug("Cancel of job {} ignored: already {}", jobId, job.getStatus());
        }
        return job;
    }

    /**
     * Replay a FAILED job that was left retryable (queue-level retries used
     * up). It starts over with a fresh attempt budget.
     */
    @Transactional
    public Job requeue(UUID jobId, String actor) {
        Job job = lockJob(jobId);
        if (job.getStatus() != JobStatus.FAILED || !job.isRetryable()) {
            throw new JobStateException(jobId, "Only failed jobs marked retryable can be re-queued; job "
                    + jobId + " is " + job.getStatus() + " (retryable=" + job.isRetryable() + ")");
        }
        job.setStatus(JobStatus.QUEUED);
        job.setAttempt(1);
        job.setRetryable(false);
        job.setNextAttemptAt(null);
        job.setFinishedAt(null);
        jobRepo.save(job);
        log.info("Job {} re-queued by {}", jobId, actor);
        telemetry.info(jobId, "job.requeued", Map.of("actor", String.valueOf(actor)));
        return job;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Job get(UUID jobId) {
        return jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Transactional(readOnly = true)
    public List<Job> list(JobStatus status, String type, int limit) {
        int size = Math.max(1, Math.min(limit, 500));
        return jobRepo.search(status, type, PageRequest.of(0, size));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Job lockJob(UUID jobId) {
        return jobRepo.findByIdForUpdate(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /** Terminal → state error; otherwise the caller must hold the lease. */
    private Job lockOwnedJob(UUID jobId, String workerId) {
        Job job = lockJob(jobId);
        if (job.getStatus().isTerminal()) {
            throw new JobStateException(jobId, "Job " + jobId + " is already " + job.getStatus());
        }
        if (!job.isOwnedBy(workerId)) {
            throw new JobOwnershipException(jobId, "Worker '" + workerId + "' does not hold job "
                    + jobId + " (status=" + job.getStatus() + ", owner=" + job.getClaimedBy() + ")");
        }
        return job;
    }

    private static void requireWorker(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new QueueValidationException("workerId is required");
        }
    }

    private void requireLease(int leaseSeconds) {
        if (leaseSeconds < 1 || leaseSeconds > settings.maxLeaseSeconds()) {
            throw new QueueValidationException("leaseSeconds must be between 1 and "
                    + settings.maxLeaseSeconds() + ", got " + leaseSeconds);
        }
    }

    private static Set<String> normalized(Collection<String> values, boolean lowerCase) {
        if (values == null) return Set.of();
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::strip)
                .map(v -> lowerCase ? v.toLowerCase(Locale.ROOT) : v)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
