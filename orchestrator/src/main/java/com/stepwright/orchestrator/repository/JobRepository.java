package com.stepwright.orchestrator.repository;

import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.model.JobStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + claim queries for the jobs table.
 *
 * Lock timeout -2 is Hibernate's SKIP_LOCKED: on PostgreSQL the locking
 * queries render as FOR UPDATE SKIP LOCKED, so a row another claimer holds is
 * passed over instead of waited on.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    String SKIP_LOCKED = "-2";

    /**
     * First batch of queued jobs in claim order: priority DESC, created_at ASC, id ASC.
     * Read without locks; the caller locks one row at a time with
     * {@link #lockQueuedForClaim}.
     */
    @Query("""
            SELECT new com.stepwright.orchestrator.repository.ClaimCandidate(
                   j.id, j.type, j.payload, j.priority, j.createdAt)
            FROM Job j
            WHERE j.status = com.stepwright.orchestrator.model.JobStatus.QUEUED
              AND (j.nextAttemptAt IS NULL OR j.nextAttemptAt <= :now)
            ORDER BY j.priority DESC, j.createdAt ASC, j.id ASC
            """)
    List<ClaimCandidate> findClaimCandidates(@Param("now") Instant now, Pageable page);

    /**
     * Next batch in claim order, strictly after the given candidate. Keyed on
     * the sort columns rather than an offset, so rows claimed by other workers
     * in the meantime cannot shift an eligible job out of view.
     */
    @Query("""
            SELECT new com.stepwright.orchestrator.repository.ClaimCandidate(
                   j.id, j.type, j.payload, j.priority, j.createdAt)
            FROM Job j
            WHERE j.status = com.stepwright.orchestrator.model.JobStatus.QUEUED
              AND (j.nextAttemptAt IS NULL OR j.nextAttemptAt <= :now)
              AND (j.priority < :priority
                   OR (j.priority = :priority AND j.createdAt > :createdAt)
                   OR (j.priority = :priority AND j.createdAt = :createdAt AND j.id > :id))
            ORDER BY j.priority DESC, j.createdAt ASC, j.id ASC
            """)
    List<ClaimCandidate> findClaimCandidatesAfter(@Param("now") Instant now,
                                                  @Param("priority") int priority,
                                                  @Param("createdAt") Instant createdAt,
                                                  @Param("id") UUID id,
                                                  Pageable page);

    /**
     * Lock one candidate if it is still QUEUED and nobody else holds it.
     * Empty means: already claimed, or locked by a concurrent claimer.
     *
     * Must run inside the caller's transaction; the lock is held until commit.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = SKIP_LOCKED))
    @Query("""
            SELECT j FROM Job j
            WHERE j.id = :id
              AND j.status = com.stepwright.orchestrator.model.JobStatus.QUEUED
            """)
    Optional<Job> lockQueuedForClaim(@Param("id") UUID id);

    /** RUNNING jobs whose lease has run out. Locked rows are left for the next sweep. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = SKIP_LOCKED))
    @Query("""
            SELECT j FROM Job j
            WHERE j.status = com.stepwright.orchestrator.model.JobStatus.RUNNING
              AND j.leaseExpiresAt < :now
            """)
    List<Job> lockExpiredLeases(@Param("now") Instant now);

    /**
     * Blocking row lock for lease-holder and operator writes; serializes the
     * two so neither loses the other's update.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            SELECT j FROM Job j
            WHERE (:status IS NULL OR j.status = :status)
              AND (:type IS NULL OR j.type = :type)
            ORDER BY j.createdAt DESC
            """)
    List<Job> search(@Param("status") JobStatus status, @Param("type") String type, Pageable page);
}
