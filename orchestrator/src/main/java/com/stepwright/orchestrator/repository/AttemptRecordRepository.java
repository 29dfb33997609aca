package com.stepwright.orchestrator.repository;

import com.stepwright.orchestrator.model.AttemptRecord;
import com.stepwright.orchestrator.model.SelfHealStrategy;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface AttemptRecordRepository extends JpaRepository<AttemptRecord, Long> {

    List<AttemptRecord> findByJobIdOrderByIdAsc(UUID jobId);

    /** Highest attempt number used so far for a step; 0 if it never ran. */
    @Query("""
            SELECT COALESCE(MAX(a.attempt), 0) FROM AttemptRecord a
            WHERE a.jobId = :jobId AND a.stepIndex = :stepIndex
            """)
    int findMaxAttempt(@Param("jobId") UUID jobId, @Param("stepIndex") int stepIndex);

    /** Hard resets already spent by a job, across every claim of it. */
    long countByJobIdAndStrategy(UUID jobId, SelfHealStrategy strategy);
}
