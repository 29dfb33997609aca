package com.stepwright.orchestrator.repository;

import com.stepwright.orchestrator.model.StepCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface StepCheckpointRepository extends JpaRepository<StepCheckpoint, Long> {

    /** Oldest first within each index, so later rows override earlier ones when folded. */
    List<StepCheckpoint> findByJobIdOrderByStepIndexAscIdAsc(UUID jobId);
}
