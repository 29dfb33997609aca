package com.stepwright.orchestrator.repository;

import com.stepwright.orchestrator.model.WorkerPauseState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface WorkerPauseStateRepository extends JpaRepository<WorkerPauseState, Integer> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WorkerPauseState w WHERE w.id = :id")
    Optional<WorkerPauseState> findByIdForUpdate(@Param("id") Integer id);
}
