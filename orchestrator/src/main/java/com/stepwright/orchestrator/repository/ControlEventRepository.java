package com.stepwright.orchestrator.repository;

import com.stepwright.orchestrator.model.ControlEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ControlEventRepository extends JpaRepository<ControlEvent, Long> {

    List<ControlEvent> findByJobIdOrderByIdAsc(UUID jobId);

    /** System-wide events (worker pause) have no job. */
    List<ControlEvent> findTop50ByJobIdIsNullOrderByIdDesc();
}
