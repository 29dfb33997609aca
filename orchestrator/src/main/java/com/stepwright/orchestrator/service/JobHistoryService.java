package com.stepwright.orchestrator.service;

import com.stepwright.orchestrator.model.AttemptRecord;
import com.stepwright.orchestrator.model.JobEvent;
import com.stepwright.orchestrator.model.StepCheckpoint;
import com.stepwright.orchestrator.repository.AttemptRecordRepository;
import com.stepwright.orchestrator.repository.JobEventRepository;
import com.stepwright.orchestrator.repository.JobRepository;
import com.stepwright.orchestrator.repository.StepCheckpointRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Read-only audit trail of a job: attempts, checkpoints and telemetry events.
 */
@Service
@Transactional(readOnly = true)
public class JobHistoryService {

    private final JobRepository            jobRepo;
    private final AttemptRecordRepository  attempts;
    private final StepCheckpointRepository checkpoints;
    private final JobEventRepository       events;

    public JobHistoryService(JobRepository jobRepo,
                             AttemptRecordRepository attempts,
                             StepCheckpointRepository checkpoints,
                             JobEventRepository events) {
        this.jobRepo     = jobRepo;
        this.attempts    = attempts;
        this.checkpoints = checkpoints;
        this.events      = events;
    }

    public List<AttemptRecord> attempts(UUID jobId) {
        requireJob(jobId);
        return attempts.findByJobIdOrderByIdAsc(jobId);
    }

    public List<StepCheckpoint> checkpoints(UUID jobId) {
        requireJob(jobId);
        return checkpoints.findByJobIdOrderByStepIndexAscIdAsc(jobId);
    }

    public List<JobEvent> events(UUID jobId) {
        requireJob(jobId);
        return events.findByJobIdOrderByIdAsc(jobId);
    }

    private void requireJob(UUID jobId) {
        if (!jobRepo.existsById(jobId)) throw new JobNotFoundException(jobId);
    }
}
