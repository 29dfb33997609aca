package com.stepwright.orchestrator.service;

import com.stepwright.orchestrator.model.ControlEvent;
import com.stepwright.orchestrator.model.WorkerPauseMode;
import com.stepwright.orchestrator.model.WorkerPauseState;
import com.stepwright.orchestrator.repository.ControlEventRepository;
import com.stepwright.orchestrator.repository.WorkerPauseStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Global worker pause: DRAIN stops new claims, QUIESCE also holds running
 * jobs at their next control checkpoint. Every change is audited as a
 * {@link ControlEvent} without a job id.
 */
@Service
public class WorkerPauseService {

    private static final Logger log = LoggerFactory.getLogger(WorkerPauseService.class);

    private final WorkerPauseStateRepository pauseRepo;
    private final ControlEventRepository     controlEvents;
    private final Clock                      clock;

    public WorkerPauseService(WorkerPauseStateRepository pauseRepo,
                              ControlEventRepository controlEvents,
                              Clock clock) {
        this.pauseRepo     = pauseRepo;
        this.controlEvents = controlEvents;
        this.clock         = clock;
    }

    /** Current state; an unpaused default if the row was never written. */
    @Transactional(readOnly = true)
    public WorkerPauseState current() {
        return pauseRepo.findById(WorkerPauseState.SINGLETON_ID).orElseGet(WorkerPauseState::new);
    }

    @Transactional
    public WorkerPauseState pause(WorkerPauseMode mode, String reason, String actor) {
        if (reason == null || reason.isBlank()) {
            throw new QueueValidationException("A reason is required to pause workers");
        }
        WorkerPauseMode effective = mode == null ? WorkerPauseMode.DRAIN : mode;
        WorkerPauseState state = lockedState();
        state.apply(true, effective, reason, actor, clock.instant());
        pauseRepo.save(state);
        controlEvents.save(new ControlEvent(null, "worker.pause", null,
                effective.name().toLowerCase(Locale.ROOT), reason, actor, clock.instant()));
        log.warn("Workers paused ({}) by {}: {}", effective, actor, reason);
        return state;
    }

    @Transactional
    public WorkerPauseState resume(String reason, String actor) {
        WorkerPauseState state = lockedState();
        state.apply(false, state.getMode(), reason, actor, clock.instant());
        pauseRepo.save(state);
        controlEvents.save(new ControlEvent(null, "worker.resume", null, null, reason, actor, clock.instant()));
        log.info("Workers resumed by {}", actor);
        return state;
    }

    @Transactional(readOnly = true)
    public List<ControlEvent> recentEvents() {
        return controlEvents.findTop50ByJobIdIsNullOrderByIdDesc();
    }

    private WorkerPauseState lockedState() {
        return pauseRepo.findByIdForUpdate(WorkerPauseState.SINGLETON_ID)
                .orElseGet(WorkerPauseState::new);
    }
}
