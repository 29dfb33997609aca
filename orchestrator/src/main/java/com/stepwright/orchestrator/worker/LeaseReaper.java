package com.stepwright.orchestrator.worker;

import com.stepwright.orchestrator.service.QueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Returns jobs with an expired lease to the queue even when no worker is
 * claiming (claim runs the same sweep first).
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "stepwright.worker.enabled", havingValue = "true", matchIfMissing = true)
public class LeaseReaper {

    private static final Logger log = LoggerFactory.getLogger(LeaseReaper.class);

    private final QueueService queueService;

    public LeaseReaper(QueueService queueService) {
        this.queueService = queueService;
    }

    @Scheduled(fixedDelayString = "${stepwright.worker.reaper-millis:60000}")
    public void reap() {
        try {
            int reclaimed = queueService.reclaimExpiredLeases();
            if (reclaimed > 0) {
                log.info("Reclaimed {} job(s) with expired leases", reclaimed);
            }
        } catch (RuntimeException e) {
            log.warn("Lease sweep failed: {}", e.getMessage());
        }
    }
}
