package com.stepwright.orchestrator.worker;

import com.stepwright.orchestrator.execution.JobRunner;
import com.stepwright.orchestrator.heal.LiveControlGate;
import com.stepwright.orchestrator.model.Job;
import com.stepwright.orchestrator.service.ClaimResult;
import com.stepwright.orchestrator.service.QueueService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process worker. Every tick claims jobs while a slot is free and runs
 * each on the fixed worker pool. The DB is the queue; claim is the dequeue.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "stepwright.worker.enabled", havingValue = "true", matchIfMissing = true)
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final QueueService    queueService;
    private final JobRunner       jobRunner;
    private final LiveControlGate gate;
    private final int             concurrency;
    private final int             leaseSeconds;
    private final String          workerPrefix;
    private final List<String>    allowedTypes;
    private final List<String>    capabilities;

    private final ExecutorService workers;
    private final AtomicInteger   busy = new AtomicInteger();

    public JobScheduler(QueueService queueService,
                        JobRunner jobRunner,
                        LiveControlGate gate,
                        @Value("${stepwright.worker.concurrency:4}") int concurrency,
                        @Value("${stepwright.worker.lease-seconds:120}") int leaseSeconds,
                        @Value("${stepwright.worker.id-prefix:worker}") String workerPrefix,
                        @Value("${stepwright.worker.allowed-types:}") List<String> allowedTypes,
                        @Value("${stepwright.worker.capabilities:}") List<String> capabilities) {
        this.queueService = queueService;
        this.jobRunner    = jobRunner;
        this.gate         = gate;
        this.concurrency  = Math.max(1, concurrency);
        this.leaseSeconds = leaseSeconds;
        this.workerPrefix = workerPrefix;
        this.allowedTypes = allowedTypes;
        this.capabilities = capabilities;
        this.workers      = Executors.newFixedThreadPool(this.concurrency);
    }

    @Scheduled(fixedDelayString = "${stepwright.worker.poll-millis:2000}")
    public void tick() {
        while (!gate.isStopping() && busy.get() < concurrency) {
            String workerId = workerPrefix + "-" + UUID.randomUUID().toString().substring(0, 8);
            ClaimResult result;
            try {
                result = queueService.claim(workerId, leaseSeconds, allowedTypes, capabilities);
            } catch (RuntimeException e) {
                log.warn("Claim failed, retrying next tick: {}", e.getMessage());
                return;
            }
            Optional<Job> claimed = result.claimed();
            if (claimed.isEmpty()) {
                return;
            }
            dispatch(claimed.get(), workerId);
        }
    }

    private void dispatch(Job job, String workerId) {
        busy.incrementAndGet();
        workers.submit(() -> {
            try {
                jobRunner.run(job, workerId, leaseSeconds);
            } catch (RuntimeException e) {
                log.error("Unhandled error in worker for job {}: {}", job.getId(), e.getMessage(), e);
            } finally {
                busy.decrementAndGet();
            }
        });
    }

    int busySlots() {
        return busy.get();
    }

    /**
     * Stop claiming, let running jobs reach their next checkpoint and hand
     * themselves back, then interrupt whatever is left.
     */
    @PreDestroy
    public void stop() throws InterruptedException {
        gate.requestStop();
        workers.shutdown();
        if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("Workers still busy after 30s, interrupting");
            workers.shutdownNow();
        }
    }
}
