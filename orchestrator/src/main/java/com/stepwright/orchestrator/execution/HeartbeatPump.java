package com.stepwright.orchestrator.execution;

import com.stepwright.orchestrator.service.JobOwnershipException;
import com.stepwright.orchestrator.service.QueueService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Renews a running job's lease in the background while a long attempt
 * keeps the worker thread busy.
 *
 * Interval is a third of the lease, clamped to 1..30 s. Transient errors are
 * logged and retried on the next beat; losing ownership stops the pump.
 */
@Component
public class HeartbeatPump {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatPump.class);

    private final QueueService queueService;

    private final AtomicInteger threadSeq = new AtomicInteger();
    private final ScheduledExecutorService beats = Executors.newScheduledThreadPool(1, r -> {
        Thread t = new Thread(r, "heartbeat-" + threadSeq.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public HeartbeatPump(QueueService queueService) {
        this.queueService = queueService;
    }

    public Handle start(UUID jobId, String workerId, int leaseSeconds) {
        long interval = intervalSeconds(leaseSeconds);
        Handle handle = new Handle();
        handle.future = beats.scheduleWithFixedDelay(() -> beat(handle, jobId, workerId, leaseSeconds),
                interval, interval, TimeUnit.SECONDS);
        return handle;
    }

    static long intervalSeconds(int leaseSeconds) {
        return Math.max(1, Math.min(30, leaseSeconds / 3));
    }

    private void beat(Handle handle, UUID jobId, String workerId, int leaseSeconds) {
        try {
            queueService.heartbeat(jobId, workerId, leaseSeconds);
        } catch (JobOwnershipException e) {
            log.warn("Stopping heartbeats for job {}: {}", jobId, e.getMessage());
            handle.close();
        } catch (RuntimeException e) {
            log.warn("Heartbeat for job {} failed, will retry: {}", jobId, e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        beats.shutdownNow();
    }

    /** Stops the pump when closed. */
    public static final class Handle implements AutoCloseable {

        private volatile ScheduledFuture<?> future;

        @Override
        public void close() {
            ScheduledFuture<?> f = future;
            if (f != null) f.cancel(false);
        }
    }
}
