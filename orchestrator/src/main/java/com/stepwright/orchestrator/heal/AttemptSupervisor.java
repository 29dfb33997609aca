package com.stepwright.orchestrator.heal;

import com.stepwright.orchestrator.executor.StepInvocation;
import com.stepwright.orchestrator.executor.StepOutcome;
import com.stepwright.orchestrator.executor.StepRuntime;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one step attempt on a separate daemon thread and enforces the
 * wall-clock and idle watchdogs from the calling (worker) thread.
 *
 * On a trip the attempt thread is interrupted and the runtime is told to
 * terminate. The supervisor returns right away; a runtime that ignores both
 * is left to finish on its own daemon thread.
 */
@Component
public class AttemptSupervisor {

    private static final Logger log = LoggerFactory.getLogger(AttemptSupervisor.class);

    private final Duration pollInterval;

    private final AtomicInteger threadSeq = new AtomicInteger();
    private final ExecutorService runtimePool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "step-runtime-" + threadSeq.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public AttemptSupervisor(@Value("${stepwright.self-heal.watchdog-poll-millis:1000}") long pollMillis) {
        this.pollInterval = Duration.ofMillis(Math.max(10, pollMillis));
    }

    /**
     * @throws InterruptedException if the worker thread itself is interrupted;
     *         the attempt is cancelled and terminated before this propagates
     */
    public SupervisedRun run(StepRuntime runtime, StepInvocation invocation,
                             Duration wallTimeout, Duration idleTimeout) throws InterruptedException {
        long start = System.nanoTime();
        AtomicLong lastPulse = new AtomicLong(start);
        AtomicLong longestGap = new AtomicLong(0);

        Future<StepOutcome> future = runtimePool.submit(() -> runtime.execute(invocation, () -> {
            long now = System.nanoTime();
            long gap = now - lastPulse.getAndSet(now);
            longestGap.accumulateAndGet(gap, Math::max);
        }));

        long wallNanos = wallTimeout.toNanos();
        long idleNanos = idleTimeout.toNanos();

        while (true) {
            long now = System.nanoTime();
            long waitNanos = Math.min(pollInterval.toNanos(),
                    Math.min(start + wallNanos - now, lastPulse.get() + idleNanos - now));
            try {
                StepOutcome outcome = future.get(Math.max(TimeUnit.MILLISECONDS.toNanos(1), waitNanos),
                        TimeUnit.NANOSECONDS);
                return new SupervisedRun(outcome, null, WatchdogTrip.NONE,
                        elapsedSince(start), idle(lastPulse, longestGap), false);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Runtime failed for job {} step {}: {}",
                        invocation.jobId(), invocation.step().stepId(), cause.toString());
                return new SupervisedRun(null, cause, WatchdogTrip.NONE,
                        elapsedSince(start), idle(lastPulse, longestGap), false);
            } catch (TimeoutException e) {
                long t = System.nanoTime();
                WatchdogTrip trip = WatchdogTrip.NONE;
                if (t - start >= wallNanos) {
                    trip = WatchdogTrip.WALL_CLOCK;
                } else if (t - lastPulse.get() >= idleNanos) {
                    trip = WatchdogTrip.IDLE;
                }
                if (trip != WatchdogTrip.NONE) {
                    Duration longestIdle = idle(lastPulse, longestGap);
                    log.warn("Watchdog {} tripped for job {} step {} attempt {}",
                            trip.wireName(), invocation.jobId(), invocation.step().stepId(), invocation.attempt());
                    stop(runtime, invocation, future);
                    return new SupervisedRun(null, null, trip, elapsedSince(start), longestIdle, true);
                }
            } catch (InterruptedException e) {
                stop(runtime, invocation, future);
                throw e;
            }
        }
    }

    private static void stop(StepRuntime runtime, StepInvocation invocation, Future<?> future) {
        future.cancel(true);
        try {
            runtime.terminate(invocation);
        } catch (RuntimeException e) {
            log.warn("Terminating runtime for job {} step {} failed: {}",
                    invocation.jobId(), invocation.step().stepId(), e.getMessage());
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static Duration idle(AtomicLong lastPulse, AtomicLong longestGap) {
        long trailing = System.nanoTime() - lastPulse.get();
        return Duration.ofNanos(Math.max(trailing, longestGap.get()));
    }

    @PreDestroy
    public void shutdown() {
        runtimePool.shutdownNow();
    }
}
