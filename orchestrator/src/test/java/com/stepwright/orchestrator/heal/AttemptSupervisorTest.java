package com.stepwright.orchestrator.heal;

import com.stepwright.orchestrator.executor.ActivityListener;
import com.stepwright.orchestrator.executor.StepInvocation;
import com.stepwright.orchestrator.executor.StepOutcome;
import com.stepwright.orchestrator.executor.StepRuntime;
import com.stepwright.orchestrator.task.ResolvedStep;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the supervisor against small in-process runtimes with real threads
 * and short timeouts.
 */
class AttemptSupervisorTest {

    final AttemptSupervisor supervisor = new AttemptSupervisor(10);

    final StepInvocation invocation = new StepInvocation(UUID.randomUUID(), "ws",
            new ResolvedStep(0, "fix", null, "Apply the fix", "auto"), 1, 1, "Apply the fix", null);

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    /** Runtime that sleeps, pulsing every {@code pulseMillis} (0 = never), until done or interrupted. */
    static class SleepyRuntime implements StepRuntime {
        final long          runMillis;
        final long          pulseMillis;
        final AtomicBoolean terminated = new AtomicBoolean();

        SleepyRuntime(long runMillis, long pulseMillis) {
            this.runMillis   = runMillis;
            this.pulseMillis = pulseMillis;
        }

        @Override
        public StepOutcome execute(StepInvocation inv, ActivityListener activity) throws InterruptedException {
            long deadline = System.currentTimeMillis() + runMillis;
            while (System.currentTimeMillis() < deadline) {
                Thread.sleep(pulseMillis > 0 ? pulseMillis : 5);
                if (pulseMillis > 0) activity.pulse();
            }
            return StepOutcome.success("done", "", List.of());
        }

        @Override
        public void terminate(StepInvocation inv) {
            terminated.set(true);
        }
    }

    @Test
    void run_finishesInTime_returnsOutcome() throws Exception {
        SleepyRuntime runtime = new SleepyRuntime(50, 10);

        SupervisedRun run = supervisor.run(runtime, invocation, Duration.ofSeconds(5), Duration.ofSeconds(5));

        assertThat(run.completedNormally()).isTrue();
        assertThat(run.outcome().summary()).isEqualTo("done");
        assertThat(run.terminated()).isFalse();
        assertThat(runtime.terminated).isFalse();
    }

    @Test
    void run_exceedsWallClock_tripsAndTerminates() throws Exception {
        SleepyRuntime runtime = new SleepyRuntime(10_000, 10);

        SupervisedRun run = supervisor.run(runtime, invocation, Duration.ofMillis(200), Duration.ofSeconds(5));

        assertThat(run.trip()).isEqualTo(WatchdogTrip.WALL_CLOCK);
        assertThat(run.terminated()).isTrue();
        assertThat(runtime.terminated).isTrue();
        assertThat(run.effectiveOutcome().errorMessage()).startsWith("watchdog wall_clock:");
    }

    @Test
    void run_silentRuntime_tripsIdle() throws Exception {
        SleepyRuntime runtime = new SleepyRuntime(10_000, 0);

        SupervisedRun run = supervisor.run(runtime, invocation, Duration.ofSeconds(5), Duration.ofMillis(150));

        assertThat(run.trip()).isEqualTo(WatchdogTrip.IDLE);
        assertThat(run.longestIdle()).isGreaterThanOrEqualTo(Duration.ofMillis(150));
        assertThat(run.effectiveOutcome().errorMessage()).startsWith("watchdog idle:");
    }

    @Test
    void run_runtimeThrows_reportedAsError() throws Exception {
        StepRuntime runtime = new StepRuntime() {
            @Override
            public StepOutcome execute(StepInvocation inv, ActivityListener activity) {
                throw new IllegalStateException("executor unreachable");
            }

            @Override
            public void terminate(StepInvocation inv) {
            }
        };

        SupervisedRun run = supervisor.run(runtime, invocation, Duration.ofSeconds(5), Duration.ofSeconds(5));

        assertThat(run.completedNormally()).isFalse();
        assertThat(run.error()).isInstanceOf(IllegalStateException.class);
        assertThat(run.effectiveOutcome().succeeded()).isFalse();
        assertThat(run.effectiveOutcome().errorMessage()).isEqualTo("runtime error: executor unreachable");
    }
}
