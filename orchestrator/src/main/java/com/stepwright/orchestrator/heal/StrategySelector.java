package com.stepwright.orchestrator.heal;

import com.stepwright.orchestrator.model.FailureClass;
import com.stepwright.orchestrator.model.SelfHealStrategy;

/**
 * Decision table from failure class and remaining budgets to a recovery strategy.
 */
public class StrategySelector {

    /**
     * @param strategy    what to do next
     * @param retryStep   true when the step gets another attempt in this claim
     * @param retryable   for a stop: whether the queue may retry the job later
     */
    public record Decision(SelfHealStrategy strategy, boolean retryStep, boolean retryable) {

        static Decision softReset() { return new Decision(SelfHealStrategy.SOFT_RESET, true, false); }
        static Decision hardReset() { return new Decision(SelfHealStrategy.HARD_RESET, true, false); }
        static Decision terminal()  { return new Decision(SelfHealStrategy.NONE, false, false); }

        static Decision queueRetry(boolean retryable) {
            return new Decision(SelfHealStrategy.QUEUE_RETRY, false, retryable);
        }
    }

    private final SelfHealConfig config;

    public StrategySelector(SelfHealConfig config) {
        this.config = config;
    }

    /**
     * @param hardResetsRemaining automatic hard resets the job may still spend
     * @param jobAttempt          current queue-level attempt of the job
     * @param jobMaxAttempts      queue-level attempt limit of the job
     */
    public Decision select(FailureClass cls, StepAttemptState state, int hardResetsRemaining,
                           int jobAttempt, int jobMaxAttempts) {
        if (cls.forbidsRetry()) {
            return Decision.terminal();
        }
        boolean noProgressLeft = !state.noProgressExhausted(config.noProgressLimit());
        if (!cls.isQueueRetryable()) {
            // Repo failures only get a rebuild, and only while the step is still making progress.
            return hardResetsRemaining > 0 && noProgressLeft ? Decision.hardReset() : Decision.terminal();
        }
        if (state.windowAttempts() < config.stepMaxAttempts() && noProgressLeft) {
            return Decision.softReset();
        }
        if (hardResetsRemaining > 0) {
            return Decision.hardReset();
        }
        return Decision.queueRetry(jobAttempt < jobMaxAttempts);
    }
}
