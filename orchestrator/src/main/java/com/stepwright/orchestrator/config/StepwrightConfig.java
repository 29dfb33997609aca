package com.stepwright.orchestrator.config;

import com.stepwright.orchestrator.heal.SelfHealConfig;
import com.stepwright.orchestrator.service.QueueSettings;
import com.stepwright.orchestrator.telemetry.SecretScrubber;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the plain (non-component) settings objects from {@code stepwright.*}.
 * Invalid values fail startup.
 */
@Configuration
public class StepwrightConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    SecretScrubber secretScrubber(@Value("${stepwright.scrub.extra-values:}") List<String> extraValues) {
        return SecretScrubber.fromEnvironment(extraValues);
    }

    @Bean
    QueueSettings queueSettings(
            @Value("${stepwright.queue.retry-backoff-base-seconds:5}") long backoffBaseSeconds,
            @Value("${stepwright.queue.retry-backoff-max-seconds:300}") long backoffMaxSeconds,
            @Value("${stepwright.queue.claim-batch-size:200}") int claimBatchSize,
            @Value("${stepwright.queue.max-lease-seconds:3600}") int maxLeaseSeconds) {
        return new QueueSettings(Duration.ofSeconds(backoffBaseSeconds), Duration.ofSeconds(backoffMaxSeconds),
                claimBatchSize, maxLeaseSeconds);
    }

    @Bean
    SelfHealConfig selfHealConfig(
            @Value("${stepwright.self-heal.step-max-attempts:3}") int stepMaxAttempts,
            @Value("${stepwright.self-heal.step-timeout-seconds:900}") long stepTimeoutSeconds,
            @Value("${stepwright.self-heal.step-idle-timeout-seconds:300}") long idleTimeoutSeconds,
            @Value("${stepwright.self-heal.step-no-progress-limit:2}") int noProgressLimit,
            @Value("${stepwright.self-heal.job-max-hard-resets:1}") int jobMaxHardResets) {
        return new SelfHealConfig(stepMaxAttempts, Duration.ofSeconds(stepTimeoutSeconds),
                Duration.ofSeconds(idleTimeoutSeconds), noProgressLimit, jobMaxHardResets);
    }
}
