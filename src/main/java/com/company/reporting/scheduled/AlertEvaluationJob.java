package com.company.reporting.scheduled;

import com.company.reporting.service.AlertEvaluationService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Periodic alert evaluation tick.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "reporting.alerts.evaluation.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class AlertEvaluationJob {

    private final AlertEvaluationService evaluationService;
    private final MeterRegistry meterRegistry;

    @Scheduled(
            fixedDelayString = "${reporting.alerts.evaluation.interval-ms:60000}",
            initialDelayString = "${reporting.alerts.evaluation.initial-delay-ms:30000}"
    )
    public void evaluateAlerts() {
        Instant startTime = Instant.now();

        try {
            int triggered = evaluationService.evaluateAll();

            Duration executionTime = Duration.between(startTime, Instant.now());
            if (triggered > 0) {
                log.info("Alert evaluation completed: {} new alert(s) in {}ms", triggered, executionTime.toMillis());
            } else {
                log.debug("Alert evaluation completed in {}ms, nothing triggered", executionTime.toMillis());
            }
            meterRegistry.timer("alerts.evaluation.duration").record(executionTime);

        } catch (Exception e) {
            log.error("Alert evaluation job failed", e);
            meterRegistry.counter("alerts.evaluation.job.failures").increment();
        }
    }
}
