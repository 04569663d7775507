package com.company.reporting.service;

import com.company.reporting.domain.AlertInstance;
import com.company.reporting.domain.AlertRule;
import com.company.reporting.domain.enums.AlertInstanceStatus;
import com.company.reporting.domain.enums.ComparisonOperator;
import com.company.reporting.domain.enums.Severity;
import com.company.reporting.event.AlertTriggeredEvent;
import com.company.reporting.repository.AlertInstanceRepository;
import com.company.reporting.repository.AlertRuleRepository;
import com.company.reporting.util.ThresholdComparator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One pass over enabled alert rules: fetch the metric, compare it with the
 * threshold, raise at most one ACTIVE instance per rule.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertEvaluationService {

    private final AlertRuleRepository ruleRepository;
    private final AlertInstanceRepository instanceRepository;
    private final AlertMetricResolver metricResolver;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * @return number of new alert instances created
     */
    public int evaluateAll() {
        List<AlertRule> rules = ruleRepository.findAllEnabled();
        log.debug("Evaluating {} enabled alert rules", rules.size());

        int triggered = 0;
        for (AlertRule rule : rules) {
            try {
                if (evaluateRule(rule).isPresent()) {
                    triggered++;
                }
            } catch (Exception e) {
                log.error("Evaluation of alert rule {} failed", rule.getId(), e);
                meterRegistry.counter("alerts.evaluation.failures").increment();
            }
        }
        return triggered;
    }

    public Optional<AlertInstance> evaluateRule(AlertRule rule) {
        meterRegistry.counter("alerts.evaluations").increment();

        Optional<Double> value;
        try {
            value = metricResolver.resolve(rule);
        } catch (Exception e) {
            log.warn("Skipping alert rule {}: metric fetch failed: {}", rule.getId(), e.getMessage());
            meterRegistry.counter("alerts.evaluation.failures").increment();
            return Optional.empty();
        }

        if (value.isEmpty()) {
            log.warn("Skipping alert rule {}: no metric value available", rule.getId());
            return Optional.empty();
        }

        Instant now = clock.instant();
        Optional<AlertInstance> created = Optional.empty();

        if (ThresholdComparator.compare(value.get(), rule.getThresholdValue(), rule.getComparisonOperator())) {
            created = raiseInstance(rule, value.get(), now);
        }

        rule.setLastEvaluatedAt(now);
        ruleRepository.updateLastEvaluatedAt(rule.getId(), now);
        return created;
    }

    private Optional<AlertInstance> raiseInstance(AlertRule rule, double value, Instant now) {
        if (instanceRepository.findActiveByRuleId(rule.getId()).isPresent()) {
            log.debug("Alert rule {} still breached, active instance already open", rule.getId());
            meterRegistry.counter("alerts.instances.deduplicated").increment();
            return Optional.empty();
        }

        Severity severity = rule.getSeverity() != null ? rule.getSeverity() : Severity.MEDIUM;
        AlertInstance instance = AlertInstance.builder()
                .alertRuleId(rule.getId())
                .severity(severity)
                .status(AlertInstanceStatus.ACTIVE)
                .triggeredValue(value)
                .message(buildMessage(rule, value))
                .triggeredAt(now)
                .autoResolved(false)
                .build();

        try {
            instance = instanceRepository.save(instance);
        } catch (DuplicateKeyException e) {
            log.warn("Active alert instance for rule {} created concurrently, skipping", rule.getId());
            meterRegistry.counter("alerts.instances.deduplicated").increment();
            return Optional.empty();
        }

        rule.setLastTriggeredAt(now);
        ruleRepository.updateLastTriggeredAt(rule.getId(), now);

        meterRegistry.counter("alerts.instances.created", "severity", severity.toValue()).increment();
        log.info("Alert rule {} triggered: {}", rule.getId(), instance.getMessage());

        eventPublisher.publishEvent(new AlertTriggeredEvent(rule, instance));
        return Optional.of(instance);
    }

    private String buildMessage(AlertRule rule, double value) {
        ComparisonOperator operator = rule.getComparisonOperator() != null
                ? rule.getComparisonOperator() : ComparisonOperator.UNKNOWN;
        return "Alert " + rule.getName() + ": " + value + " " + operator.getSymbol() + " " + rule.getThresholdValue();
    }
}
