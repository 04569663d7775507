package com.company.reporting.notification;

import com.company.reporting.domain.AlertInstance;
import com.company.reporting.domain.AlertRule;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Channel-neutral view of a triggered alert.
 */
@Getter
@Builder
public class AlertNotification {
    private final Long ruleId;
    private final String ruleName;
    private final Long instanceId;
    private final String severity;
    private final Double value;
    private final Double threshold;
    private final String operator;
    private final String message;
    private final Instant triggeredAt;

    public static AlertNotification from(AlertRule rule, AlertInstance instance) {
        return AlertNotification.builder()
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .instanceId(instance.getId())
                .severity(instance.getSeverity() != null ? instance.getSeverity().toValue() : null)
                .value(instance.getTriggeredValue())
                .threshold(rule.getThresholdValue())
                .operator(rule.getComparisonOperator() != null ? rule.getComparisonOperator().getSymbol() : null)
                .message(instance.getMessage())
                .triggeredAt(instance.getTriggeredAt())
                .build();
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alert_rule_id", ruleId);
        payload.put("alert_name", ruleName);
        payload.put("alert_instance_id", instanceId);
        payload.put("severity", severity);
        payload.put("value", value);
        payload.put("threshold", threshold);
        payload.put("operator", operator);
        payload.put("message", message);
        payload.put("triggered_at", triggeredAt != null ? triggeredAt.toString() : null);
        return payload;
    }
}
