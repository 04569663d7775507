package com.company.reporting.domain;

import com.company.reporting.domain.enums.ComparisonOperator;
import com.company.reporting.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {
    private Long id;
    private String tenantId;
    private String name;
    private String ruleType;

    // Metric source
    private DataSourceDescriptor dataSource;
    private Map<String, Object> queryConfig;
    private Map<String, Object> conditionConfig;

    // Threshold
    private Double thresholdValue;
    private ComparisonOperator comparisonOperator;
    private Severity severity;

    private List<NotificationChannelDescriptor> notificationConfig;

    private Integer evaluationIntervalSeconds;
    private Boolean enabled;
    private Instant lastEvaluatedAt;
    private Instant lastTriggeredAt;
}
