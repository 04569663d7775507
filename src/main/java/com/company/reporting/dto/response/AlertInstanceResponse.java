package com.company.reporting.dto.response;

import com.company.reporting.domain.AlertInstance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertInstanceResponse {
    private Long id;
    private Long alertRuleId;
    private String severity;
    private String status;
    private Double triggeredValue;
    private String message;
    private Instant triggeredAt;
    private Instant acknowledgedAt;
    private String acknowledgedBy;
    private Instant resolvedAt;
    private String resolvedBy;
    private String resolutionReason;
    private Boolean autoResolved;

    public static AlertInstanceResponse from(AlertInstance instance) {
        return AlertInstanceResponse.builder()
                .id(instance.getId())
                .alertRuleId(instance.getAlertRuleId())
                .severity(instance.getSeverity() != null ? instance.getSeverity().toValue() : null)
                .status(instance.getStatus().toValue())
                .triggeredValue(instance.getTriggeredValue())
                .message(instance.getMessage())
                .triggeredAt(instance.getTriggeredAt())
                .acknowledgedAt(instance.getAcknowledgedAt())
                .acknowledgedBy(instance.getAcknowledgedBy())
                .resolvedAt(instance.getResolvedAt())
                .resolvedBy(instance.getResolvedBy())
                .resolutionReason(instance.getResolutionReason())
                .autoResolved(instance.getAutoResolved())
                .build();
    }
}
