package com.company.reporting.domain;

import com.company.reporting.domain.enums.AlertInstanceStatus;
import com.company.reporting.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertInstance {
    private Long id;
    private Long alertRuleId;
    private Severity severity;
    private AlertInstanceStatus status;

    private Double triggeredValue;
    private String message;
    private Instant triggeredAt;

    // Acknowledgement / resolution
    private Instant acknowledgedAt;
    private String acknowledgedBy;
    private Instant resolvedAt;
    private String resolvedBy;
    private String resolutionReason;
    private Boolean autoResolved;
}
