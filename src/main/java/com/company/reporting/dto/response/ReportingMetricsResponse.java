package com.company.reporting.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportingMetricsResponse {
    private String tenantId;
    private Instant from;
    private Instant to;

    private long totalExecutions;
    private long successfulExecutions;
    private long failedExecutions;
    private double successRate;
    private double averageDurationMs;

    private long dashboardCount;
    private long totalDashboardViews;
}
