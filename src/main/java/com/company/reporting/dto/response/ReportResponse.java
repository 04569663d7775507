package com.company.reporting.dto.response;

import com.company.reporting.domain.ReportDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportResponse {
    private Long id;
    private String tenantId;
    private String name;
    private String description;
    private String reportType;
    private int dataSourceCount;
    private List<String> outputFormats;
    private Integer autoRefreshIntervalMinutes;
    private Instant nextRunAt;
    private Integer cacheTtlMinutes;
    private Instant createdAt;

    public static ReportResponse from(ReportDefinition report) {
        return ReportResponse.builder()
                .id(report.getId())
                .tenantId(report.getTenantId())
                .name(report.getName())
                .description(report.getDescription())
                .reportType(report.getReportType())
                .dataSourceCount(report.getDataSources() != null ? report.getDataSources().size() : 0)
                .outputFormats(report.getOutputFormats())
                .autoRefreshIntervalMinutes(report.getAutoRefreshIntervalMinutes())
                .nextRunAt(report.getNextRunAt())
                .cacheTtlMinutes(report.getCacheTtlMinutes())
                .createdAt(report.getCreatedAt())
                .build();
    }
}
