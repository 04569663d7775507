package com.company.reporting.service;

import com.company.reporting.domain.ReportDefinition;
import com.company.reporting.dto.request.CreateReportRequest;
import com.company.reporting.exception.ResourceNotFoundException;
import com.company.reporting.repository.ReportRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class ReportDefinitionService {

    private final ReportRepository reportRepository;
    private final ReportDefinitionValidator validator;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Transactional
    public ReportDefinition createReport(CreateReportRequest request, String tenantId) {
        validator.validate(request.getDataSources(), request.getQueryConfig());

        Instant now = clock.instant();
        ReportDefinition report = ReportDefinition.builder()
                .tenantId(tenantId)
                .name(request.getName())
                .description(request.getDescription())
                .reportType(request.getReportType() != null ? request.getReportType() : "custom")
                .dataSources(request.getDataSources())
                .queryConfig(request.getQueryConfig())
                .visualizationConfig(request.getVisualizationConfig())
                .outputFormats(request.getOutputFormats() != null ? request.getOutputFormats() : List.of("json"))
                .autoRefreshIntervalMinutes(request.getAutoRefreshIntervalMinutes())
                .cacheTtlMinutes(request.getCacheTtlMinutes())
                .createdAt(now)
                .updatedAt(now)
                .build();

        if (report.isScheduled()) {
            report.setNextRunAt(now.plus(Duration.ofMinutes(report.getAutoRefreshIntervalMinutes())));
        }

        report = reportRepository.save(report);

        meterRegistry.counter("reporting.reports.created", "type", report.getReportType()).increment();
        log.info("Created report {} '{}' for tenant {}", report.getId(), report.getName(), tenantId);

        return report;
    }

    public ReportDefinition getReport(Long reportId) {
        return reportRepository.findById(reportId)
                .orElseThrow(() -> new ResourceNotFoundException("Report", reportId));
    }
}
