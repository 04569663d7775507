package com.company.reporting.service;

import com.company.reporting.domain.DataSourceDescriptor;
import com.company.reporting.domain.ReportDefinition;
import com.company.reporting.dto.request.CreateReportRequest;
import com.company.reporting.exception.ReportValidationException;
import com.company.reporting.repository.ReportRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReportDefinitionServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private ReportRepository reportRepository;

    private ReportDefinitionService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new ReportDefinitionService(reportRepository, new ReportDefinitionValidator(),
                new SimpleMeterRegistry(), Clock.fixed(NOW, ZoneOffset.UTC));
        when(reportRepository.save(any())).thenAnswer(invocation -> {
            ReportDefinition report = invocation.getArgument(0);
            report.setId(21L);
            return report;
        });
    }

    @Test
    void createReport_scheduled_firstRunOneIntervalOut() {
        CreateReportRequest request = request();
        request.setAutoRefreshIntervalMinutes(30);

        ReportDefinition report = service.createReport(request, "acme");

        assertThat(report.getId()).isEqualTo(21L);
        assertThat(report.getTenantId()).isEqualTo("acme");
        assertThat(report.getReportType()).isEqualTo("custom");
        assertThat(report.getOutputFormats()).containsExactly("json");
        assertThat(report.getNextRunAt()).isEqualTo(NOW.plusSeconds(1800));
    }

    @Test
    void createReport_unscheduled_noNextRun() {
        ReportDefinition report = service.createReport(request(), "acme");

        assertThat(report.getNextRunAt()).isNull();
    }

    @Test
    void createReport_sourceWithoutType_rejected() {
        CreateReportRequest request = request();
        request.setDataSources(List.of(DataSourceDescriptor.builder().config(Map.of()).build()));

        assertThatThrownBy(() -> service.createReport(request, "acme"))
                .isInstanceOf(ReportValidationException.class)
                .hasMessage("Data source 0 must specify 'type'");
        verify(reportRepository, never()).save(any());
    }

    private CreateReportRequest request() {
        return CreateReportRequest.builder()
                .name("Weekly sales")
                .dataSources(List.of(DataSourceDescriptor.builder().type("database").config(Map.of()).build()))
                .queryConfig(Map.of("query", "SELECT * FROM sales"))
                .build();
    }
}
