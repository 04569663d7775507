package com.company.reporting.scheduled;

import com.company.reporting.domain.ReportDefinition;
import com.company.reporting.domain.enums.TriggerType;
import com.company.reporting.dto.request.TriggerExecutionRequest;
import com.company.reporting.exception.ReportValidationException;
import com.company.reporting.repository.ReportRepository;
import com.company.reporting.service.ReportExecutionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReportScheduleJobTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private ReportRepository reportRepository;

    @Mock
    private ReportExecutionService executionService;

    private ReportScheduleJob job;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        job = new ReportScheduleJob(reportRepository, executionService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void triggerDueReports_failureDoesNotStopBatch_allSchedulesAdvance() {
        ReportDefinition broken = ReportDefinition.builder().id(1L).autoRefreshIntervalMinutes(15).build();
        ReportDefinition healthy = ReportDefinition.builder().id(2L).autoRefreshIntervalMinutes(60).build();
        when(reportRepository.findDueForRefresh(NOW, 100)).thenReturn(List.of(broken, healthy));
        when(executionService.executeReport(eq(1L), any(TriggerExecutionRequest.class), eq(TriggerType.SCHEDULED)))
                .thenThrow(new ReportValidationException("Report must have at least one data source"));

        job.triggerDueReports();

        verify(executionService).executeReport(eq(2L), any(TriggerExecutionRequest.class), eq(TriggerType.SCHEDULED));
        verify(reportRepository).updateNextRunAt(1L, NOW.plusSeconds(15 * 60));
        verify(reportRepository).updateNextRunAt(2L, NOW.plusSeconds(60 * 60));
        assertThat(healthy.getNextRunAt()).isEqualTo(NOW.plusSeconds(3600));
    }

    @Test
    void triggerDueReports_nothingDue_noRuns() {
        when(reportRepository.findDueForRefresh(any(), anyInt())).thenReturn(List.of());

        job.triggerDueReports();

        verify(executionService, never()).executeReport(any(), any(TriggerExecutionRequest.class), any(TriggerType.class));
        verify(reportRepository, never()).updateNextRunAt(any(), any());
    }
}
