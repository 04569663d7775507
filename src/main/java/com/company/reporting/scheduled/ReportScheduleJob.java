package com.company.reporting.scheduled;

import com.company.reporting.domain.ReportDefinition;
import com.company.reporting.domain.enums.TriggerType;
import com.company.reporting.dto.request.TriggerExecutionRequest;
import com.company.reporting.repository.ReportRepository;
import com.company.reporting.service.ReportExecutionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Triggers auto-refreshing reports whose next run time has passed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "reporting.schedule.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ReportScheduleJob {

    private final ReportRepository reportRepository;
    private final ReportExecutionService executionService;
    private final Clock clock;

    @Value("${reporting.schedule.batch-size:100}")
    private int batchSize = 100;

    @Scheduled(
            fixedDelayString = "${reporting.schedule.interval-ms:60000}",
            initialDelayString = "${reporting.schedule.initial-delay-ms:45000}"
    )
    public void triggerDueReports() {
        Instant now = clock.instant();
        List<ReportDefinition> dueReports = reportRepository.findDueForRefresh(now, batchSize);

        if (dueReports.isEmpty()) {
            log.debug("No reports due for refresh");
            return;
        }

        int successCount = 0;
        int failureCount = 0;

        for (ReportDefinition report : dueReports) {
            try {
                executionService.executeReport(report.getId(), new TriggerExecutionRequest(), TriggerType.SCHEDULED);
                successCount++;
            } catch (Exception e) {
                log.error("Failed to trigger scheduled run of report {}", report.getId(), e);
                failureCount++;
            } finally {
                advanceSchedule(report, now);
            }
        }

        log.info("Scheduled refresh: {} triggered, {} failed", successCount, failureCount);
    }

    private void advanceSchedule(ReportDefinition report, Instant now) {
        try {
            Instant nextRunAt = now.plus(Duration.ofMinutes(report.getAutoRefreshIntervalMinutes()));
            report.setNextRunAt(nextRunAt);
            reportRepository.updateNextRunAt(report.getId(), nextRunAt);
        } catch (Exception e) {
            log.error("Failed to advance schedule of report {}", report.getId(), e);
        }
    }
}
