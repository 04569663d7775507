package com.company.reporting.service;

import com.company.reporting.domain.enums.ExecutionStatus;
import com.company.reporting.dto.response.ReportingMetricsResponse;
import com.company.reporting.repository.DashboardRepository;
import com.company.reporting.repository.ReportExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class ReportingMetricsService {

    private final ReportExecutionRepository executionRepository;
    private final DashboardRepository dashboardRepository;

    @Cacheable(value = "reportingMetrics", key = "#tenantId + '-' + #from + '-' + #to")
    public ReportingMetricsResponse getReportingMetrics(String tenantId, Instant from, Instant to) {
        log.debug("Computing reporting metrics for tenant {} between {} and {}", tenantId, from, to);

        Map<ExecutionStatus, Long> byStatus = executionRepository.countByStatusForTenant(tenantId, from, to);
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        long successful = byStatus.getOrDefault(ExecutionStatus.COMPLETED, 0L);
        long failed = byStatus.getOrDefault(ExecutionStatus.FAILED, 0L);

        Double averageDuration = executionRepository.averageDurationMsForTenant(tenantId, from, to);

        return ReportingMetricsResponse.builder()
                .tenantId(tenantId)
                .from(from)
                .to(to)
                .totalExecutions(total)
                .successfulExecutions(successful)
                .failedExecutions(failed)
                .successRate(successRate(successful, total))
                .averageDurationMs(averageDuration != null ? averageDuration : 0d)
                .dashboardCount(dashboardRepository.countByTenant(tenantId))
                .totalDashboardViews(dashboardRepository.sumViewsByTenant(tenantId))
                .build();
    }

    static double successRate(long successful, long total) {
        if (total == 0) {
            return 0d;
        }
        return BigDecimal.valueOf(successful * 100.0 / total)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
