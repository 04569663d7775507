package com.company.reporting.controller;

import com.company.reporting.dto.response.ReportingMetricsResponse;
import com.company.reporting.service.ReportingMetricsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@RestController
@RequestMapping("/api/v1/metrics")
@Tag(name = "Reporting Metrics", description = "Execution and dashboard usage statistics")
@RequiredArgsConstructor
public class ReportingMetricsController {

    private final ReportingMetricsService metricsService;
    private final Clock clock;

    @GetMapping("/reporting")
    @Operation(summary = "Reporting metrics for a tenant", description = "Defaults to the last 30 days")
    public ResponseEntity<ReportingMetricsResponse> getReportingMetrics(
            @RequestHeader(value = "X-Tenant-ID", defaultValue = "default") String tenantId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        // Truncated so the cache key is stable within a minute
        Instant end = to != null ? to : clock.instant().truncatedTo(ChronoUnit.MINUTES);
        Instant start = from != null ? from : end.minus(Duration.ofDays(30));

        return ResponseEntity.ok(metricsService.getReportingMetrics(tenantId, start, end));
    }
}
