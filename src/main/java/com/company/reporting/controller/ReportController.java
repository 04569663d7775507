package com.company.reporting.controller;

import com.company.reporting.domain.ReportDefinition;
import com.company.reporting.dto.request.CreateReportRequest;
import com.company.reporting.dto.request.TriggerExecutionRequest;
import com.company.reporting.dto.response.ExecutionResponse;
import com.company.reporting.dto.response.ReportResponse;
import com.company.reporting.service.ExecutionHandle;
import com.company.reporting.service.ReportDefinitionService;
import com.company.reporting.service.ReportExecutionService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/reports")
@Tag(name = "Reports", description = "Report definitions and execution triggers")
@RequiredArgsConstructor
@Slf4j
public class ReportController {

    private final ReportDefinitionService definitionService;
    private final ReportExecutionService executionService;
    private final MeterRegistry meterRegistry;

    @PostMapping
    @Operation(summary = "Create a report definition")
    public ResponseEntity<ReportResponse> createReport(
            @RequestHeader(value = "X-Tenant-ID", defaultValue = "default") String tenantId,
            @Valid @RequestBody CreateReportRequest request) {

        ReportDefinition report = definitionService.createReport(request, tenantId);

        return ResponseEntity
                .created(URI.create("/api/v1/reports/" + report.getId()))
                .body(ReportResponse.from(report));
    }

    @GetMapping("/{reportId}")
    @Operation(summary = "Get a report definition")
    public ResponseEntity<ReportResponse> getReport(@PathVariable Long reportId) {
        return ResponseEntity.ok(ReportResponse.from(definitionService.getReport(reportId)));
    }

    @PostMapping("/{reportId}/executions")
    @Operation(summary = "Trigger a report execution",
            description = "Returns immediately with the queued execution, or the cached result when the report cache is fresh")
    public ResponseEntity<ExecutionResponse> executeReport(
            @PathVariable Long reportId,
            @RequestBody(required = false) TriggerExecutionRequest request) {

        TriggerExecutionRequest effective = request != null ? request : new TriggerExecutionRequest();
        log.info("Execution requested for report {} by {}", reportId,
                effective.getTriggeredBy() != null ? effective.getTriggeredBy() : "api");

        meterRegistry.counter("api.reports.execute.requests").increment();

        ExecutionHandle handle = executionService.executeReport(reportId, effective);
        ExecutionResponse body = ExecutionResponse.from(handle.getExecution());

        return ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/executions/" + body.getExecutionId()))
                .body(body);
    }

    @GetMapping("/{reportId}/executions")
    @Operation(summary = "List recent executions of a report")
    public ResponseEntity<List<ExecutionResponse>> getRecentExecutions(
            @PathVariable Long reportId,
            @RequestParam(defaultValue = "20") int limit) {

        List<ExecutionResponse> executions = executionService.getRecentExecutions(reportId, limit).stream()
                .map(ExecutionResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(executions);
    }
}
