package com.company.reporting.service;

import com.company.reporting.domain.CacheState;
import com.company.reporting.domain.OutputArtifact;
import com.company.reporting.domain.ReportDefinition;
import com.company.reporting.domain.ReportExecution;
import com.company.reporting.domain.enums.ExecutionStatus;
import com.company.reporting.domain.enums.TriggerType;
import com.company.reporting.dto.request.TriggerExecutionRequest;
import com.company.reporting.exception.ExecutionFailureException;
import com.company.reporting.exception.ResourceNotFoundException;
import com.company.reporting.output.OutputRenderer;
import com.company.reporting.query.QueryExecutor;
import com.company.reporting.repository.ReportExecutionRepository;
import com.company.reporting.repository.ReportRepository;
import com.company.reporting.transform.TransformPipeline;
import com.company.reporting.visualization.ChartPayload;
import com.company.reporting.visualization.VisualizationBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs reports: cache check, then query, transform, visualize and render on the
 * report executor. Execution records move QUEUED, RUNNING, then COMPLETED or FAILED.
 */
@Service
@Slf4j
public class ReportExecutionService {

    private final ReportRepository reportRepository;
    private final ReportExecutionRepository executionRepository;
    private final ReportDefinitionValidator validator;
    private final QueryExecutor queryExecutor;
    private final TransformPipeline transformPipeline;
    private final VisualizationBuilder visualizationBuilder;
    private final OutputRenderer outputRenderer;
    private final Executor reportExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final boolean awaitCompletion;

    public ReportExecutionService(ReportRepository reportRepository,
                                  ReportExecutionRepository executionRepository,
                                  ReportDefinitionValidator validator,
                                  QueryExecutor queryExecutor,
                                  TransformPipeline transformPipeline,
                                  VisualizationBuilder visualizationBuilder,
                                  OutputRenderer outputRenderer,
                                  @Qualifier("reportExecutionExecutor") Executor reportExecutor,
                                  MeterRegistry meterRegistry,
                                  Clock clock,
                                  @Value("${reporting.execution.await-completion:false}") boolean awaitCompletion) {
        this.reportRepository = reportRepository;
        this.executionRepository = executionRepository;
        this.validator = validator;
        this.queryExecutor = queryExecutor;
        this.transformPipeline = transformPipeline;
        this.visualizationBuilder = visualizationBuilder;
        this.outputRenderer = outputRenderer;
        this.reportExecutor = reportExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.awaitCompletion = awaitCompletion;
    }

    public ExecutionHandle executeReport(Long reportId, TriggerExecutionRequest request) {
        TriggerType triggerType = request.getTriggeredBy() != null ? TriggerType.MANUAL : TriggerType.API;
        return executeReport(reportId, request, triggerType);
    }

    public ExecutionHandle executeReport(Long reportId, TriggerExecutionRequest request, TriggerType triggerType) {
        ReportDefinition report = reportRepository.findById(reportId)
                .orElseThrow(() -> new ResourceNotFoundException("Report", reportId));

        validator.validate(report);

        Instant now = clock.instant();
        CacheState cache = report.cacheState();
        if (cache.isValid(now)) {
            log.debug("Serving report {} from cache (expires {})", reportId, cache.expiresAt());
            return ExecutionHandle.completed(recordCachedExecution(report, request, now));
        }

        ReportExecution execution = ReportExecution.builder()
                .executionId(UUID.randomUUID().toString())
                .reportId(reportId)
                .status(ExecutionStatus.QUEUED)
                .triggerType(triggerType)
                .triggeredBy(request.getTriggeredBy())
                .parameters(orEmpty(request.getParameters()))
                .filters(orEmpty(request.getFilters()))
                .outputFormats(resolveFormats(request, report))
                .startedAt(now)
                .build();

        executionRepository.insert(execution);

        execution.setStatus(ExecutionStatus.RUNNING);
        executionRepository.updateStatus(execution.getExecutionId(), ExecutionStatus.RUNNING);

        meterRegistry.counter("reporting.executions.started", "trigger", triggerType.toValue()).increment();
        log.info("Execution {} of report {} started ({})", execution.getExecutionId(), reportId, triggerType.toValue());

        ReportExecution snapshot = execution.toBuilder().build();
        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        CompletableFuture<ReportExecution> completion;
        try {
            completion = CompletableFuture.supplyAsync(
                    () -> runPipeline(report, execution, callerContext), reportExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Report executor rejected execution {}", execution.getExecutionId(), e);
            completion = CompletableFuture.completedFuture(fail(execution, e));
        }

        ExecutionHandle handle = new ExecutionHandle(snapshot, completion);
        if (awaitCompletion) {
            return new ExecutionHandle(handle.await(), completion);
        }
        return handle;
    }

    public ReportExecution getExecution(String executionId) {
        return executionRepository.findById(executionId)
                .orElseThrow(() -> new ResourceNotFoundException("Execution", executionId));
    }

    /**
     * Most recent executions of a report, newest first. The limit is clamped to 1..100.
     */
    public List<ReportExecution> getRecentExecutions(Long reportId, int limit) {
        if (reportRepository.findById(reportId).isEmpty()) {
            throw new ResourceNotFoundException("Report", reportId);
        }
        return executionRepository.findRecentByReport(reportId, Math.max(1, Math.min(limit, 100)));
    }

    /**
     * Runs under the triggering request's MDC so background logs keep its requestId.
     */
    ReportExecution runPipeline(ReportDefinition report, ReportExecution execution, Map<String, String> callerContext) {
        Map<String, String> previousContext = MDC.getCopyOfContextMap();
        if (callerContext != null) {
            MDC.setContextMap(callerContext);
        }
        MDC.put("executionId", execution.getExecutionId());
        try {
            List<Map<String, Object>> rows = queryExecutor.executeAll(
                    report.getDataSources(), report.getQueryConfig(),
                    execution.getParameters(), execution.getFilters());

            List<Map<String, Object>> processed = stage("transform",
                    () -> transformPipeline.transformReport(rows, report.getQueryConfig()));

            Map<String, ChartPayload> visualizations = stage("visualize",
                    () -> visualizationBuilder.build(processed, report.getVisualizationConfig()));

            List<OutputArtifact> artifacts = new ArrayList<>();
            for (String format : execution.getOutputFormats()) {
                stage("render", () -> outputRenderer.render(processed, visualizations, format, execution.getExecutionId()))
                        .ifPresent(artifacts::add);
            }

            Instant completedAt = clock.instant();
            long durationMs = Duration.between(execution.getStartedAt(), completedAt).toMillis();
            Map<String, Object> payload = resultPayload(processed, visualizations, durationMs);

            execution.setStatus(ExecutionStatus.COMPLETED);
            execution.setCompletedAt(completedAt);
            execution.setDurationMs(durationMs);
            execution.setResultPayload(payload);
            execution.setOutputArtifacts(artifacts);
            execution.setRowsProcessed((long) processed.size());
            executionRepository.complete(execution);

            report.setCachedPayload(payload);
            report.setCachedAt(completedAt);
            report.setLastRunAt(completedAt);
            reportRepository.updateCache(report.getId(), payload, completedAt);

            meterRegistry.counter("reporting.executions.completed").increment();
            meterRegistry.timer("reporting.executions.duration").record(Duration.ofMillis(durationMs));

            log.info("Execution {} completed: {} rows, {} artifacts in {}ms",
                    execution.getExecutionId(), processed.size(), artifacts.size(), durationMs);
            return execution;

        } catch (Exception e) {
            log.error("Execution {} of report {} failed", execution.getExecutionId(), report.getId(), e);
            return fail(execution, e);
        } finally {
            if (previousContext != null) {
                MDC.setContextMap(previousContext);
            } else {
                MDC.clear();
            }
        }
    }

    private ReportExecution fail(ReportExecution execution, Exception cause) {
        Instant completedAt = clock.instant();
        execution.setStatus(ExecutionStatus.FAILED);
        execution.setErrorMessage(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        execution.setCompletedAt(completedAt);
        execution.setDurationMs(Duration.between(execution.getStartedAt(), completedAt).toMillis());

        meterRegistry.counter("reporting.executions.failed").increment();

        try {
            executionRepository.complete(execution);
        } catch (Exception e) {
            log.error("Could not record failure of execution {}", execution.getExecutionId(), e);
        }
        return execution;
    }

    private ReportExecution recordCachedExecution(ReportDefinition report, TriggerExecutionRequest request, Instant now) {
        Map<String, Object> payload = report.getCachedPayload();

        ReportExecution execution = ReportExecution.builder()
                .executionId(UUID.randomUUID().toString())
                .reportId(report.getId())
                .status(ExecutionStatus.COMPLETED)
                .triggerType(TriggerType.CACHED)
                .triggeredBy(request.getTriggeredBy())
                .parameters(orEmpty(request.getParameters()))
                .filters(orEmpty(request.getFilters()))
                .outputFormats(resolveFormats(request, report))
                .startedAt(now)
                .completedAt(now)
                .durationMs(0L)
                .resultPayload(payload)
                .outputArtifacts(Collections.emptyList())
                .rowsProcessed(cachedRowCount(payload))
                .build();

        executionRepository.insert(execution);
        meterRegistry.counter("reporting.executions.cached").increment();

        log.info("Execution {} of report {} served from cache", execution.getExecutionId(), report.getId());
        return execution;
    }

    private <T> T stage(String name, Supplier<T> work) {
        try {
            return work.get();
        } catch (ExecutionFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExecutionFailureException(name, e);
        }
    }

    private Map<String, Object> resultPayload(List<Map<String, Object>> rows,
                                              Map<String, ChartPayload> visualizations,
                                              long durationMs) {
        Map<String, Object> charts = new LinkedHashMap<>();
        visualizations.forEach((name, chart) -> charts.put(name, chart.toMap()));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rows_count", rows.size());
        metadata.put("execution_time_ms", durationMs);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("data", rows);
        payload.put("visualizations", charts);
        payload.put("metadata", metadata);
        return payload;
    }

    private List<String> resolveFormats(TriggerExecutionRequest request, ReportDefinition report) {
        if (request.getOutputFormats() != null && !request.getOutputFormats().isEmpty()) {
            return request.getOutputFormats();
        }
        return report.getOutputFormats() != null ? report.getOutputFormats() : Collections.emptyList();
    }

    @SuppressWarnings("unchecked")
    private Long cachedRowCount(Map<String, Object> payload) {
        Object metadata = payload.get("metadata");
        if (metadata instanceof Map && ((Map<String, Object>) metadata).get("rows_count") instanceof Number count) {
            return count.longValue();
        }
        return null;
    }

    private Map<String, Object> orEmpty(Map<String, Object> map) {
        return map != null ? map : Collections.emptyMap();
    }
}
