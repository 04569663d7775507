package com.company.reporting.repository;

import com.company.reporting.domain.OutputArtifact;
import com.company.reporting.domain.ReportExecution;
import com.company.reporting.domain.enums.ExecutionStatus;
import com.company.reporting.domain.enums.TriggerType;
import com.company.reporting.util.JsonColumns;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.company.reporting.repository.SqlTimestamps.toInstant;
import static com.company.reporting.repository.SqlTimestamps.toTimestamp;

/**
 * Execution records are inserted once and afterwards only see status, timing and
 * result updates.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ReportExecutionRepository {

    private static final TypeReference<List<OutputArtifact>> ARTIFACTS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    private static final String SELECT_BASE = """
        SELECT execution_id, report_id, status, trigger_type, triggered_by,
               parameters, filters, output_formats,
               started_at, completed_at, duration_ms,
               result_payload, output_artifacts, rows_processed, error_message
        FROM report_executions
        """;

    public Optional<ReportExecution> findById(String executionId) {
        String sql = SELECT_BASE + " WHERE execution_id = ?";

        List<ReportExecution> results = jdbcTemplate.query(sql, new ExecutionRowMapper(), executionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<ReportExecution> findRecentByReport(Long reportId, int limit) {
        String sql = SELECT_BASE + " WHERE report_id = ? ORDER BY started_at DESC LIMIT ?";
        return jdbcTemplate.query(sql, new ExecutionRowMapper(), reportId, limit);
    }

    public ReportExecution insert(ReportExecution execution) {
        String sql = """
            INSERT INTO report_executions (
                execution_id, report_id, status, trigger_type, triggered_by,
                parameters, filters, output_formats,
                started_at, completed_at, duration_ms,
                result_payload, output_artifacts, rows_processed, error_message
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?)
            """;

        jdbcTemplate.update(sql,
                execution.getExecutionId(),
                execution.getReportId(),
                execution.getStatus().name(),
                execution.getTriggerType().toValue(),
                execution.getTriggeredBy(),
                jsonColumns.write(execution.getParameters()),
                jsonColumns.write(execution.getFilters()),
                jsonColumns.write(execution.getOutputFormats()),
                toTimestamp(execution.getStartedAt()),
                toTimestamp(execution.getCompletedAt()),
                execution.getDurationMs(),
                jsonColumns.write(execution.getResultPayload()),
                jsonColumns.write(execution.getOutputArtifacts()),
                execution.getRowsProcessed(),
                execution.getErrorMessage()
        );

        return execution;
    }

    public void updateStatus(String executionId, ExecutionStatus status) {
        jdbcTemplate.update("UPDATE report_executions SET status = ? WHERE execution_id = ?",
                status.name(), executionId);
    }

    /**
     * Persists the terminal state of an execution (COMPLETED or FAILED).
     */
    public void complete(ReportExecution execution) {
        String sql = """
            UPDATE report_executions
            SET status = ?,
                completed_at = ?,
                duration_ms = ?,
                result_payload = ?::jsonb,
                output_artifacts = ?::jsonb,
                rows_processed = ?,
                error_message = ?
            WHERE execution_id = ?
            """;

        jdbcTemplate.update(sql,
                execution.getStatus().name(),
                toTimestamp(execution.getCompletedAt()),
                execution.getDurationMs(),
                jsonColumns.write(execution.getResultPayload()),
                jsonColumns.write(execution.getOutputArtifacts()),
                execution.getRowsProcessed(),
                execution.getErrorMessage(),
                execution.getExecutionId()
        );
    }

    public long countByStatus(ExecutionStatus status) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM report_executions WHERE status = ?", Long.class, status.name());
        return count != null ? count : 0L;
    }

    /**
     * Execution counts per status for one tenant's reports started within [from, to].
     */
    public Map<ExecutionStatus, Long> countByStatusForTenant(String tenantId, Instant from, Instant to) {
        String sql = """
            SELECT e.status, COUNT(*) AS total
            FROM report_executions e
            JOIN reports r ON r.id = e.report_id
            WHERE r.tenant_id = ?
            AND e.started_at >= ?
            AND e.started_at <= ?
            GROUP BY e.status
            """;

        Map<ExecutionStatus, Long> counts = new EnumMap<>(ExecutionStatus.class);
        jdbcTemplate.query(sql, rs -> {
            counts.put(ExecutionStatus.fromString(rs.getString("status")), rs.getLong("total"));
        }, tenantId, toTimestamp(from), toTimestamp(to));
        return counts;
    }

    public Double averageDurationMsForTenant(String tenantId, Instant from, Instant to) {
        String sql = """
            SELECT AVG(e.duration_ms)
            FROM report_executions e
            JOIN reports r ON r.id = e.report_id
            WHERE r.tenant_id = ?
            AND e.started_at >= ?
            AND e.started_at <= ?
            AND e.duration_ms IS NOT NULL
            AND e.status = 'COMPLETED'
            AND e.trigger_type <> 'cached'
            """;

        return jdbcTemplate.queryForObject(sql, Double.class, tenantId, toTimestamp(from), toTimestamp(to));
    }

    private class ExecutionRowMapper implements RowMapper<ReportExecution> {
        @Override
        public ReportExecution mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ReportExecution.builder()
                    .executionId(rs.getString("execution_id"))
                    .reportId(rs.getLong("report_id"))
                    .status(ExecutionStatus.fromString(rs.getString("status")))
                    .triggerType(TriggerType.fromString(rs.getString("trigger_type")))
                    .triggeredBy(rs.getString("triggered_by"))
                    .parameters(jsonColumns.readMap(rs.getString("parameters")))
                    .filters(jsonColumns.readMap(rs.getString("filters")))
                    .outputFormats(jsonColumns.readStringList(rs.getString("output_formats")))
                    .startedAt(toInstant(rs.getTimestamp("started_at")))
                    .completedAt(toInstant(rs.getTimestamp("completed_at")))
                    .durationMs(rs.getObject("duration_ms", Long.class))
                    .resultPayload(jsonColumns.readMap(rs.getString("result_payload")))
                    .outputArtifacts(jsonColumns.read(rs.getString("output_artifacts"), ARTIFACTS_TYPE))
                    .rowsProcessed(rs.getObject("rows_processed", Long.class))
                    .errorMessage(rs.getString("error_message"))
                    .build();
        }
    }
}
