package com.company.reporting.repository;

import com.company.reporting.domain.DataSourceDescriptor;
import com.company.reporting.domain.ReportDefinition;
import com.company.reporting.util.JsonColumns;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.company.reporting.repository.SqlTimestamps.toInstant;
import static com.company.reporting.repository.SqlTimestamps.toTimestamp;

@Repository
@RequiredArgsConstructor
@Slf4j
public class ReportRepository {

    private static final TypeReference<List<DataSourceDescriptor>> DATA_SOURCES_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    private static final String SELECT_BASE = """
        SELECT id, tenant_id, name, description, report_type,
               data_sources, query_config, visualization_config, output_formats,
               auto_refresh_interval_minutes, next_run_at, last_run_at,
               cache_ttl_minutes, cached_payload, cached_at,
               created_at, updated_at
        FROM reports
        """;

    public Optional<ReportDefinition> findById(Long reportId) {
        String sql = SELECT_BASE + " WHERE id = ?";

        List<ReportDefinition> results = jdbcTemplate.query(sql, new ReportRowMapper(), reportId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Reports with an auto refresh interval whose next run is due.
     */
    public List<ReportDefinition> findDueForRefresh(Instant now, int limit) {
        String sql = SELECT_BASE + """
            WHERE auto_refresh_interval_minutes > 0
            AND (next_run_at IS NULL OR next_run_at <= ?)
            ORDER BY next_run_at ASC NULLS FIRST
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, new ReportRowMapper(), toTimestamp(now), limit);
    }

    public ReportDefinition save(ReportDefinition report) {
        Instant now = Instant.now();
        if (report.getCreatedAt() == null) {
            report.setCreatedAt(now);
        }
        report.setUpdatedAt(now);

        String sql = """
            INSERT INTO reports (
                tenant_id, name, description, report_type,
                data_sources, query_config, visualization_config, output_formats,
                auto_refresh_interval_minutes, next_run_at, cache_ttl_minutes,
                created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, report.getTenantId());
            ps.setString(2, report.getName());
            ps.setString(3, report.getDescription());
            ps.setString(4, report.getReportType() != null ? report.getReportType() : "custom");
            ps.setString(5, jsonColumns.write(report.getDataSources()));
            ps.setString(6, jsonColumns.write(report.getQueryConfig()));
            ps.setString(7, jsonColumns.write(report.getVisualizationConfig()));
            ps.setString(8, jsonColumns.write(report.getOutputFormats()));
            ps.setObject(9, report.getAutoRefreshIntervalMinutes(), Types.INTEGER);
            ps.setTimestamp(10, toTimestamp(report.getNextRunAt()));
            ps.setInt(11, report.getCacheTtlMinutes() != null
                    ? report.getCacheTtlMinutes() : ReportDefinition.DEFAULT_CACHE_TTL_MINUTES);
            ps.setTimestamp(12, toTimestamp(report.getCreatedAt()));
            ps.setTimestamp(13, toTimestamp(report.getUpdatedAt()));
            return ps;
        }, keyHolder);

        report.setId(keyHolder.getKey().longValue());
        return report;
    }

    /**
     * Writes the cache fields after a completed execution. Last writer wins.
     */
    public void updateCache(Long reportId, Map<String, Object> payload, Instant cachedAt) {
        String sql = """
            UPDATE reports
            SET cached_payload = ?::jsonb,
                cached_at = ?,
                last_run_at = ?
            WHERE id = ?
            """;

        jdbcTemplate.update(sql,
                jsonColumns.write(payload),
                toTimestamp(cachedAt),
                toTimestamp(cachedAt),
                reportId
        );
    }

    public void updateNextRunAt(Long reportId, Instant nextRunAt) {
        jdbcTemplate.update("UPDATE reports SET next_run_at = ? WHERE id = ?",
                toTimestamp(nextRunAt), reportId);
    }

    private class ReportRowMapper implements RowMapper<ReportDefinition> {
        @Override
        public ReportDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ReportDefinition.builder()
                    .id(rs.getLong("id"))
                    .tenantId(rs.getString("tenant_id"))
                    .name(rs.getString("name"))
                    .description(rs.getString("description"))
                    .reportType(rs.getString("report_type"))
                    .dataSources(jsonColumns.read(rs.getString("data_sources"), DATA_SOURCES_TYPE))
                    .queryConfig(jsonColumns.readMap(rs.getString("query_config")))
                    .visualizationConfig(jsonColumns.readMap(rs.getString("visualization_config")))
                    .outputFormats(jsonColumns.readStringList(rs.getString("output_formats")))
                    .autoRefreshIntervalMinutes(rs.getObject("auto_refresh_interval_minutes", Integer.class))
                    .nextRunAt(toInstant(rs.getTimestamp("next_run_at")))
                    .lastRunAt(toInstant(rs.getTimestamp("last_run_at")))
                    .cacheTtlMinutes(rs.getObject("cache_ttl_minutes", Integer.class))
                    .cachedPayload(jsonColumns.readMap(rs.getString("cached_payload")))
                    .cachedAt(toInstant(rs.getTimestamp("cached_at")))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
        }
    }
}
