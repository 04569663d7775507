package com.company.reporting.repository;

import com.company.reporting.domain.Dashboard;
import com.company.reporting.util.JsonColumns;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.company.reporting.repository.SqlTimestamps.toInstant;
import static com.company.reporting.repository.SqlTimestamps.toTimestamp;

@Repository
@RequiredArgsConstructor
@Slf4j
public class DashboardRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    public Optional<Dashboard> findById(Long dashboardId) {
        String sql = """
            SELECT id, tenant_id, name, description, layout_config, theme_config,
                   view_count, last_viewed_at, created_at
            FROM dashboards
            WHERE id = ?
            """;

        List<Dashboard> results = jdbcTemplate.query(sql, new DashboardRowMapper(), dashboardId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public void recordView(Long dashboardId, Instant viewedAt) {
        jdbcTemplate.update(
                "UPDATE dashboards SET view_count = view_count + 1, last_viewed_at = ? WHERE id = ?",
                toTimestamp(viewedAt), dashboardId);
    }

    public long countByTenant(String tenantId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM dashboards WHERE tenant_id = ?", Long.class, tenantId);
        return count != null ? count : 0L;
    }

    public long sumViewsByTenant(String tenantId) {
        Long views = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(view_count), 0) FROM dashboards WHERE tenant_id = ?", Long.class, tenantId);
        return views != null ? views : 0L;
    }

    private class DashboardRowMapper implements RowMapper<Dashboard> {
        @Override
        public Dashboard mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Dashboard.builder()
                    .id(rs.getLong("id"))
                    .tenantId(rs.getString("tenant_id"))
                    .name(rs.getString("name"))
                    .description(rs.getString("description"))
                    .layoutConfig(jsonColumns.readMap(rs.getString("layout_config")))
                    .themeConfig(jsonColumns.readMap(rs.getString("theme_config")))
                    .viewCount(rs.getLong("view_count"))
                    .lastViewedAt(toInstant(rs.getTimestamp("last_viewed_at")))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .build();
        }
    }
}
