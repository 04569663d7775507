package com.company.reporting.repository;

import com.company.reporting.domain.DataSourceDescriptor;
import com.company.reporting.domain.Widget;
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
import java.util.List;
import java.util.Map;

import static com.company.reporting.repository.SqlTimestamps.toInstant;
import static com.company.reporting.repository.SqlTimestamps.toTimestamp;

@Repository
@RequiredArgsConstructor
@Slf4j
public class WidgetRepository {

    private static final TypeReference<DataSourceDescriptor> DATA_SOURCE_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    /**
     * Widgets of a dashboard in layout order.
     */
    public List<Widget> findByDashboardId(Long dashboardId) {
        String sql = """
            SELECT id, dashboard_id, widget_key, name, visualization_type,
                   data_source, query_config, transformation_config, visual_config,
                   position_config, position, enabled,
                   cache_ttl_minutes, cached_payload, cached_at
            FROM widgets
            WHERE dashboard_id = ?
            ORDER BY position ASC, id ASC
            """;

        return jdbcTemplate.query(sql, new WidgetRowMapper(), dashboardId);
    }

    public void updateCache(Long widgetId, Map<String, Object> payload, Instant cachedAt) {
        jdbcTemplate.update(
                "UPDATE widgets SET cached_payload = ?::jsonb, cached_at = ? WHERE id = ?",
                jsonColumns.write(payload), toTimestamp(cachedAt), widgetId);
    }

    private class WidgetRowMapper implements RowMapper<Widget> {
        @Override
        public Widget mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Widget.builder()
                    .id(rs.getLong("id"))
                    .dashboardId(rs.getLong("dashboard_id"))
                    .widgetKey(rs.getString("widget_key"))
                    .name(rs.getString("name"))
                    .visualizationType(rs.getString("visualization_type"))
                    .dataSource(jsonColumns.read(rs.getString("data_source"), DATA_SOURCE_TYPE))
                    .queryConfig(jsonColumns.readMap(rs.getString("query_config")))
                    .transformationConfig(jsonColumns.readMap(rs.getString("transformation_config")))
                    .visualConfig(jsonColumns.readMap(rs.getString("visual_config")))
                    .positionConfig(jsonColumns.readMap(rs.getString("position_config")))
                    .position(rs.getInt("position"))
                    .enabled(rs.getBoolean("enabled"))
                    .cacheTtlMinutes(rs.getObject("cache_ttl_minutes", Integer.class))
                    .cachedPayload(jsonColumns.readMap(rs.getString("cached_payload")))
                    .cachedAt(toInstant(rs.getTimestamp("cached_at")))
                    .build();
        }
    }
}
