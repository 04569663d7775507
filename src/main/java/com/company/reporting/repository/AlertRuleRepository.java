package com.company.reporting.repository;

import com.company.reporting.domain.AlertRule;
import com.company.reporting.domain.DataSourceDescriptor;
import com.company.reporting.domain.NotificationChannelDescriptor;
import com.company.reporting.domain.enums.ComparisonOperator;
import com.company.reporting.domain.enums.Severity;
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

import static com.company.reporting.repository.SqlTimestamps.toInstant;
import static com.company.reporting.repository.SqlTimestamps.toTimestamp;

@Repository
@RequiredArgsConstructor
@Slf4j
public class AlertRuleRepository {

    private static final TypeReference<DataSourceDescriptor> DATA_SOURCE_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<NotificationChannelDescriptor>> CHANNELS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    private static final String SELECT_BASE = """
        SELECT id, tenant_id, name, rule_type, data_source, query_config, condition_config,
               threshold_value, comparison_operator, severity, notification_config,
               evaluation_interval_seconds, enabled, last_evaluated_at, last_triggered_at
        FROM alert_rules
        """;

    public List<AlertRule> findAllEnabled() {
        return jdbcTemplate.query(SELECT_BASE + " WHERE enabled = true ORDER BY id", new AlertRuleRowMapper());
    }

    public void updateLastEvaluatedAt(Long ruleId, Instant evaluatedAt) {
        jdbcTemplate.update("UPDATE alert_rules SET last_evaluated_at = ? WHERE id = ?",
                toTimestamp(evaluatedAt), ruleId);
    }

    public void updateLastTriggeredAt(Long ruleId, Instant triggeredAt) {
        jdbcTemplate.update("UPDATE alert_rules SET last_triggered_at = ? WHERE id = ?",
                toTimestamp(triggeredAt), ruleId);
    }

    private class AlertRuleRowMapper implements RowMapper<AlertRule> {
        @Override
        public AlertRule mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AlertRule.builder()
                    .id(rs.getLong("id"))
                    .tenantId(rs.getString("tenant_id"))
                    .name(rs.getString("name"))
                    .ruleType(rs.getString("rule_type"))
                    .dataSource(jsonColumns.read(rs.getString("data_source"), DATA_SOURCE_TYPE))
                    .queryConfig(jsonColumns.readMap(rs.getString("query_config")))
                    .conditionConfig(jsonColumns.readMap(rs.getString("condition_config")))
                    .thresholdValue(rs.getObject("threshold_value", Double.class))
                    .comparisonOperator(ComparisonOperator.fromSymbol(rs.getString("comparison_operator")))
                    .severity(Severity.fromString(rs.getString("severity")))
                    .notificationConfig(jsonColumns.read(rs.getString("notification_config"), CHANNELS_TYPE))
                    .evaluationIntervalSeconds(rs.getObject("evaluation_interval_seconds", Integer.class))
                    .enabled(rs.getBoolean("enabled"))
                    .lastEvaluatedAt(toInstant(rs.getTimestamp("last_evaluated_at")))
                    .lastTriggeredAt(toInstant(rs.getTimestamp("last_triggered_at")))
                    .build();
        }
    }
}
