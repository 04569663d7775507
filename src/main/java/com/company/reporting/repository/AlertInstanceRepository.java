package com.company.reporting.repository;

import com.company.reporting.domain.AlertInstance;
import com.company.reporting.domain.enums.AlertInstanceStatus;
import com.company.reporting.domain.enums.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import static com.company.reporting.repository.SqlTimestamps.toInstant;
import static com.company.reporting.repository.SqlTimestamps.toTimestamp;

@Repository
@RequiredArgsConstructor
@Slf4j
public class AlertInstanceRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT id, alert_rule_id, severity, status, triggered_value, message, triggered_at,
               acknowledged_at, acknowledged_by, resolved_at, resolved_by,
               resolution_reason, auto_resolved
        FROM alert_instances
        """;

    public Optional<AlertInstance> findById(Long instanceId) {
        List<AlertInstance> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE id = ?", new AlertInstanceRowMapper(), instanceId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<AlertInstance> findActiveByRuleId(Long ruleId) {
        List<AlertInstance> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE alert_rule_id = ? AND status = 'active'",
                new AlertInstanceRowMapper(), ruleId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Inserts a new instance. The partial unique index on active instances makes a
     * second concurrent insert for the same rule fail; callers must handle
     * DuplicateKeyException.
     */
    public AlertInstance save(AlertInstance instance) throws DuplicateKeyException {
        String sql = """
            INSERT INTO alert_instances (
                alert_rule_id, severity, status, triggered_value, message, triggered_at, auto_resolved
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setLong(1, instance.getAlertRuleId());
            ps.setString(2, instance.getSeverity().toValue());
            ps.setString(3, instance.getStatus().toValue());
            ps.setObject(4, instance.getTriggeredValue());
            ps.setString(5, instance.getMessage());
            ps.setTimestamp(6, toTimestamp(instance.getTriggeredAt()));
            ps.setBoolean(7, Boolean.TRUE.equals(instance.getAutoResolved()));
            return ps;
        }, keyHolder);

        instance.setId(keyHolder.getKey().longValue());
        return instance;
    }

    /**
     * Persists a status transition with its acknowledgement or resolution fields.
     */
    public void updateStatus(AlertInstance instance) {
        String sql = """
            UPDATE alert_instances
            SET status = ?,
                acknowledged_at = ?,
                acknowledged_by = ?,
                resolved_at = ?,
                resolved_by = ?,
                resolution_reason = ?,
                auto_resolved = ?
            WHERE id = ?
            """;

        jdbcTemplate.update(sql,
                instance.getStatus().toValue(),
                toTimestamp(instance.getAcknowledgedAt()),
                instance.getAcknowledgedBy(),
                toTimestamp(instance.getResolvedAt()),
                instance.getResolvedBy(),
                instance.getResolutionReason(),
                Boolean.TRUE.equals(instance.getAutoResolved()),
                instance.getId()
        );
    }

    private static class AlertInstanceRowMapper implements RowMapper<AlertInstance> {
        @Override
        public AlertInstance mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AlertInstance.builder()
                    .id(rs.getLong("id"))
                    .alertRuleId(rs.getLong("alert_rule_id"))
                    .severity(Severity.fromString(rs.getString("severity")))
                    .status(AlertInstanceStatus.fromString(rs.getString("status")))
                    .triggeredValue(rs.getObject("triggered_value", Double.class))
                    .message(rs.getString("message"))
                    .triggeredAt(toInstant(rs.getTimestamp("triggered_at")))
                    .acknowledgedAt(toInstant(rs.getTimestamp("acknowledged_at")))
                    .acknowledgedBy(rs.getString("acknowledged_by"))
                    .resolvedAt(toInstant(rs.getTimestamp("resolved_at")))
                    .resolvedBy(rs.getString("resolved_by"))
                    .resolutionReason(rs.getString("resolution_reason"))
                    .autoResolved(rs.getBoolean("auto_resolved"))
                    .build();
        }
    }
}
