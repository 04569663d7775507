package com.company.reporting.service;

import com.company.reporting.domain.AlertRule;
import com.company.reporting.query.QueryExecutor;
import com.company.reporting.transform.RowValues;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fetches the current metric value an alert rule watches.
 */
@Component
@RequiredArgsConstructor
public class AlertMetricResolver {

    private final QueryExecutor queryExecutor;

    /**
     * The rule's value_field from the first row, else the first numeric column.
     * Query failures propagate to the caller.
     */
    public Optional<Double> resolve(AlertRule rule) {
        List<Map<String, Object>> rows = queryExecutor.execute(
                rule.getDataSource(), rule.getQueryConfig(), Collections.emptyMap(), Collections.emptyMap());
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return extractValue(rows.get(0), valueField(rule));
    }

    static Optional<Double> extractValue(Map<String, Object> row, String valueField) {
        if (valueField != null) {
            return Optional.ofNullable(RowValues.toDouble(row.get(valueField)));
        }
        return row.values().stream()
                .filter(RowValues::isNumeric)
                .findFirst()
                .map(RowValues::toDouble);
    }

    private String valueField(AlertRule rule) {
        Map<String, Object> condition = rule.getConditionConfig();
        if (condition == null || condition.get("value_field") == null) {
            return null;
        }
        return String.valueOf(condition.get("value_field"));
    }
}
