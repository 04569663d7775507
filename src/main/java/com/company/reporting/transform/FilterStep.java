package com.company.reporting.transform;

import com.company.reporting.domain.enums.FilterOperator;
import com.company.reporting.domain.enums.TransformStepType;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Getter
@ToString
public class FilterStep implements TransformStep {

    private final String field;
    private final FilterOperator operator;
    private final String rawOperator;
    private final Object value;

    public FilterStep(String field, String operator, Object value) {
        this.field = field;
        this.rawOperator = operator;
        this.operator = FilterOperator.fromString(operator);
        this.value = value;
    }

    @Override
    public TransformStepType getType() {
        return TransformStepType.FILTER;
    }

    @Override
    public List<Map<String, Object>> apply(List<Map<String, Object>> rows) {
        if (operator == FilterOperator.UNKNOWN) {
            log.warn("Skipping filter on '{}': unsupported operator '{}'", field, rawOperator);
            return rows;
        }
        if (!RowValues.anyRowHas(rows, field)) {
            return rows;
        }

        return rows.stream()
                .filter(this::matches)
                .collect(Collectors.toList());
    }

    private boolean matches(Map<String, Object> row) {
        Object actual = row.get(field);
        if (actual == null || value == null) {
            return false;
        }

        switch (operator) {
            case EQUALS:
                if (actual instanceof Number || value instanceof Number) {
                    Double a = RowValues.toDouble(actual);
                    Double b = RowValues.toDouble(value);
                    return a != null && a.equals(b);
                }
                return actual.equals(value) || String.valueOf(actual).equals(String.valueOf(value));
            case GREATER_THAN:
                return RowValues.sameKind(actual, value) && RowValues.compare(actual, value) > 0;
            case LESS_THAN:
                return RowValues.sameKind(actual, value) && RowValues.compare(actual, value) < 0;
            default:
                return false;
        }
    }
}
