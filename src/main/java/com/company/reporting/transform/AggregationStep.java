package com.company.reporting.transform;

import com.company.reporting.domain.enums.AggregateFunction;
import com.company.reporting.domain.enums.TransformStepType;
import com.company.reporting.exception.TransformException;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups rows by the group-by fields and reduces the other fields.
 * Output rows follow first-seen group order; group-by fields come first.
 */
@Getter
@ToString
public class AggregationStep implements TransformStep {

    private final List<String> groupBy;
    private final Map<String, AggregateFunction> aggregations;

    public AggregationStep(List<String> groupBy, Map<String, String> aggregations) {
        this.groupBy = groupBy != null ? List.copyOf(groupBy) : List.of();
        this.aggregations = new LinkedHashMap<>();
        if (aggregations != null) {
            aggregations.forEach((field, function) -> this.aggregations.put(field,
                    AggregateFunction.fromString(function)
                            .orElseThrow(() -> new TransformException(
                                    "Unknown aggregate function '" + function + "' for field " + field))));
        }
    }

    @Override
    public TransformStepType getType() {
        return TransformStepType.AGGREGATION;
    }

    @Override
    public List<Map<String, Object>> apply(List<Map<String, Object>> rows) {
        if (groupBy.isEmpty()) {
            return rows;
        }

        Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            List<Object> key = new ArrayList<>(groupBy.size());
            for (String field : groupBy) {
                key.add(row.get(field));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }

        List<Map<String, Object>> result = new ArrayList<>(groups.size());
        for (Map.Entry<List<Object>, List<Map<String, Object>>> group : groups.entrySet()) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (int i = 0; i < groupBy.size(); i++) {
                out.put(groupBy.get(i), group.getKey().get(i));
            }
            aggregations.forEach((field, function) ->
                    out.put(field, reduce(function, field, group.getValue())));
            result.add(out);
        }
        return result;
    }

    private Object reduce(AggregateFunction function, String field, List<Map<String, Object>> rows) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object value = row.get(field);
            if (value != null) {
                values.add(value);
            }
        }

        switch (function) {
            case COUNT:
                return (long) values.size();
            case SUM:
                return sum(field, values);
            case AVG:
                if (values.isEmpty()) {
                    return null;
                }
                return numbers(field, values).stream().mapToDouble(Double::doubleValue).average().orElse(0d);
            case MIN:
                return values.stream().min(RowValues::compare).orElse(null);
            case MAX:
                return values.stream().max(RowValues::compare).orElse(null);
            default:
                throw new TransformException("Unsupported aggregate function " + function);
        }
    }

    private Object sum(String field, List<Object> values) {
        if (values.stream().allMatch(RowValues::isIntegral)) {
            return values.stream().mapToLong(v -> ((Number) v).longValue()).sum();
        }
        return numbers(field, values).stream().mapToDouble(Double::doubleValue).sum();
    }

    private List<Double> numbers(String field, List<Object> values) {
        List<Double> numbers = new ArrayList<>(values.size());
        for (Object value : values) {
            Double number = RowValues.toDouble(value);
            if (number == null) {
                throw new TransformException("Non-numeric value '" + value + "' in aggregated field " + field);
            }
            numbers.add(number);
        }
        return numbers;
    }
}
