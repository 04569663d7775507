package com.company.reporting.transform;

import com.company.reporting.domain.enums.TransformStepType;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Stable sort on one field, nulls last in both directions.
 */
@Getter
@ToString
public class SortStep implements TransformStep {

    private final String field;
    private final boolean ascending;

    public SortStep(String field, boolean ascending) {
        this.field = field;
        this.ascending = ascending;
    }

    @Override
    public TransformStepType getType() {
        return TransformStepType.SORT;
    }

    @Override
    public List<Map<String, Object>> apply(List<Map<String, Object>> rows) {
        if (!RowValues.anyRowHas(rows, field)) {
            return rows;
        }

        Comparator<Object> valueOrder = ascending
                ? RowValues::compare
                : (a, b) -> RowValues.compare(b, a);

        List<Map<String, Object>> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparing(row -> row.get(field), Comparator.nullsLast(valueOrder)));
        return sorted;
    }
}
