package com.company.reporting.transform;

import com.company.reporting.exception.TransformException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Group-by semantics: one row per key tuple in first-seen order.
 */
class AggregationStepTest {

    @Test
    void apply_sumByGroup_firstSeenOrder() {
        List<Map<String, Object>> rows = List.of(
                row("region", "west", "sales", 10),
                row("region", "east", "sales", 5),
                row("region", "west", "sales", 7));

        List<Map<String, Object>> result = new AggregationStep(List.of("region"), Map.of("sales", "sum")).apply(rows);

        assertThat(result).hasSize(2);
        assertThat(result.get(0)).containsEntry("region", "west").containsEntry("sales", 17L);
        assertThat(result.get(1)).containsEntry("region", "east").containsEntry("sales", 5L);
        assertThat(new ArrayList<>(result.get(0).keySet())).containsExactly("region", "sales");
    }

    @Test
    void apply_sumWithDecimals_returnsDouble() {
        List<Map<String, Object>> rows = List.of(
                row("region", "west", "sales", 1.5),
                row("region", "west", "sales", 2));

        List<Map<String, Object>> result = new AggregationStep(List.of("region"), Map.of("sales", "sum")).apply(rows);

        assertThat(result.get(0).get("sales")).isEqualTo(3.5);
    }

    @Test
    void apply_avgCountMinMax() {
        List<Map<String, Object>> rows = List.of(
                row("team", "a", "score", 4),
                row("team", "a", "score", 8),
                row("team", "a", "score", null));

        Map<String, String> aggregations = new LinkedHashMap<>();
        aggregations.put("score", "avg");
        List<Map<String, Object>> avg = new AggregationStep(List.of("team"), aggregations).apply(rows);
        List<Map<String, Object>> count = new AggregationStep(List.of("team"), Map.of("score", "count")).apply(rows);
        List<Map<String, Object>> min = new AggregationStep(List.of("team"), Map.of("score", "min")).apply(rows);
        List<Map<String, Object>> max = new AggregationStep(List.of("team"), Map.of("score", "max")).apply(rows);

        assertThat(avg.get(0).get("score")).isEqualTo(6.0);
        assertThat(count.get(0).get("score")).isEqualTo(2L);
        assertThat(min.get(0).get("score")).isEqualTo(4);
        assertThat(max.get(0).get("score")).isEqualTo(8);
    }

    @Test
    void apply_multiFieldGroupKey() {
        List<Map<String, Object>> rows = List.of(
                row("region", "west", "year", 2023, "sales", 1),
                row("region", "west", "year", 2024, "sales", 2),
                row("region", "west", "year", 2023, "sales", 3));

        List<Map<String, Object>> result = new AggregationStep(List.of("region", "year"), Map.of("sales", "sum")).apply(rows);

        assertThat(result).hasSize(2);
        assertThat(result.get(0)).containsEntry("year", 2023).containsEntry("sales", 4L);
    }

    @Test
    void apply_emptyGroupBy_rowsUntouched() {
        List<Map<String, Object>> rows = List.of(row("sales", 1), row("sales", 2));

        assertThat(new AggregationStep(List.of(), Map.of("sales", "sum")).apply(rows)).isSameAs(rows);
    }

    @Test
    void constructor_unknownFunction_throws() {
        assertThatThrownBy(() -> new AggregationStep(List.of("region"), Map.of("sales", "median")))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("median");
    }

    static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
