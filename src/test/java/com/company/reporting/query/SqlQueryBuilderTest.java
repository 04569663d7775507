package com.company.reporting.query;

import com.company.reporting.exception.ReportValidationException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlQueryBuilderTest {

    @Test
    void build_substitutesParameters() {
        String sql = SqlQueryBuilder.build(
                "SELECT * FROM sales WHERE year = ${year} AND region = '${region}'",
                Map.of("year", 2024, "region", "EU"),
                Map.of());

        assertThat(sql).isEqualTo("SELECT * FROM sales WHERE year = 2024 AND region = 'EU'");
    }

    @Test
    void build_noWhere_appendsWhereClause() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("region", "EU");
        filters.put("channel", List.of("web", "store"));

        String sql = SqlQueryBuilder.build("SELECT * FROM sales", Map.of(), filters);

        assertThat(sql).isEqualTo("SELECT * FROM sales WHERE region = 'EU' AND channel IN ('web','store')");
    }

    @Test
    void build_existingWhereAnyCase_appendsWithAnd() {
        String sql = SqlQueryBuilder.build("select * from sales where year = 2024", Map.of(), Map.of("region", "EU"));

        assertThat(sql).isEqualTo("select * from sales where year = 2024 AND region = 'EU'");
    }

    @Test
    void build_quoteInValue_isDoubled() {
        String sql = SqlQueryBuilder.build("SELECT * FROM customers", Map.of(), Map.of("name", "O'Brien"));

        assertThat(sql).endsWith("WHERE name = 'O''Brien'");
    }

    @Test
    void build_invalidFieldName_rejected() {
        assertThatThrownBy(() -> SqlQueryBuilder.build("SELECT * FROM t", Map.of(), Map.of("1=1; DROP", "x")))
                .isInstanceOf(ReportValidationException.class);
    }

    @Test
    void build_noFilters_queryUnchanged() {
        assertThat(SqlQueryBuilder.build("SELECT 1", null, null)).isEqualTo("SELECT 1");
    }

    @Test
    void build_emptyListFilter_matchesNothingButStaysValid() {
        String sql = SqlQueryBuilder.build("SELECT * FROM t", Map.of(), Map.of("region", List.of()));

        assertThat(sql).isEqualTo("SELECT * FROM t WHERE region IN ('')");
    }
}
