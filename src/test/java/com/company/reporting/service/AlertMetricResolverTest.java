package com.company.reporting.service;

import com.company.reporting.domain.AlertRule;
import com.company.reporting.domain.DataSourceDescriptor;
import com.company.reporting.query.QueryExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.when;

class AlertMetricResolverTest {

    @Mock
    private QueryExecutor queryExecutor;

    private AlertMetricResolver resolver;

    private final AlertRule rule = AlertRule.builder()
            .id(7L)
            .dataSource(DataSourceDescriptor.builder().type("database").config(Map.of()).build())
            .queryConfig(Map.of("query", "SELECT count(*) AS errors, 'api' AS service FROM errors"))
            .build();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        resolver = new AlertMetricResolver(queryExecutor);
    }

    @Test
    void resolve_valueFieldConfigured_readsThatColumn() {
        rule.setConditionConfig(Map.of("value_field", "p95"));
        when(queryExecutor.execute(any(), any(), anyMap(), anyMap()))
                .thenReturn(List.of(Map.of("p50", 12, "p95", "180.5")));

        assertThat(resolver.resolve(rule)).contains(180.5);
    }

    @Test
    void resolve_noValueField_firstNumericColumn() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("service", "api");
        row.put("errors", 42L);
        row.put("warnings", 3L);
        when(queryExecutor.execute(any(), any(), anyMap(), anyMap())).thenReturn(List.of(row));

        assertThat(resolver.resolve(rule)).contains(42.0);
    }

    @Test
    void resolve_noRows_empty() {
        when(queryExecutor.execute(any(), any(), anyMap(), anyMap())).thenReturn(List.of());

        assertThat(resolver.resolve(rule)).isEmpty();
    }

    @Test
    void resolve_queryFails_propagates() {
        when(queryExecutor.execute(any(), any(), anyMap(), anyMap())).thenThrow(new IllegalStateException("timeout"));

        assertThatThrownBy(() -> resolver.resolve(rule)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void extractValue_nonNumericField_empty() {
        assertThat(AlertMetricResolver.extractValue(Map.of("status", "ok"), "status")).isEmpty();
        assertThat(AlertMetricResolver.extractValue(Map.of("status", "ok"), null)).isEmpty();
    }
}
