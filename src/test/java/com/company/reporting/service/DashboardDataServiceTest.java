package com.company.reporting.service;

import com.company.reporting.domain.Dashboard;
import com.company.reporting.domain.DataSourceDescriptor;
import com.company.reporting.domain.Widget;
import com.company.reporting.exception.ResourceNotFoundException;
import com.company.reporting.query.QueryExecutor;
import com.company.reporting.repository.DashboardRepository;
import com.company.reporting.repository.WidgetRepository;
import com.company.reporting.transform.TransformPipeline;
import com.company.reporting.transform.TransformStepParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DashboardDataServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private DashboardRepository dashboardRepository;

    @Mock
    private WidgetRepository widgetRepository;

    @Mock
    private QueryExecutor queryExecutor;

    private DashboardDataService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new DashboardDataService(dashboardRepository, widgetRepository, queryExecutor,
                new TransformPipeline(new TransformStepParser()), new SimpleMeterRegistry(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        when(dashboardRepository.findById(3L)).thenReturn(Optional.of(Dashboard.builder()
                .id(3L)
                .name("Ops")
                .layoutConfig(Map.of("columns", 12))
                .build()));
    }

    @Test
    void getDashboardData_freshCache_servedWithoutQuery() {
        Map<String, Object> cached = Map.of("data", List.of(), "last_updated", "earlier");
        Widget widget = widget(1L, "revenue");
        widget.setCachedPayload(cached);
        widget.setCachedAt(NOW.minusSeconds(60));
        when(widgetRepository.findByDashboardId(3L)).thenReturn(List.of(widget));

        Map<String, Object> result = service.getDashboardData(3L, null, null);

        assertThat(widgets(result).get("revenue")).isEqualTo(cached);
        verify(queryExecutor, never()).execute(any(), any(), any(), any());
        verify(dashboardRepository).recordView(3L, NOW);
    }

    @Test
    void getDashboardData_staleCache_requeriedTransformedAndCached() {
        Widget widget = widget(1L, null);
        widget.setCachedPayload(Map.of("data", List.of()));
        widget.setCachedAt(NOW.minusSeconds(31 * 60));
        widget.setTransformationConfig(Map.of("limit", 1));
        when(widgetRepository.findByDashboardId(3L)).thenReturn(List.of(widget));
        when(queryExecutor.execute(any(), any(), anyMap(), anyMap()))
                .thenReturn(List.of(Map.of("v", 1), Map.of("v", 2)));

        Map<String, Object> result = service.getDashboardData(3L, Map.of("day", "mon"), null);

        Map<String, Object> payload = asMap(widgets(result).get("widget_1"));
        assertThat((List<?>) payload.get("data")).hasSize(1);
        assertThat(payload).containsEntry("visualization_type", "metric")
                .containsEntry("last_updated", NOW.toString());
        verify(widgetRepository).updateCache(eq(1L), any(), eq(NOW));
        verify(queryExecutor).execute(any(), any(), eq(Map.of("day", "mon")), anyMap());
    }

    @Test
    void getDashboardData_failingWidget_isolated() {
        Widget broken = widget(1L, "broken");
        Widget healthy = widget(2L, "healthy");
        healthy.setDataSource(DataSourceDescriptor.builder().type("dataset").config(Map.of("dataset_id", 4)).build());
        when(widgetRepository.findByDashboardId(3L)).thenReturn(List.of(broken, healthy));
        when(queryExecutor.execute(eq(broken.getDataSource()), any(), anyMap(), anyMap()))
                .thenThrow(new IllegalStateException("relation does not exist"));
        when(queryExecutor.execute(eq(healthy.getDataSource()), any(), anyMap(), anyMap()))
                .thenReturn(List.of(Map.of("v", 1)));

        Map<String, Object> widgets = widgets(service.getDashboardData(3L, null, null));

        assertThat(asMap(widgets.get("broken"))).containsEntry("error", "relation does not exist");
        assertThat(asMap(widgets.get("healthy"))).containsKey("data");
    }

    @Test
    void getDashboardData_disabledWidget_omitted() {
        Widget disabled = widget(1L, "hidden");
        disabled.setEnabled(false);
        when(widgetRepository.findByDashboardId(3L)).thenReturn(List.of(disabled));

        Map<String, Object> result = service.getDashboardData(3L, null, null);

        assertThat(widgets(result)).isEmpty();
        assertThat(asMap(result.get("dashboard"))).containsEntry("name", "Ops");
        assertThat(result).containsEntry("filters", Map.of()).containsEntry("parameters", Map.of());
    }

    @Test
    void getDashboardData_unknownDashboard_notFound() {
        when(dashboardRepository.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getDashboardData(9L, null, null))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(dashboardRepository, never()).recordView(any(), any());
    }

    private Widget widget(Long id, String key) {
        return Widget.builder()
                .id(id)
                .dashboardId(3L)
                .widgetKey(key)
                .visualizationType("metric")
                .dataSource(DataSourceDescriptor.builder().type("database").config(Map.of("name", "w" + id)).build())
                .queryConfig(Map.of("query", "SELECT 1"))
                .enabled(true)
                .build();
    }

    private static Map<String, Object> widgets(Map<String, Object> result) {
        return asMap(result.get("widgets"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
