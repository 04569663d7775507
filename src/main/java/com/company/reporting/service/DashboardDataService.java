package com.company.reporting.service;

import com.company.reporting.domain.CacheState;
import com.company.reporting.domain.Dashboard;
import com.company.reporting.domain.Widget;
import com.company.reporting.exception.ResourceNotFoundException;
import com.company.reporting.query.QueryExecutor;
import com.company.reporting.repository.DashboardRepository;
import com.company.reporting.repository.WidgetRepository;
import com.company.reporting.transform.TransformPipeline;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles dashboard data widget by widget, serving each widget from its own
 * cache while the cache is fresh.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DashboardDataService {

    private final DashboardRepository dashboardRepository;
    private final WidgetRepository widgetRepository;
    private final QueryExecutor queryExecutor;
    private final TransformPipeline transformPipeline;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public Map<String, Object> getDashboardData(Long dashboardId,
                                                Map<String, Object> parameters,
                                                Map<String, Object> filters) {
        Dashboard dashboard = dashboardRepository.findById(dashboardId)
                .orElseThrow(() -> new ResourceNotFoundException("Dashboard", dashboardId));

        Map<String, Object> params = parameters != null ? parameters : Collections.emptyMap();
        Map<String, Object> filterMap = filters != null ? filters : Collections.emptyMap();

        dashboardRepository.recordView(dashboardId, clock.instant());

        List<Widget> widgets = widgetRepository.findByDashboardId(dashboardId);
        Map<String, Object> widgetData = new LinkedHashMap<>();
        for (Widget widget : widgets) {
            if (!widget.isEnabled()) {
                continue;
            }
            widgetData.put(widgetKey(widget), loadWidget(widget, params, filterMap));
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", dashboard.getId());
        summary.put("name", dashboard.getName());
        summary.put("layout_config", dashboard.getLayoutConfig());
        summary.put("theme_config", dashboard.getThemeConfig());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("dashboard", summary);
        result.put("widgets", widgetData);
        result.put("filters", filterMap);
        result.put("parameters", params);
        return result;
    }

    private Map<String, Object> loadWidget(Widget widget, Map<String, Object> parameters, Map<String, Object> filters) {
        Instant now = clock.instant();
        CacheState cache = widget.cacheState();
        if (cache.isValid(now)) {
            log.debug("Widget {} served from cache", widget.getId());
            meterRegistry.counter("reporting.widgets.cache.hit").increment();
            return cache.getPayload();
        }

        meterRegistry.counter("reporting.widgets.cache.miss").increment();
        try {
            List<Map<String, Object>> rows = queryExecutor.execute(
                    widget.getDataSource(), widget.getQueryConfig(), parameters, filters);
            List<Map<String, Object>> processed = transformPipeline.transformWidget(rows, widget.getTransformationConfig());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("data", processed);
            payload.put("visualization_type", widget.getVisualizationType());
            payload.put("visual_config", widget.getVisualConfig());
            payload.put("last_updated", now.toString());

            widget.setCachedPayload(payload);
            widget.setCachedAt(now);
            widgetRepository.updateCache(widget.getId(), payload, now);
            return payload;

        } catch (Exception e) {
            log.error("Failed to load widget {} of dashboard {}", widget.getId(), widget.getDashboardId(), e);
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return error;
        }
    }

    private String widgetKey(Widget widget) {
        return widget.getWidgetKey() != null ? widget.getWidgetKey() : "widget_" + widget.getId();
    }
}
