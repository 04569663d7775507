package com.company.reporting.visualization;

import com.company.reporting.domain.enums.ChartType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shapes result rows into named chart payloads, one per configured chart.
 */
@Component
@Slf4j
public class VisualizationBuilder {

    @SuppressWarnings("unchecked")
    public Map<String, ChartPayload> build(List<Map<String, Object>> rows, Map<String, Object> visualizationConfig) {
        Map<String, ChartPayload> visualizations = new LinkedHashMap<>();
        if (visualizationConfig == null || !(visualizationConfig.get("charts") instanceof List)) {
            return visualizations;
        }

        for (Object chart : (List<Object>) visualizationConfig.get("charts")) {
            if (!(chart instanceof Map)) {
                continue;
            }
            Map<String, Object> chartConfig = (Map<String, Object>) chart;
            Object name = chartConfig.get("name");
            String chartName = name != null ? String.valueOf(name) : "chart_" + visualizations.size();
            visualizations.put(chartName, buildChart(rows, chartConfig));
        }
        return visualizations;
    }

    ChartPayload buildChart(List<Map<String, Object>> rows, Map<String, Object> chartConfig) {
        String rawType = chartConfig.get("type") != null ? String.valueOf(chartConfig.get("type")) : null;
        ChartType chartType = ChartType.fromString(rawType);

        if (chartType == ChartType.UNKNOWN) {
            log.debug("Passing through rows for unrecognised chart type '{}'", rawType);
            return ChartPayload.builder()
                    .type(rawType)
                    .data(rows)
                    .config(Collections.emptyMap())
                    .build();
        }

        Map<String, Object> config = new LinkedHashMap<>();
        switch (chartType) {
            case BAR:
            case LINE:
            case SCATTER:
                config.put("x_field", chartConfig.get("x_field"));
                config.put("y_field", chartConfig.get("y_field"));
                break;
            case PIE:
                config.put("label_field", chartConfig.get("label_field"));
                config.put("value_field", chartConfig.get("value_field"));
                break;
            case TABLE:
                config.put("columns", chartConfig.containsKey("columns")
                        ? chartConfig.get("columns")
                        : defaultColumns(rows));
                break;
            case METRIC:
                config.put("value_field", chartConfig.get("value_field"));
                config.put("label", chartConfig.get("label"));
                break;
            case GAUGE:
                config.put("value_field", chartConfig.get("value_field"));
                config.put("min", chartConfig.getOrDefault("min", 0));
                config.put("max", chartConfig.getOrDefault("max", 100));
                break;
            case HEATMAP:
                config.put("x_field", chartConfig.get("x_field"));
                config.put("y_field", chartConfig.get("y_field"));
                config.put("value_field", chartConfig.get("value_field"));
                break;
            default:
                break;
        }
        config.put("title", chartConfig.getOrDefault("title", chartType.getDefaultTitle()));

        return ChartPayload.builder()
                .type(chartType.getValue())
                .data(rows)
                .config(config)
                .build();
    }

    private List<String> defaultColumns(List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(rows.get(0).keySet());
    }
}
