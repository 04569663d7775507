package com.company.reporting.domain.enums;

import java.util.Locale;

public enum ChartType {
    BAR("bar_chart", "Bar Chart"),
    LINE("line_chart", "Line Chart"),
    PIE("pie_chart", "Pie Chart"),
    TABLE("table", "Data Table"),
    METRIC("metric", "Metric"),
    GAUGE("gauge", "Gauge"),
    HEATMAP("heatmap", "Heatmap"),
    SCATTER("scatter_plot", "Scatter Plot"),
    UNKNOWN(null, null);

    private final String value;
    private final String defaultTitle;

    ChartType(String value, String defaultTitle) {
        this.value = value;
        this.defaultTitle = defaultTitle;
    }

    public String getValue() {
        return value;
    }

    public String getDefaultTitle() {
        return defaultTitle;
    }

    /**
     * Accepts both the short ("bar") and the suffixed ("bar_chart") spelling.
     */
    public static ChartType fromString(String type) {
        if (type == null) {
            return UNKNOWN;
        }
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        for (ChartType chartType : values()) {
            if (chartType == UNKNOWN) {
                continue;
            }
            if (normalized.equals(chartType.value) || normalized.equals(chartType.name().toLowerCase(Locale.ROOT))) {
                return chartType;
            }
        }
        return UNKNOWN;
    }
}
