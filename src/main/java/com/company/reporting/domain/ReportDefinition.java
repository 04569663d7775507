package com.company.reporting.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Declarative report: where the rows come from, how they are shaped and how long
 * the last result may be served from cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportDefinition {

    public static final int DEFAULT_CACHE_TTL_MINUTES = 60;

    private Long id;
    private String tenantId;
    private String name;
    private String description;
    private String reportType;

    // Query definition
    private List<DataSourceDescriptor> dataSources;
    private Map<String, Object> queryConfig;
    private Map<String, Object> visualizationConfig;
    private List<String> outputFormats;

    // Scheduling
    private Integer autoRefreshIntervalMinutes;
    private Instant nextRunAt;
    private Instant lastRunAt;

    // Cache
    private Integer cacheTtlMinutes;
    private Map<String, Object> cachedPayload;
    private Instant cachedAt;

    private Instant createdAt;
    private Instant updatedAt;

    public CacheState cacheState() {
        return CacheState.of(cachedPayload, cachedAt, cacheTtlMinutes, DEFAULT_CACHE_TTL_MINUTES);
    }

    public boolean isScheduled() {
        return autoRefreshIntervalMinutes != null && autoRefreshIntervalMinutes > 0;
    }
}
