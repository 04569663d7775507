package com.company.reporting.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Dashboard tile with its own query and its own cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Widget {

    public static final int DEFAULT_CACHE_TTL_MINUTES = 30;

    private Long id;
    private Long dashboardId;
    private String widgetKey;
    private String name;
    private String visualizationType;

    private DataSourceDescriptor dataSource;
    private Map<String, Object> queryConfig;
    private Map<String, Object> transformationConfig;
    private Map<String, Object> visualConfig;
    private Map<String, Object> positionConfig;
    private Integer position;
    private Boolean enabled;

    // Cache
    private Integer cacheTtlMinutes;
    private Map<String, Object> cachedPayload;
    private Instant cachedAt;

    public CacheState cacheState() {
        return CacheState.of(cachedPayload, cachedAt, cacheTtlMinutes, DEFAULT_CACHE_TTL_MINUTES);
    }

    public boolean isEnabled() {
        return !Boolean.FALSE.equals(enabled);
    }
}
