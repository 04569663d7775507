package com.company.reporting.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Dashboard {
    private Long id;
    private String tenantId;
    private String name;
    private String description;
    private Map<String, Object> layoutConfig;
    private Map<String, Object> themeConfig;
    private Long viewCount;
    private Instant lastViewedAt;
    private Instant createdAt;
}
