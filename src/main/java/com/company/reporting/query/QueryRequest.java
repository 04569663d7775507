package com.company.reporting.query;

import com.company.reporting.domain.DataSourceDescriptor;
import com.company.reporting.domain.Dataset;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * What a connector needs to fetch rows for one declared source.
 */
@Getter
@Builder
public class QueryRequest {
    private final DataSourceDescriptor source;
    // Final query text for relational sources, after parameter and filter expansion
    private final String query;
    private final Map<String, Object> parameters;
    private final Map<String, Object> filters;
    // Resolved target for dataset-reference sources
    private final Dataset dataset;
}
