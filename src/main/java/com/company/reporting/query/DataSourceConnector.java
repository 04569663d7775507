package com.company.reporting.query;

import com.company.reporting.domain.enums.SourceKind;

import java.util.List;
import java.util.Map;

/**
 * Driver for one kind of data source. Implementations must not mutate report or
 * widget state; timeouts are their own responsibility.
 */
public interface DataSourceConnector {

    SourceKind getKind();

    List<Map<String, Object>> fetch(QueryRequest request);
}
