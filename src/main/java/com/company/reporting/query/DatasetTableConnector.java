package com.company.reporting.query;

import com.company.reporting.domain.Dataset;
import com.company.reporting.domain.enums.SourceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads a dataset's backing table, narrowed by the request filters.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DatasetTableConnector implements DataSourceConnector {

    private static final int DEFAULT_ROW_LIMIT = 10_000;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public SourceKind getKind() {
        return SourceKind.DATASET;
    }

    @Override
    public List<Map<String, Object>> fetch(QueryRequest request) {
        Dataset dataset = request.getDataset();
        String table = SqlQueryBuilder.requireIdentifier(dataset.getTableName());

        String sql = SqlQueryBuilder.appendFilters("SELECT * FROM " + table, request.getFilters())
                + " LIMIT " + rowLimit(request);

        log.debug("Reading dataset {} ({})", dataset.getId(), table);

        return jdbcTemplate.queryForList(sql).stream()
                .map(LinkedHashMap::new)
                .collect(Collectors.toList());
    }

    private int rowLimit(QueryRequest request) {
        Object limit = request.getSource().configValue("limit");
        if (limit == null) {
            return DEFAULT_ROW_LIMIT;
        }
        try {
            return Integer.parseInt(String.valueOf(limit));
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric dataset row limit '{}'", limit);
            return DEFAULT_ROW_LIMIT;
        }
    }
}
