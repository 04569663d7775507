package com.company.reporting.query;

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
 * Runs relational report queries against the service's own datasource.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcQueryConnector implements DataSourceConnector {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public SourceKind getKind() {
        return SourceKind.DATABASE;
    }

    @Override
    public List<Map<String, Object>> fetch(QueryRequest request) {
        log.debug("Executing report query: {}", request.getQuery());

        return jdbcTemplate.queryForList(request.getQuery()).stream()
                .map(LinkedHashMap::new)
                .collect(Collectors.toList());
    }
}
