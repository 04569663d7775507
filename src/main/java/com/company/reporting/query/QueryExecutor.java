package com.company.reporting.query;

import com.company.reporting.domain.DataSourceDescriptor;
import com.company.reporting.domain.Dataset;
import com.company.reporting.domain.enums.SourceKind;
import com.company.reporting.exception.ReportValidationException;
import com.company.reporting.exception.ResourceNotFoundException;
import com.company.reporting.exception.UnsupportedSourceKindException;
import com.company.reporting.repository.DatasetRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a logical query to the connector registered for the source kind.
 */
@Service
@Slf4j
public class QueryExecutor {

    private final Map<SourceKind, DataSourceConnector> connectors = new EnumMap<>(SourceKind.class);
    private final DatasetRepository datasetRepository;

    public QueryExecutor(List<DataSourceConnector> connectors, DatasetRepository datasetRepository) {
        for (DataSourceConnector connector : connectors) {
            this.connectors.put(connector.getKind(), connector);
        }
        this.datasetRepository = datasetRepository;
    }

    public List<Map<String, Object>> execute(DataSourceDescriptor source,
                                             Map<String, Object> queryConfig,
                                             Map<String, Object> parameters,
                                             Map<String, Object> filters) {
        SourceKind kind = source != null ? source.kind() : SourceKind.UNSUPPORTED;
        Map<String, Object> params = parameters != null ? parameters : Collections.emptyMap();
        Map<String, Object> filterMap = filters != null ? filters : Collections.emptyMap();

        QueryRequest.QueryRequestBuilder request = QueryRequest.builder()
                .source(source)
                .parameters(params)
                .filters(filterMap);

        switch (kind) {
            case DATABASE:
                request.query(SqlQueryBuilder.build(requireQuery(queryConfig), params, filterMap));
                break;
            case DATASET:
                request.dataset(resolveDataset(source));
                break;
            case API:
                break;
            default:
                throw new UnsupportedSourceKindException(source != null ? source.getType() : null);
        }

        DataSourceConnector connector = connectors.get(kind);
        if (connector == null) {
            throw new UnsupportedSourceKindException(source.getType());
        }

        List<Map<String, Object>> rows = connector.fetch(request.build());
        log.debug("Fetched {} rows from {} source", rows.size(), kind);
        return rows;
    }

    /**
     * Runs every declared source in order and concatenates the rows. The first
     * failing source aborts the whole call.
     */
    public List<Map<String, Object>> executeAll(List<DataSourceDescriptor> sources,
                                                Map<String, Object> queryConfig,
                                                Map<String, Object> parameters,
                                                Map<String, Object> filters) {
        List<Map<String, Object>> combined = new ArrayList<>();
        for (DataSourceDescriptor source : sources) {
            combined.addAll(execute(source, queryConfig, parameters, filters));
        }
        return combined;
    }

    private String requireQuery(Map<String, Object> queryConfig) {
        Object query = queryConfig != null ? queryConfig.get("query") : null;
        if (query == null || String.valueOf(query).isBlank()) {
            throw new ReportValidationException("Query configuration must include 'query' field");
        }
        return String.valueOf(query);
    }

    private Dataset resolveDataset(DataSourceDescriptor source) {
        Object rawId = source.configValue("dataset_id");
        if (rawId == null) {
            throw new ReportValidationException("Dataset source must declare 'dataset_id'");
        }

        Long datasetId;
        try {
            datasetId = Long.valueOf(String.valueOf(rawId));
        } catch (NumberFormatException e) {
            throw new ResourceNotFoundException("Dataset", rawId);
        }

        return datasetRepository.findById(datasetId)
                .orElseThrow(() -> new ResourceNotFoundException("Dataset", datasetId));
    }
}
