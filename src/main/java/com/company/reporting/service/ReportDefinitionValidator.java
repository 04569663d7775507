package com.company.reporting.service;

import com.company.reporting.domain.DataSourceDescriptor;
import com.company.reporting.domain.ReportDefinition;
import com.company.reporting.exception.ReportValidationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Structural checks run before a report is stored and before every run.
 */
@Component
public class ReportDefinitionValidator {

    public void validate(ReportDefinition report) {
        validate(report.getDataSources(), report.getQueryConfig());
    }

    public void validate(List<DataSourceDescriptor> dataSources, Map<String, Object> queryConfig) {
        if (dataSources == null || dataSources.isEmpty()) {
            throw new ReportValidationException("Report must have at least one data source");
        }

        for (int i = 0; i < dataSources.size(); i++) {
            DataSourceDescriptor source = dataSources.get(i);
            if (source == null || source.getType() == null || source.getType().isBlank()) {
                throw new ReportValidationException("Data source " + i + " must specify 'type'");
            }
            if (source.getConfig() == null) {
                throw new ReportValidationException("Data source " + i + " must specify 'config'");
            }
        }

        if (queryConfig == null || queryConfig.get("query") == null) {
            throw new ReportValidationException("Query configuration must include 'query' field");
        }
    }
}
