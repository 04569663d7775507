package com.company.reporting.transform;

import com.company.reporting.domain.enums.TransformStepType;
import com.company.reporting.exception.TransformException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns declarative step maps into {@link TransformStep}s.
 *
 * <p>Report steps are inline maps, e.g.
 * {@code {"type": "aggregation", "group_by": ["region"], "aggregations": {"sales": "sum"}}}.
 * Widget configs use the shorthand {@code {"filters": [...], "sort": {...}, "limit": n}}.
 */
@Component
public class TransformStepParser {

    public List<TransformStep> parse(List<Map<String, Object>> stepConfigs) {
        if (stepConfigs == null) {
            return Collections.emptyList();
        }
        List<TransformStep> steps = new ArrayList<>(stepConfigs.size());
        for (Map<String, Object> config : stepConfigs) {
            steps.add(parseStep(config));
        }
        return steps;
    }

    @SuppressWarnings("unchecked")
    public List<TransformStep> parseReportSteps(Map<String, Object> queryConfig) {
        if (queryConfig == null || !(queryConfig.get("transformations") instanceof List)) {
            return Collections.emptyList();
        }
        return parse((List<Map<String, Object>>) queryConfig.get("transformations"));
    }

    /**
     * Widget shorthand expands to filters first, then sort, then limit.
     */
    @SuppressWarnings("unchecked")
    public List<TransformStep> parseWidgetConfig(Map<String, Object> transformationConfig) {
        if (transformationConfig == null || transformationConfig.isEmpty()) {
            return Collections.emptyList();
        }

        List<TransformStep> steps = new ArrayList<>();
        Object filters = transformationConfig.get("filters");
        if (filters instanceof List) {
            for (Object filter : (List<Object>) filters) {
                if (filter instanceof Map) {
                    steps.add(filterStep((Map<String, Object>) filter));
                }
            }
        }

        Object sort = transformationConfig.get("sort");
        if (sort instanceof Map) {
            steps.add(sortStep((Map<String, Object>) sort));
        }

        Object limit = transformationConfig.get("limit");
        if (limit != null) {
            steps.add(new LimitStep(toInt(limit, "limit")));
        }
        return steps;
    }

    TransformStep parseStep(Map<String, Object> config) {
        String declaredType = config.get("type") != null ? String.valueOf(config.get("type")) : null;

        switch (TransformStepType.fromString(declaredType)) {
            case AGGREGATION:
                return aggregationStep(config);
            case FILTER:
                return filterStep(config);
            case SORT:
                return sortStep(config);
            case LIMIT:
                Object n = config.containsKey("n") ? config.get("n") : config.get("limit");
                return new LimitStep(toInt(n, "limit"));
            default:
                return new UnknownStep(declaredType);
        }
    }

    @SuppressWarnings("unchecked")
    private AggregationStep aggregationStep(Map<String, Object> config) {
        List<String> groupBy = new ArrayList<>();
        Object rawGroupBy = config.get("group_by");
        if (rawGroupBy instanceof List) {
            ((List<Object>) rawGroupBy).forEach(field -> groupBy.add(String.valueOf(field)));
        } else if (rawGroupBy != null) {
            groupBy.add(String.valueOf(rawGroupBy));
        }

        Map<String, String> aggregations = new LinkedHashMap<>();
        Object rawAggregations = config.get("aggregations");
        if (rawAggregations instanceof Map) {
            ((Map<String, Object>) rawAggregations).forEach((field, function) ->
                    aggregations.put(field, String.valueOf(function)));
        }
        return new AggregationStep(groupBy, aggregations);
    }

    private FilterStep filterStep(Map<String, Object> config) {
        Object field = config.get("field");
        Object operator = config.getOrDefault("operator", "equals");
        return new FilterStep(field != null ? String.valueOf(field) : null, String.valueOf(operator), config.get("value"));
    }

    private SortStep sortStep(Map<String, Object> config) {
        Object field = config.containsKey("field") ? config.get("field") : config.get("sort_by");
        boolean ascending = true;
        if (config.get("ascending") != null) {
            ascending = Boolean.parseBoolean(String.valueOf(config.get("ascending")));
        } else if (config.get("direction") != null) {
            ascending = !"desc".equalsIgnoreCase(String.valueOf(config.get("direction")));
        }
        return new SortStep(field != null ? String.valueOf(field) : null, ascending);
    }

    private int toInt(Object value, String name) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new TransformException("Invalid " + name + " value: " + value);
        }
    }
}
