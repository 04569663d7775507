package com.company.reporting.transform;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Applies transformation steps strictly in declared order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransformPipeline {

    private final TransformStepParser parser;

    public List<Map<String, Object>> transform(List<Map<String, Object>> rows, List<TransformStep> steps) {
        List<Map<String, Object>> current = rows;
        for (TransformStep step : steps) {
            int before = current.size();
            current = step.apply(current);
            log.debug("Applied {} step: {} -> {} rows", step.getType(), before, current.size());
        }
        return current;
    }

    public List<Map<String, Object>> transformReport(List<Map<String, Object>> rows, Map<String, Object> queryConfig) {
        return transform(rows, parser.parseReportSteps(queryConfig));
    }

    public List<Map<String, Object>> transformWidget(List<Map<String, Object>> rows, Map<String, Object> transformationConfig) {
        return transform(rows, parser.parseWidgetConfig(transformationConfig));
    }
}
