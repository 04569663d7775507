package com.company.reporting.transform;

import com.company.reporting.domain.enums.TransformStepType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Placeholder for step types this engine does not know. Leaves rows untouched.
 */
@Slf4j
@Getter
public class UnknownStep implements TransformStep {

    private final String declaredType;

    public UnknownStep(String declaredType) {
        this.declaredType = declaredType;
    }

    @Override
    public TransformStepType getType() {
        return TransformStepType.UNKNOWN;
    }

    @Override
    public List<Map<String, Object>> apply(List<Map<String, Object>> rows) {
        log.warn("Ignoring unknown transformation step type '{}'", declaredType);
        return rows;
    }
}
