package com.company.reporting.transform;

import com.company.reporting.domain.enums.TransformStepType;

import java.util.List;
import java.util.Map;

public interface TransformStep {

    TransformStepType getType();

    /**
     * Returns the transformed rows. The input list is never mutated.
     */
    List<Map<String, Object>> apply(List<Map<String, Object>> rows);
}
