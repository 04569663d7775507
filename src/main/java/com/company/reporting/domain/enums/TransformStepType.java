package com.company.reporting.domain.enums;

import java.util.Locale;

public enum TransformStepType {
    AGGREGATION,
    FILTER,
    SORT,
    LIMIT,
    UNKNOWN;

    public static TransformStepType fromString(String type) {
        if (type == null) {
            return UNKNOWN;
        }
        try {
            return TransformStepType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
