package com.company.reporting.domain.enums;

import java.util.Locale;

public enum FilterOperator {
    EQUALS,
    GREATER_THAN,
    LESS_THAN,
    UNKNOWN;

    public static FilterOperator fromString(String operator) {
        if (operator == null) {
            return UNKNOWN;
        }
        try {
            return FilterOperator.valueOf(operator.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
