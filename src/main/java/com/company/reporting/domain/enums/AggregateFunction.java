package com.company.reporting.domain.enums;

import java.util.Locale;
import java.util.Optional;

public enum AggregateFunction {
    SUM,
    AVG,
    COUNT,
    MIN,
    MAX;

    public static Optional<AggregateFunction> fromString(String function) {
        if (function == null) {
            return Optional.empty();
        }
        String normalized = function.trim().toUpperCase(Locale.ROOT);
        if ("MEAN".equals(normalized)) {
            return Optional.of(AVG);
        }
        try {
            return Optional.of(AggregateFunction.valueOf(normalized));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
