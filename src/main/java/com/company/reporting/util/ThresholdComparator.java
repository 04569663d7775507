package com.company.reporting.util;

import com.company.reporting.domain.enums.ComparisonOperator;

public final class ThresholdComparator {

    private ThresholdComparator() {
    }

    /**
     * Returns true when {@code value} breaches {@code threshold} under the given operator
     * symbol (">", "<", ">=", "<=", "==", "!="). Unknown symbols never breach.
     */
    public static boolean compare(double value, double threshold, String operator) {
        return ComparisonOperator.fromSymbol(operator).test(value, threshold);
    }

    public static boolean compare(Double value, Double threshold, ComparisonOperator operator) {
        if (value == null || threshold == null || operator == null) {
            return false;
        }
        return operator.test(value, threshold);
    }
}
