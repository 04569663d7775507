package com.company.reporting.domain.enums;

public enum ComparisonOperator {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!="),
    UNKNOWN("?");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * UNKNOWN never reports a breach.
     */
    public boolean test(double value, double threshold) {
        switch (this) {
            case GREATER_THAN:
                return value > threshold;
            case LESS_THAN:
                return value < threshold;
            case GREATER_THAN_OR_EQUAL:
                return value >= threshold;
            case LESS_THAN_OR_EQUAL:
                return value <= threshold;
            case EQUAL:
                return Double.compare(value, threshold) == 0;
            case NOT_EQUAL:
                return Double.compare(value, threshold) != 0;
            default:
                return false;
        }
    }

    public static ComparisonOperator fromSymbol(String symbol) {
        if (symbol == null) {
            return UNKNOWN;
        }
        String trimmed = symbol.trim();
        for (ComparisonOperator operator : values()) {
            if (operator != UNKNOWN && operator.symbol.equals(trimmed)) {
                return operator;
            }
        }
        return UNKNOWN;
    }
}
