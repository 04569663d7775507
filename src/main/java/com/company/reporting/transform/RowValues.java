package com.company.reporting.transform;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Value coercion shared by the filter, sort and aggregation steps.
 */
public final class RowValues {

    private static final int NUMERIC_RANK = 0;
    private static final int COMPARABLE_RANK = 1;
    private static final int TEXT_RANK = 2;

    private RowValues() {
    }

    public static boolean isNumeric(Object value) {
        return value instanceof Number;
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    /**
     * Numbers as-is, numeric strings parsed, everything else null.
     */
    public static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim()).doubleValue();
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static boolean anyRowHas(List<Map<String, Object>> rows, String field) {
        return field != null && rows.stream().anyMatch(row -> row.containsKey(field));
    }

    /**
     * Total order over mixed columns. Values are ranked numeric (numbers and numeric
     * strings), comparable, then text, and ordered within their rank. Callers handle nulls.
     */
    @SuppressWarnings("unchecked")
    public static int compare(Object left, Object right) {
        int leftRank = rank(left);
        int rightRank = rank(right);
        if (leftRank != rightRank) {
            return Integer.compare(leftRank, rightRank);
        }
        if (leftRank == NUMERIC_RANK) {
            int byValue = Double.compare(toDouble(left), toDouble(right));
            return byValue != 0 ? byValue : String.valueOf(left).compareTo(String.valueOf(right));
        }
        if (leftRank == COMPARABLE_RANK) {
            if (left.getClass() == right.getClass()) {
                return ((Comparable<Object>) left).compareTo(right);
            }
            int byType = left.getClass().getName().compareTo(right.getClass().getName());
            if (byType != 0) {
                return byType;
            }
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }

    /**
     * True when both values share a rank in {@link #compare}.
     */
    public static boolean sameKind(Object left, Object right) {
        return rank(left) == rank(right);
    }

    private static int rank(Object value) {
        if (toDouble(value) != null) {
            return NUMERIC_RANK;
        }
        if (value instanceof Comparable && !(value instanceof String)) {
            return COMPARABLE_RANK;
        }
        return TEXT_RANK;
    }
}
