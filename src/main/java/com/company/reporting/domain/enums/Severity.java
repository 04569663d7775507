package com.company.reporting.domain.enums;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String toValue() {
        return name().toLowerCase();
    }

    /**
     * Unrecognised or missing severities default to MEDIUM.
     */
    public static Severity fromString(String severity) {
        if (severity == null) {
            return MEDIUM;
        }
        try {
            return Severity.valueOf(severity.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
