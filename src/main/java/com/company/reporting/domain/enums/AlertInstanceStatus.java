package com.company.reporting.domain.enums;

public enum AlertInstanceStatus {
    ACTIVE("Threshold breached and not yet handled"),
    ACKNOWLEDGED("Someone is looking at the breach"),
    RESOLVED("Breach closed");

    private final String description;

    AlertInstanceStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public String toValue() {
        return name().toLowerCase();
    }

    public static AlertInstanceStatus fromString(String status) {
        if (status == null) {
            return ACTIVE;
        }
        try {
            return AlertInstanceStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return ACTIVE;
        }
    }
}
