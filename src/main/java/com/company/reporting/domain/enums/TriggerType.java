package com.company.reporting.domain.enums;

public enum TriggerType {
    MANUAL,
    SCHEDULED,
    API,
    CACHED;

    public String toValue() {
        return name().toLowerCase();
    }

    public static TriggerType fromString(String value) {
        if (value == null) {
            return API;
        }
        try {
            return TriggerType.valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            return API;
        }
    }
}
