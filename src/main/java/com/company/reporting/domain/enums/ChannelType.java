package com.company.reporting.domain.enums;

import java.util.Locale;

public enum ChannelType {
    EMAIL,
    WEBHOOK,
    SLACK,
    UNSUPPORTED;

    public static ChannelType fromString(String type) {
        if (type == null) {
            return UNSUPPORTED;
        }
        try {
            return ChannelType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNSUPPORTED;
        }
    }
}
