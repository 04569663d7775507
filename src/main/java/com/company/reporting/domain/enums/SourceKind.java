package com.company.reporting.domain.enums;

import java.util.Locale;

/**
 * Closed set of data source kinds a report, widget or alert rule can declare.
 */
public enum SourceKind {
    DATABASE,
    DATASET,
    API,
    UNSUPPORTED;

    public static SourceKind fromString(String type) {
        if (type == null) {
            return UNSUPPORTED;
        }
        switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "database":
            case "sql":
            case "relational":
                return DATABASE;
            case "dataset":
            case "data_set":
                return DATASET;
            case "api":
                return API;
            default:
                return UNSUPPORTED;
        }
    }
}
