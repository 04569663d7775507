package com.company.reporting.domain.enums;

import java.util.Locale;

public enum OutputFormat {
    CSV("csv", "csv"),
    JSON("json", "json"),
    EXCEL("excel", "xlsx"),
    PDF("pdf", "pdf"),
    UNSUPPORTED("unsupported", null);

    private final String value;
    private final String extension;

    OutputFormat(String value, String extension) {
        this.value = value;
        this.extension = extension;
    }

    public String getValue() {
        return value;
    }

    public String getExtension() {
        return extension;
    }

    public static OutputFormat fromString(String format) {
        if (format == null) {
            return UNSUPPORTED;
        }
        String normalized = format.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat outputFormat : values()) {
            if (outputFormat != UNSUPPORTED && outputFormat.value.equals(normalized)) {
                return outputFormat;
            }
        }
        return UNSUPPORTED;
    }
}
