package com.company.reporting.domain.enums;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class OutputFormatTest {

    @ParameterizedTest
    @CsvSource({
            "csv, CSV",
            "' JSON ', JSON",
            "Excel, EXCEL",
            "pdf, PDF"
    })
    void fromString_knownFormats(String input, OutputFormat expected) {
        assertThat(OutputFormat.fromString(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"docx", "xlsx", "unsupported", ""})
    void fromString_anythingElse_isUnsupported(String input) {
        assertThat(OutputFormat.fromString(input)).isEqualTo(OutputFormat.UNSUPPORTED);
    }
}
