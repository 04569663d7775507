package com.company.reporting.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * SDK autoconfiguration with exporters off unless configured. OTEL_* environment
 * variables and otel.* system properties still take precedence.
 */
@Configuration
@Slf4j
public class OpenTelemetryConfig {

    static final String INSTRUMENTATION_NAME = "reporting-engine";

    @Bean
    public OpenTelemetry openTelemetry(
            @Value("${spring.application.name:reporting-engine}") String serviceName,
            @Value("${reporting.tracing.exporter:none}") String exporter) {

        log.info("Initialising OpenTelemetry for {} (traces exporter: {})", serviceName, exporter);

        return AutoConfiguredOpenTelemetrySdk.builder()
                .addPropertiesSupplier(() -> Map.of(
                        "otel.service.name", serviceName,
                        "otel.traces.exporter", exporter,
                        "otel.metrics.exporter", "none",
                        "otel.logs.exporter", "none"))
                .build()
                .getOpenTelemetrySdk();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME);
    }
}
