package com.company.reporting.config;

import com.company.reporting.domain.enums.ExecutionStatus;
import com.company.reporting.repository.ReportExecutionRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final ReportExecutionRepository executionRepository;

    @Bean
    public MeterBinder reportingMetrics() {
        return registry -> {
            Gauge.builder("reporting.executions.running", executionRepository, repo -> {
                        try {
                            return repo.countByStatus(ExecutionStatus.RUNNING);
                        } catch (Exception e) {
                            log.warn("Failed to count running report executions", e);
                            return 0;
                        }
                    })
                    .description("Report executions currently in RUNNING state")
                    .register(registry);

            log.info("Reporting metrics registered");
        };
    }
}
