package com.company.reporting;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableCaching
@EnableScheduling
@EnableAsync
@OpenAPIDefinition(
        info = @Info(
                title = "Reporting Engine API",
                version = "1.0.0",
                description = "Report execution, dashboard caching and alert evaluation service"
        )
)
public class ReportingEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportingEngineApplication.class, args);
    }
}
