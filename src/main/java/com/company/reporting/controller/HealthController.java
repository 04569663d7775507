package com.company.reporting.controller;

import com.company.reporting.domain.enums.ExecutionStatus;
import com.company.reporting.repository.ReportExecutionRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Liveness plus a database round trip")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final ReportExecutionRepository executionRepository;
    private final Clock clock;

    @GetMapping
    @Operation(summary = "Health check", description = "503 when the reporting database is unreachable")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", "reporting-engine");
        response.put("timestamp", clock.instant());

        try {
            response.put("runningExecutions", executionRepository.countByStatus(ExecutionStatus.RUNNING));
            response.put("status", "UP");
            return ResponseEntity.ok(response);
        } catch (DataAccessException e) {
            log.warn("Health check could not reach the database: {}", e.getMessage());
            response.put("status", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
    }
}
