package com.company.reporting.controller;

import com.company.reporting.service.DashboardDataService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/dashboards")
@Tag(name = "Dashboards", description = "Dashboard data with per-widget caching")
@RequiredArgsConstructor
public class DashboardController {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final DashboardDataService dashboardDataService;
    private final ObjectMapper objectMapper;

    @GetMapping("/{dashboardId}/data")
    @Operation(summary = "Get dashboard data")
    public ResponseEntity<Map<String, Object>> getDashboardData(
            @PathVariable Long dashboardId,
            @Parameter(description = "JSON object of query parameters")
            @RequestParam(required = false) String parameters,
            @Parameter(description = "JSON object of filters, values may be lists")
            @RequestParam(required = false) String filters) {

        return ResponseEntity.ok(dashboardDataService.getDashboardData(
                dashboardId, parseJson("parameters", parameters), parseJson("filters", filters)));
    }

    private Map<String, Object> parseJson(String name, String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Query parameter '" + name + "' is not a JSON object", e);
        }
    }
}
