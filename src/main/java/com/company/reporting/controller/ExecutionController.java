package com.company.reporting.controller;

import com.company.reporting.dto.response.ExecutionResponse;
import com.company.reporting.service.ReportExecutionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/executions")
@Tag(name = "Executions", description = "Report execution status and results")
@RequiredArgsConstructor
public class ExecutionController {

    private final ReportExecutionService executionService;

    @GetMapping("/{executionId}")
    @Operation(summary = "Get an execution", description = "Poll until status is COMPLETED or FAILED")
    public ResponseEntity<ExecutionResponse> getExecution(@PathVariable String executionId) {
        return ResponseEntity.ok(ExecutionResponse.from(executionService.getExecution(executionId)));
    }
}
