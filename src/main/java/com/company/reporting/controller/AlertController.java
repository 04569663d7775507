package com.company.reporting.controller;

import com.company.reporting.dto.request.AcknowledgeAlertRequest;
import com.company.reporting.dto.request.ResolveAlertRequest;
import com.company.reporting.dto.response.AlertInstanceResponse;
import com.company.reporting.service.AlertInstanceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/alerts/instances")
@Tag(name = "Alerts", description = "Alert instance lifecycle")
@RequiredArgsConstructor
public class AlertController {

    private final AlertInstanceService alertInstanceService;

    @PostMapping("/{instanceId}/acknowledge")
    @Operation(summary = "Acknowledge an active alert")
    public ResponseEntity<AlertInstanceResponse> acknowledge(
            @PathVariable Long instanceId,
            @Valid @RequestBody AcknowledgeAlertRequest request) {
        return ResponseEntity.ok(AlertInstanceResponse.from(
                alertInstanceService.acknowledge(instanceId, request.getUserId())));
    }

    @PostMapping("/{instanceId}/resolve")
    @Operation(summary = "Resolve an active or acknowledged alert")
    public ResponseEntity<AlertInstanceResponse> resolve(
            @PathVariable Long instanceId,
            @Valid @RequestBody ResolveAlertRequest request) {
        return ResponseEntity.ok(AlertInstanceResponse.from(
                alertInstanceService.resolve(instanceId, request.getUserId(), request.getReason())));
    }
}
