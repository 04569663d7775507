package com.company.reporting.domain;

import com.company.reporting.domain.enums.ExecutionStatus;
import com.company.reporting.domain.enums.TriggerType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One run of a report. Only status, timing and result fields change after insert.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReportExecution {
    private String executionId;
    private Long reportId;

    private ExecutionStatus status;
    private TriggerType triggerType;
    private String triggeredBy;

    private Map<String, Object> parameters;
    private Map<String, Object> filters;
    private List<String> outputFormats;

    // Timing
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;

    // Results
    private Map<String, Object> resultPayload;
    private List<OutputArtifact> outputArtifacts;
    private Long rowsProcessed;
    private String errorMessage;
}
