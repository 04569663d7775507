package com.company.reporting.dto.response;

import com.company.reporting.domain.OutputArtifact;
import com.company.reporting.domain.ReportExecution;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResponse {
    private String executionId;
    private Long reportId;
    private String status;
    private String triggerType;
    private String triggeredBy;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private Long rowsProcessed;
    private Map<String, Object> result;
    private List<OutputArtifact> outputArtifacts;
    private String errorMessage;

    public static ExecutionResponse from(ReportExecution execution) {
        return ExecutionResponse.builder()
                .executionId(execution.getExecutionId())
                .reportId(execution.getReportId())
                .status(execution.getStatus().name())
                .triggerType(execution.getTriggerType().toValue())
                .triggeredBy(execution.getTriggeredBy())
                .startedAt(execution.getStartedAt())
                .completedAt(execution.getCompletedAt())
                .durationMs(execution.getDurationMs())
                .rowsProcessed(execution.getRowsProcessed())
                .result(execution.getResultPayload())
                .outputArtifacts(execution.getOutputArtifacts())
                .errorMessage(execution.getErrorMessage())
                .build();
    }
}
