package com.company.reporting.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request to run a report. Every field is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerExecutionRequest {
    private Map<String, Object> parameters;
    private Map<String, Object> filters;

    // Falls back to the report's configured formats when empty
    private List<String> outputFormats;

    private String triggeredBy;
}
