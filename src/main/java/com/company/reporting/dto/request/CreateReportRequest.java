package com.company.reporting.dto.request;

import com.company.reporting.domain.DataSourceDescriptor;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateReportRequest {
    @NotBlank(message = "Report name is required")
    private String name;

    private String description;

    private String reportType;

    @NotEmpty(message = "At least one data source is required")
    private List<DataSourceDescriptor> dataSources;

    @NotNull(message = "Query configuration is required")
    private Map<String, Object> queryConfig;

    private Map<String, Object> visualizationConfig;

    private List<String> outputFormats;

    @PositiveOrZero
    private Integer autoRefreshIntervalMinutes;

    @PositiveOrZero
    private Integer cacheTtlMinutes;
}
