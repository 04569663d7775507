package com.company.reporting.output;

import com.company.reporting.domain.enums.OutputFormat;
import com.company.reporting.visualization.ChartPayload;

import java.io.IOException;
import java.util.List;
import java.util.Map;

public interface ArtifactRenderer {

    OutputFormat getFormat();

    byte[] render(List<Map<String, Object>> rows, Map<String, ChartPayload> visualizations) throws IOException;
}
