package com.company.reporting.output;

import com.company.reporting.domain.enums.OutputFormat;
import com.company.reporting.visualization.ChartPayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class JsonArtifactRenderer implements ArtifactRenderer {

    private final ObjectMapper objectMapper;

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.JSON;
    }

    @Override
    public byte[] render(List<Map<String, Object>> rows, Map<String, ChartPayload> visualizations) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(rows);
    }
}
