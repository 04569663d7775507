package com.company.reporting.output;

import com.company.reporting.domain.enums.OutputFormat;
import com.company.reporting.visualization.ChartPayload;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Placeholder document until a PDF layout engine is chosen.
 */
@Component
public class PdfArtifactRenderer implements ArtifactRenderer {

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.PDF;
    }

    @Override
    public byte[] render(List<Map<String, Object>> rows, Map<String, ChartPayload> visualizations) {
        String content = "PDF report placeholder\nRows: " + rows.size()
                + "\nVisualizations: " + (visualizations != null ? visualizations.size() : 0) + "\n";
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
