package com.company.reporting.output;

import com.company.reporting.domain.OutputArtifact;
import com.company.reporting.domain.enums.OutputFormat;
import com.company.reporting.exception.ExecutionFailureException;
import com.company.reporting.visualization.ChartPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renders result rows into a downloadable artifact per requested format.
 */
@Component
@Slf4j
public class OutputRenderer {

    private final Map<OutputFormat, ArtifactRenderer> renderers = new EnumMap<>(OutputFormat.class);
    private final ArtifactStorage storage;

    public OutputRenderer(List<ArtifactRenderer> renderers, ArtifactStorage storage) {
        renderers.forEach(renderer -> this.renderers.put(renderer.getFormat(), renderer));
        this.storage = storage;
    }

    /**
     * Returns empty for formats with no renderer; callers skip those silently.
     */
    public Optional<OutputArtifact> render(List<Map<String, Object>> rows,
                                           Map<String, ChartPayload> visualizations,
                                           String format,
                                           String executionId) {
        OutputFormat resolved = OutputFormat.fromString(format);
        if (resolved == OutputFormat.UNSUPPORTED || !renderers.containsKey(resolved)) {
            log.debug("Skipping unsupported output format '{}'", format);
            return Optional.empty();
        }

        String filename = "report_" + executionId + "." + resolved.getExtension();
        try {
            byte[] content = renderers.get(resolved).render(rows, visualizations);
            return Optional.of(storage.store(filename, resolved, content));
        } catch (IOException e) {
            throw new ExecutionFailureException("render " + resolved.getValue(), e);
        }
    }
}
