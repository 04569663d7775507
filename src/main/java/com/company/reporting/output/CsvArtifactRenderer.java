package com.company.reporting.output;

import com.company.reporting.domain.enums.OutputFormat;
import com.company.reporting.visualization.ChartPayload;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;
import org.springframework.stereotype.Component;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Header line with the union of row keys in first-seen order, then one line per row.
 * No rows still yields the (empty) header line.
 */
@Component
public class CsvArtifactRenderer implements ArtifactRenderer {

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.CSV;
    }

    @Override
    public byte[] render(List<Map<String, Object>> rows, Map<String, ChartPayload> visualizations) {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        if (columns.isEmpty()) {
            return "\n".getBytes(StandardCharsets.UTF_8);
        }

        StringWriter out = new StringWriter();
        CsvWriterSettings settings = new CsvWriterSettings();
        settings.getFormat().setLineSeparator("\n");
        CsvWriter csvWriter = new CsvWriter(out, settings);

        csvWriter.writeHeaders(columns);
        for (Map<String, Object> row : rows) {
            Object[] values = new Object[columns.size()];
            int i = 0;
            for (String column : columns) {
                values[i++] = row.get(column);
            }
            csvWriter.writeRow(values);
        }
        csvWriter.close();

        return out.toString().getBytes(StandardCharsets.UTF_8);
    }
}
