package com.company.reporting.output;

import com.company.reporting.domain.OutputArtifact;
import com.company.reporting.visualization.ChartPayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Renders against real storage in a temp directory.
 */
class OutputRendererTest {

    @TempDir
    Path outputDir;

    private OutputRenderer renderer;

    private final List<Map<String, Object>> rows = List.of(
            row("region", "west", "sales", 10),
            row("region", "east", "sales", 5),
            row("region", "north", "sales", 7));

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        renderer = new OutputRenderer(
                List.of(new CsvArtifactRenderer(), new JsonArtifactRenderer(objectMapper),
                        new ExcelArtifactRenderer(objectMapper), new PdfArtifactRenderer()),
                new LocalArtifactStorage(outputDir.toString()));
    }

    @Test
    void render_csv_headerPlusOneLinePerRow() throws Exception {
        OutputArtifact artifact = renderer.render(rows, Map.of(), "csv", "42").orElseThrow();

        assertThat(artifact.getFilename()).isEqualTo("report_42.csv");
        assertThat(artifact.getFormat()).isEqualTo("csv");
        List<String> lines = Files.readAllLines(Path.of(artifact.getPath()));
        assertThat(lines).hasSize(4);
        assertThat(lines.get(0)).isEqualTo("region,sales");
        assertThat(lines.get(1)).isEqualTo("west,10");
    }

    @Test
    void render_csvWithoutRows_stillWritesHeaderLine() throws Exception {
        OutputArtifact artifact = renderer.render(List.of(), Map.of(), "csv", "0").orElseThrow();

        assertThat(Files.readAllLines(Path.of(artifact.getPath()))).hasSize(1);
        assertThat(artifact.getSizeBytes()).isEqualTo(1L);
    }

    @Test
    void render_json_writesRowsArray() throws Exception {
        OutputArtifact artifact = renderer.render(rows, Map.of(), "JSON", "7").orElseThrow();

        String content = Files.readString(Path.of(artifact.getPath()), StandardCharsets.UTF_8);
        List<?> parsed = new ObjectMapper().readValue(content, List.class);
        assertThat(parsed).hasSize(3);
        assertThat(artifact.getSizeBytes()).isEqualTo(content.getBytes(StandardCharsets.UTF_8).length);
    }

    @Test
    void render_excelWithCharts_hasDataAndVisualizationsSheets() throws Exception {
        Map<String, ChartPayload> charts = Map.of("chart_0", ChartPayload.builder()
                .type("bar_chart").data(rows).config(Map.of("x_field", "region")).build());

        OutputArtifact artifact = renderer.render(rows, charts, "excel", "9").orElseThrow();

        assertThat(artifact.getFilename()).isEqualTo("report_9.xlsx");
        try (InputStream in = Files.newInputStream(Path.of(artifact.getPath()));
             Workbook workbook = new XSSFWorkbook(in)) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(2);
            assertThat(workbook.getSheet(ExcelArtifactRenderer.DATA_SHEET).getLastRowNum()).isEqualTo(3);
            assertThat(workbook.getSheet(ExcelArtifactRenderer.VISUALIZATIONS_SHEET)
                    .getRow(1).getCell(1).getStringCellValue()).isEqualTo("bar_chart");
        }
    }

    @Test
    void render_excelWithoutCharts_dataSheetOnly() throws Exception {
        OutputArtifact artifact = renderer.render(rows, Map.of(), "excel", "10").orElseThrow();

        try (InputStream in = Files.newInputStream(Path.of(artifact.getPath()));
             Workbook workbook = new XSSFWorkbook(in)) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(1);
            assertThat(workbook.getSheetName(0)).isEqualTo("Data");
        }
    }

    @Test
    void render_pdf_placeholder() throws Exception {
        OutputArtifact artifact = renderer.render(rows, Map.of(), "pdf", "11").orElseThrow();

        assertThat(Files.readString(Path.of(artifact.getPath()))).contains("Rows: 3");
    }

    @Test
    void render_unsupportedFormat_skipped() throws Exception {
        Optional<OutputArtifact> artifact = renderer.render(rows, Map.of(), "docx", "12");

        assertThat(artifact).isEmpty();
        try (Stream<Path> files = Files.list(outputDir)) {
            assertThat(files).isEmpty();
        }
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
