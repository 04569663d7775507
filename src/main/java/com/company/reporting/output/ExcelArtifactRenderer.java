package com.company.reporting.output;

import com.company.reporting.domain.enums.OutputFormat;
import com.company.reporting.visualization.ChartPayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes a "Data" sheet and, when charts were built, a "Visualizations" sheet.
 */
@Component
@RequiredArgsConstructor
public class ExcelArtifactRenderer implements ArtifactRenderer {

    static final String DATA_SHEET = "Data";
    static final String VISUALIZATIONS_SHEET = "Visualizations";

    private final ObjectMapper objectMapper;

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.EXCEL;
    }

    @Override
    public byte[] render(List<Map<String, Object>> rows, Map<String, ChartPayload> visualizations) throws IOException {
        try (Workbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            writeData(workbook.createSheet(DATA_SHEET), rows);

            if (visualizations != null && !visualizations.isEmpty()) {
                writeVisualizations(workbook.createSheet(VISUALIZATIONS_SHEET), visualizations);
            }

            workbook.write(out);
            return out.toByteArray();
        }
    }

    private void writeData(Sheet sheet, List<Map<String, Object>> rows) {
        Set<String> columnSet = new LinkedHashSet<>();
        rows.forEach(row -> columnSet.addAll(row.keySet()));
        List<String> columns = new ArrayList<>(columnSet);
        if (columns.isEmpty()) {
            return;
        }

        Row header = sheet.createRow(0);
        for (int c = 0; c < columns.size(); c++) {
            header.createCell(c).setCellValue(columns.get(c));
        }

        int rowIndex = 1;
        for (Map<String, Object> record : rows) {
            Row row = sheet.createRow(rowIndex++);
            for (int c = 0; c < columns.size(); c++) {
                setCell(row.createCell(c), record.get(columns.get(c)));
            }
        }
    }

    private void writeVisualizations(Sheet sheet, Map<String, ChartPayload> visualizations) throws IOException {
        Row header = sheet.createRow(0);
        header.createCell(0).setCellValue("name");
        header.createCell(1).setCellValue("type");
        header.createCell(2).setCellValue("config");

        int rowIndex = 1;
        for (Map.Entry<String, ChartPayload> entry : visualizations.entrySet()) {
            Row row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(entry.getKey());
            row.createCell(1).setCellValue(entry.getValue().getType());
            row.createCell(2).setCellValue(objectMapper.writeValueAsString(entry.getValue().getConfig()));
        }
    }

    private void setCell(Cell cell, Object value) {
        if (value == null) {
            cell.setBlank();
        } else if (value instanceof Number number) {
            cell.setCellValue(number.doubleValue());
        } else if (value instanceof Boolean bool) {
            cell.setCellValue(bool);
        } else {
            cell.setCellValue(String.valueOf(value));
        }
    }
}
