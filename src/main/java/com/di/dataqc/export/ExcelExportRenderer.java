package com.di.dataqc.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One workbook per result: a {@code Summary} sheet, one sheet per failed-row label, then
 * {@code Comparison} and {@code Aggregation} sheets when present. Each sheet has a title in the first row
 * and the table header in the second. Summary statuses are coloured green for {@code PASS} and red
 * for {@code FAIL}.
 */
@Component
public class ExcelExportRenderer implements ExportRenderer {

    static final String SUMMARY_SHEET = "Summary";
    static final String COMPARISON_SHEET = "Comparison";
    static final String AGGREGATION_SHEET = "Aggregation";

    private static final int MAX_SHEET_NAME = 31;

    private final ObjectMapper objectMapper;

    public ExcelExportRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String format() {
        return "xlsx";
    }

    @Override
    public String contentType() {
        return "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    }

    @Override
    public String fileExtension() {
        return "xlsx";
    }

    @Override
    public byte[] render(ExportData data) {
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Styles styles = new Styles(workbook);
            writeSheet(workbook, styles, SUMMARY_SHEET, "QC Results Summary", data.getSummary());
            data.getFailedRows().forEach((label, rows) ->
                    writeSheet(workbook, styles, sheetName(workbook, label), "Failed Rows: " + label, rows));
            if (data.getComparison() != null) {
                writeSheet(workbook, styles, sheetName(workbook, COMPARISON_SHEET), "Dataset Comparison", data.getComparison());
            }
            if (data.getAggregation() != null) {
                writeSheet(workbook, styles, sheetName(workbook, AGGREGATION_SHEET), "Aggregation Comparison", data.getAggregation());
            }
            workbook.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render Excel export", e);
        }
    }

    private void writeSheet(Workbook workbook, Styles styles, String name, String title, List<Map<String, Object>> rows) {
        Sheet sheet = workbook.createSheet(name);
        Cell titleCell = sheet.createRow(0).createCell(0);
        titleCell.setCellValue(title);
        titleCell.setCellStyle(styles.title);
        if (rows == null || rows.isEmpty()) {
            return;
        }

        List<String> columns = new ArrayList<>(ExportData.columnsOf(rows));
        Row header = sheet.createRow(1);
        for (int c = 0; c < columns.size(); c++) {
            Cell cell = header.createCell(c);
            cell.setCellValue(columns.get(c));
            cell.setCellStyle(styles.header);
        }
        for (int r = 0; r < rows.size(); r++) {
            Row row = sheet.createRow(r + 2);
            Map<String, Object> values = rows.get(r);
            for (int c = 0; c < columns.size(); c++) {
                Object value = values.get(columns.get(c));
                if (value == null) {
                    continue;
                }
                Cell cell = row.createCell(c);
                setValue(cell, value);
                if (ExportShaper.STATUS.equals(columns.get(c))) {
                    if ("PASS".equals(value)) {
                        cell.setCellStyle(styles.pass);
                    } else if ("FAIL".equals(value)) {
                        cell.setCellStyle(styles.fail);
                    }
                }
            }
        }
    }

    private void setValue(Cell cell, Object value) {
        if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else if (value instanceof Map || value instanceof Iterable) {
            try {
                cell.setCellValue(objectMapper.writeValueAsString(value));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Failed to serialize nested export value", e);
            }
        } else {
            cell.setCellValue(value.toString());
        }
    }

    /**
     * Excel sheet names are at most 31 characters and may not contain {@code / \ ? * [ ] :}; a name already
     * taken after truncation gets a numeric suffix.
     */
    static String sheetName(Workbook workbook, String label) {
        String base = WorkbookUtil.createSafeSheetName(label, '-');
        String name = base;
        int n = 2;
        while (workbook.getSheet(name) != null) {
            String suffix = " (" + n++ + ")";
            name = base.substring(0, Math.min(base.length(), MAX_SHEET_NAME - suffix.length())) + suffix;
        }
        return name;
    }

    private static final class Styles {
        private final CellStyle title;
        private final CellStyle header;
        private final CellStyle pass;
        private final CellStyle fail;

        private Styles(Workbook workbook) {
            Font titleFont = workbook.createFont();
            titleFont.setBold(true);
            titleFont.setFontHeightInPoints((short) 14);
            title = workbook.createCellStyle();
            title.setFont(titleFont);

            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            headerFont.setColor(IndexedColors.WHITE.getIndex());
            header = filled(workbook, IndexedColors.ROYAL_BLUE);
            header.setFont(headerFont);

            Font passFont = workbook.createFont();
            passFont.setColor(IndexedColors.GREEN.getIndex());
            pass = filled(workbook, IndexedColors.LIGHT_GREEN);
            pass.setFont(passFont);

            Font failFont = workbook.createFont();
            failFont.setColor(IndexedColors.DARK_RED.getIndex());
            fail = filled(workbook, IndexedColors.ROSE);
            fail.setFont(failFont);
        }

        private static CellStyle filled(Workbook workbook, IndexedColors color) {
            CellStyle style = workbook.createCellStyle();
            style.setFillForegroundColor(color.getIndex());
            style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            return style;
        }
    }
}
