package com.di.dataqc.connector;

import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.ConnectorException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the first sheet of an Excel workbook ({@code .xlsx} or legacy {@code .xls}). The first row is the
 * header; rows with no value in any column are skipped.
 * <p>
 * Cells keep the type Excel stored: numbers, booleans, text, and date-formatted numbers as dates (or
 * date-times when a time part is present). Formula cells take their cached result.
 */
@Slf4j
final class ExcelWorkbookReader {

    private final DataFormatter formatter = new DataFormatter();

    Dataset read(String filename, byte[] content) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new ConnectorException(FileConnector.TYPE, "Workbook has no sheets: " + filename);
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (sheet.getPhysicalNumberOfRows() == 0 || headerRow == null) {
                throw new ConnectorException(FileConnector.TYPE, "File is empty: " + filename);
            }
            List<String> header = FileConnector.headerNames(headerCells(headerRow));

            Dataset.Builder builder = Dataset.builder();
            header.forEach(builder::column);
            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                if (row.getLastCellNum() > header.size() && hasValueBeyond(row, header.size())) {
                    throw new ConnectorException(FileConnector.TYPE, String.format(
                            "Error reading %s: row %d has values beyond the %d header columns", filename, r + 1, header.size()));
                }
                List<CellValue> cells = new ArrayList<>(header.size());
                boolean blank = true;
                for (int c = 0; c < header.size(); c++) {
                    CellValue value = toCell(row.getCell(c));
                    blank &= value.isNull();
                    cells.add(value);
                }
                if (!blank) {
                    builder.cells(cells);
                }
            }
            log.debug("[CONNECTOR] Read sheet '{}' of {}", sheet.getSheetName(), filename);
            return builder.build();
        } catch (ConnectorException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ConnectorException(FileConnector.TYPE, "Failed to read " + filename + ": " + e.getMessage(), e);
        }
    }

    private String[] headerCells(Row row) {
        int width = Math.max(row.getLastCellNum(), 0);
        String[] names = new String[width];
        for (int c = 0; c < width; c++) {
            Cell cell = row.getCell(c);
            names[c] = cell == null ? null : formatter.formatCellValue(cell);
        }
        return names;
    }

    private static boolean hasValueBeyond(Row row, int width) {
        for (int c = width; c < row.getLastCellNum(); c++) {
            if (!toCell(row.getCell(c)).isNull()) {
                return true;
            }
        }
        return false;
    }

    static CellValue toCell(Cell cell) {
        if (cell == null) {
            return CellValue.nullValue();
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    LocalDateTime value = cell.getLocalDateTimeCellValue();
                    return value.toLocalTime().equals(LocalTime.MIDNIGHT)
                            ? CellValue.date(value.toLocalDate())
                            : CellValue.dateTime(value);
                }
                return number(cell.getNumericCellValue());
            case STRING:
                String text = cell.getStringCellValue();
                return text == null || text.isBlank() ? CellValue.nullValue() : CellValue.text(text);
            case BOOLEAN:
                return CellValue.bool(cell.getBooleanCellValue());
            default:
                return CellValue.nullValue();
        }
    }

    /** Excel stores every number as a double; whole values come back as integers. */
    private static CellValue number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return CellValue.number((long) value);
        }
        return CellValue.number(value);
    }
}
