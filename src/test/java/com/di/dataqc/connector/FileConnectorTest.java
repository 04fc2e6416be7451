package com.di.dataqc.connector;

import com.di.dataqc.config.QcProperties;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.ConnectorException;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for FileConnector and ExcelWorkbookReader.
 */
@DisplayName("FileConnector Tests")
class FileConnectorTest {

    private final FileConnector connector = new FileConnector(new QcProperties());

    private static ConnectorRequest file(String filename, String content) {
        return ConnectorRequest.builder()
                .type(FileConnector.TYPE)
                .filename(filename)
                .content(content.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    @Test
    @DisplayName("Should load rows with inferred cell types")
    void testLoad() {
        Dataset dataset = connector.load(file("sales.csv", "id,name,amount\n1,Alice,10.5\n2,Bob,\n"));

        assertEquals(List.of("id", "name", "amount"), dataset.columnNames());
        assertEquals(2, dataset.rowCount());
        assertTrue(dataset.cell(0, "id").isNumber());
        assertEquals("Alice", dataset.cell(0, "name").asText());
        assertEquals(10.5, dataset.cell(0, "amount").asDouble());
        assertTrue(dataset.cell(1, "amount").isNull());
    }

    @Test
    @DisplayName("Should pad short rows and reject long ones")
    void testRaggedRows() {
        Dataset dataset = connector.load(file("short.csv", "a,b\n1\n"));
        assertTrue(dataset.cell(0, "b").isNull());

        assertThrows(ConnectorException.class, () -> connector.load(file("long.csv", "a,b\n1,2,3\n")));
    }

    @Test
    @DisplayName("Should honour a tab delimiter")
    void testDelimiter() {
        ConnectorRequest request = ConnectorRequest.builder()
                .filename("data.txt")
                .content("a\tb\nx\ty\n".getBytes(StandardCharsets.UTF_8))
                .delimiter("tab")
                .build();
        Dataset dataset = connector.load(request);
        assertEquals(List.of("a", "b"), dataset.columnNames());
        assertEquals("y", dataset.cell(0, "b").asText());
    }

    @Test
    @DisplayName("Should reject disallowed extensions and empty files")
    void testRejections() {
        assertThrows(IllegalArgumentException.class, () -> connector.load(file("data.pdf", "a\n1\n")));
        assertThrows(ConnectorException.class, () -> connector.load(file("empty.csv", "")));
        assertEquals("file", connector.type());
    }

    @Test
    @DisplayName("Should name blank and repeated headers")
    void testHeaderNames() {
        assertEquals(List.of("id", "Unnamed: 1", "id.1", "id.2"),
                FileConnector.headerNames(new String[]{" id ", "", "id", "id"}));
    }

    @Test
    @DisplayName("Should drop a byte-order mark and fall back to ISO-8859-1")
    void testDecode() {
        byte[] bom = "\uFEFFid\n".getBytes(StandardCharsets.UTF_8);
        assertEquals("id\n", FileConnector.decode(bom));

        byte[] latin = {'c', 'a', 'f', (byte) 0xE9};
        assertEquals("caf\u00e9", FileConnector.decode(latin));
    }

    // ============================================================================
    // Excel workbooks
    // ============================================================================

    /** Header {@code id, name, amount, booked} and two data rows around a blank one. */
    private static byte[] workbook(Workbook workbook) throws IOException {
        try (workbook; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Sales");
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));

            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("id");
            header.createCell(1).setCellValue("name");
            header.createCell(2).setCellValue("amount");
            header.createCell(3).setCellValue("booked");

            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue(1);
            first.createCell(1).setCellValue("Alice");
            first.createCell(2).setCellValue(10.5);
            first.createCell(3).setCellValue(LocalDate.of(2024, 3, 1));
            first.getCell(3).setCellStyle(dateStyle);

            sheet.createRow(2);

            Row second = sheet.createRow(3);
            second.createCell(0).setCellValue(2);
            second.createCell(1).setCellValue(" ");
            second.createCell(2).setCellFormula("A4*10");

            workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();
            workbook.write(out);
            return out.toByteArray();
        }
    }

    private static ConnectorRequest upload(String filename, byte[] content) {
        return ConnectorRequest.builder().type(FileConnector.TYPE).filename(filename).content(content).build();
    }

    @Test
    @DisplayName("Should read the first sheet of an xlsx workbook with Excel cell types")
    void testXlsx() throws IOException {
        Dataset dataset = connector.load(upload("sales.xlsx", workbook(new XSSFWorkbook())));

        assertEquals(List.of("id", "name", "amount", "booked"), dataset.columnNames());
        assertEquals(2, dataset.rowCount());
        assertEquals(1L, dataset.cell(0, "id").toPlain());
        assertEquals("Alice", dataset.cell(0, "name").asText());
        assertEquals(10.5, dataset.cell(0, "amount").asDouble());
        assertTrue(dataset.cell(0, "booked").isDate());
        assertEquals("2024-03-01", dataset.cell(0, "booked").asText());
        assertTrue(dataset.cell(1, "name").isNull());
        assertEquals(20L, dataset.cell(1, "amount").toPlain());
        assertTrue(dataset.cell(1, "booked").isNull());
    }

    @Test
    @DisplayName("Should read a legacy xls workbook")
    void testXls() throws IOException {
        Dataset dataset = connector.load(upload("sales.xls", workbook(new HSSFWorkbook())));

        assertEquals(2, dataset.rowCount());
        assertEquals(2L, dataset.cell(1, "id").toPlain());
    }

    @Test
    @DisplayName("Should report a file that is not a workbook")
    void testCorruptWorkbook() {
        ConnectorException ex = assertThrows(ConnectorException.class,
                () -> connector.load(upload("broken.xlsx", "id,name\n1,a\n".getBytes(StandardCharsets.UTF_8))));
        assertTrue(ex.getMessage().startsWith("Failed to read broken.xlsx"));
    }
}
