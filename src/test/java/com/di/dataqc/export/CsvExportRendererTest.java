package com.di.dataqc.export;

import com.di.dataqc.dataset.Dataset;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for CsvExportRenderer.
 */
@DisplayName("CsvExportRenderer Tests")
class CsvExportRendererTest {

    private final CsvExportRenderer renderer = new CsvExportRenderer(new ObjectMapper());

    private static Map<String, Object> row(Object... pairs) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            row.put((String) pairs[i], pairs[i + 1]);
        }
        return row;
    }

    @Test
    @DisplayName("Should write the summary section first")
    void testSummary() {
        ExportData data = ExportData.builder()
                .summary(List.of(row("Label", "Null Check", "Status", "PASS")))
                .failedRows(Map.of())
                .build();

        String csv = new String(renderer.render(data), StandardCharsets.UTF_8);
        assertTrue(csv.startsWith("QC Results Summary\n"));
        assertTrue(csv.contains("Label,Status\nNull Check,PASS\n"));
        assertFalse(csv.contains("Failed Rows Detail"));
    }

    @Test
    @DisplayName("Should write one table per failed-row label")
    void testFailedRows() {
        Map<String, List<Map<String, Object>>> failed = new LinkedHashMap<>();
        failed.put("Range Check", List.of(row("row_number", 2, "amount", -5)));
        ExportData data = ExportData.builder()
                .summary(List.of(row("Label", "Range Check", "Status", "FAIL")))
                .failedRows(failed)
                .aggregation(List.of(row("group", "ALL")))
                .build();

        String csv = new String(renderer.render(data), StandardCharsets.UTF_8);
        assertTrue(csv.contains("Failed Rows Detail"));
        assertTrue(csv.contains("\nRange Check\n------------------------------\nrow_number,amount\n2,-5\n"));
        assertTrue(csv.contains("Aggregation Comparison"));
        assertFalse(csv.contains("Dataset Comparison"));
    }

    @Test
    @DisplayName("Should union columns across rows")
    void testUnionColumns() {
        String table = renderer.table(List.of(row("a", 1), row("b", 2)));
        assertEquals("a,b\n1,\n,2\n", table);
    }

    @Test
    @DisplayName("Should write nested values as JSON text")
    void testNestedValues() {
        String table = renderer.table(List.of(row("key", "k1", "parts", List.of("x", "y"))));
        assertTrue(table.contains("\"[\"\"x\"\",\"\"y\"\"]\""));
    }

    @Test
    @DisplayName("Should quote only cells that need it")
    void testMinimalQuoting() {
        String table = renderer.table(List.of(row("Label", "Null Check", "Message", "3 nulls, 1 blank")));
        assertEquals("Label,Message\nNull Check,\"3 nulls, 1 blank\"\n", table);
    }

    @Test
    @DisplayName("Should render an empty table as nothing")
    void testEmptyTable() {
        assertEquals("", renderer.table(List.of()));
        assertEquals("", renderer.table(null));
    }

    @Test
    @DisplayName("Should write a whole dataset in column order")
    void testRenderDataset() {
        Dataset dataset = Dataset.builder()
                .column("id").column("name").column("amount")
                .row(1, "Smith, J", 10.5)
                .row(2, null, -3)
                .build();

        String csv = new String(renderer.renderDataset(dataset), StandardCharsets.UTF_8);
        assertEquals("id,name,amount\n1,\"Smith, J\",10.5\n2,,-3\n", csv);
    }

    @Test
    @DisplayName("Should write the header alone for a dataset without rows")
    void testRenderEmptyDataset() {
        Dataset dataset = Dataset.builder().column("id").column("name").build();

        assertEquals("id,name\n", new String(renderer.renderDataset(dataset), StandardCharsets.UTF_8));
        assertEquals(0, renderer.renderDataset(Dataset.empty()).length);
    }
}
