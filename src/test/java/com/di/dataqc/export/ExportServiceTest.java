package com.di.dataqc.export;

import com.di.dataqc.config.QcProperties;
import com.di.dataqc.exception.ResourceNotFoundException;
import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.store.CaffeineResultStore;
import com.di.dataqc.store.ResultStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ExportService.
 */
@DisplayName("ExportService Tests")
class ExportServiceTest {

    private ResultStore resultStore;
    private ExportService exportService;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        resultStore = new CaffeineResultStore(new QcProperties());
        exportService = new ExportService(resultStore, new ExportShaper(),
                List.of(new JsonExportRenderer(objectMapper), new CsvExportRenderer(objectMapper),
                        new ExcelExportRenderer(objectMapper)));
    }

    @Test
    @DisplayName("Should render a stored result with a derived file name")
    void testExport() {
        String id = resultStore.save(ExportShaperTest.ruleBatch());

        ExportFile file = exportService.export(" CSV ", id, true);

        assertEquals("qc_results_" + id.substring(0, 8) + ".csv", file.filename());
        assertEquals("text/csv", file.contentType());
        String content = new String(file.content(), StandardCharsets.UTF_8);
        assertTrue(content.contains("Range Check"));
    }

    @Test
    @DisplayName("Should render an Excel workbook for the xlsx format")
    void testExcelExport() {
        String id = resultStore.save(ExportShaperTest.ruleBatch());

        ExportFile file = exportService.export("xlsx", id, true);

        assertEquals("qc_results_" + id.substring(0, 8) + ".xlsx", file.filename());
        assertEquals("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", file.contentType());
        assertEquals('P', (char) file.content()[0]);
        assertEquals('K', (char) file.content()[1]);
    }

    @Test
    @DisplayName("Should list formats in order")
    void testFormats() {
        assertEquals(List.of("csv", "json", "xlsx"), exportService.formats());
    }

    @Test
    @DisplayName("Should reject unknown formats and missing results")
    void testErrors() {
        RuleConfigurationException ex = assertThrows(RuleConfigurationException.class,
                () -> exportService.export("pdf", "abc", true));
        assertTrue(ex.getMessage().startsWith("Unsupported export format: pdf"));
        assertThrows(RuleConfigurationException.class, () -> exportService.export("json", " ", true));
        assertThrows(ResourceNotFoundException.class, () -> exportService.export("json", "missing", true));
    }

    @Test
    @DisplayName("Should refuse two renderers for one format")
    void testDuplicateFormat() {
        ObjectMapper objectMapper = new ObjectMapper();
        assertThrows(IllegalStateException.class, () -> new ExportService(resultStore, new ExportShaper(),
                List.of(new JsonExportRenderer(objectMapper), new JsonExportRenderer(objectMapper))));
    }
}
