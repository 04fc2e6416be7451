package com.di.dataqc.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for InputValidator.
 */
@DisplayName("InputValidator Tests")
class InputValidatorTest {

    // ============================================================================
    // SQL
    // ============================================================================

    @Test
    @DisplayName("Should accept a SELECT and strip the trailing semicolon")
    void testValidSelect() {
        assertEquals("SELECT * FROM orders", InputValidator.validateSelectQuery("  SELECT * FROM orders; "));
    }

    @Test
    @DisplayName("Should accept common table expressions")
    void testWithQuery() {
        String query = "WITH recent AS (SELECT id FROM orders) SELECT * FROM recent";
        assertEquals(query, InputValidator.validateSelectQuery(query));
    }

    @Test
    @DisplayName("Should not flag column names that start with keywords")
    void testKeywordPrefixedColumns() {
        assertDoesNotThrow(() -> InputValidator.validateSelectQuery("SELECT updated_at, created_by FROM t"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    @DisplayName("Should reject empty queries")
    void testEmptyQuery(String query) {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateSelectQuery(query));
        assertEquals("Query cannot be empty", ex.getMessage());
    }

    @Test
    @DisplayName("Should reject multiple statements")
    void testMultipleStatements() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateSelectQuery("SELECT 1; DROP TABLE t"));
        assertEquals("Only a single statement is allowed", ex.getMessage());
    }

    @Test
    @DisplayName("Should name the modifying statement")
    void testDangerousStatement() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateSelectQuery("drop table t"));
        assertEquals("Dangerous operation detected: DROP", ex.getMessage());
    }

    @Test
    @DisplayName("Should reject statements that are not SELECT")
    void testNotSelect() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateSelectQuery("SHOW TABLES"));
        assertEquals("Only SELECT queries are allowed", ex.getMessage());
    }

    // ============================================================================
    // Connection parameters
    // ============================================================================

    @Test
    @DisplayName("Should validate connection parameters")
    void testConnectionParameters() {
        assertEquals("sales_db", InputValidator.validateDatabaseName(" sales_db "));
        assertEquals("db.example.com", InputValidator.validateHost("db.example.com"));
        assertEquals(5432, InputValidator.validatePort(5432));

        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateDatabaseName("1sales"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateDatabaseName("sales;drop"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateHost("db host"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validatePort(0));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validatePort(70000));
    }

    // ============================================================================
    // Files
    // ============================================================================

    @Test
    @DisplayName("Should replace path separators and unsafe characters")
    void testSanitizeFilename() {
        assertEquals(".._etc_passwd", InputValidator.sanitizeFilename("../etc/passwd"));
        assertEquals("a_b_.csv", InputValidator.sanitizeFilename("a<b>.csv"));
        assertEquals("", InputValidator.sanitizeFilename(null));
    }

    @Test
    @DisplayName("Should cap long names and keep the extension")
    void testSanitizeLongFilename() {
        String sanitized = InputValidator.sanitizeFilename("x".repeat(300) + ".csv");
        assertEquals(200, sanitized.length());
        assertTrue(sanitized.endsWith(".csv"));
    }

    @Test
    @DisplayName("Should resolve lower-case extensions")
    void testExtensionOf() {
        assertEquals("csv", InputValidator.extensionOf("Report.CSV"));
        assertEquals("", InputValidator.extensionOf("README"));
        assertEquals("", InputValidator.extensionOf("trailing."));
    }

    @Test
    @DisplayName("Should reject unsupported file types")
    void testValidateFileExtension() {
        assertEquals("csv", InputValidator.validateFileExtension("data.csv", List.of("csv", "txt")));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateFileExtension("data.xlsx", List.of("csv", "txt")));
        assertEquals("Unsupported file type: '.xlsx'. Allowed: [csv, txt]", ex.getMessage());
    }

    @Test
    @DisplayName("Should mask passwords for logging")
    void testSanitizeForLogging() {
        assertEquals("user=bob;password=***", InputValidator.sanitizeForLogging("user=bob;password=secret"));
        assertEquals("null", InputValidator.sanitizeForLogging(null));
    }
}
