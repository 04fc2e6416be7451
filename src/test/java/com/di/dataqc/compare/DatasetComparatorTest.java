package com.di.dataqc.compare;

import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.ColumnNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for DatasetComparator.
 */
@DisplayName("DatasetComparator Tests")
class DatasetComparatorTest {

    private final DatasetComparator comparator = new DatasetComparator();

    private static Dataset amounts(double... values) {
        Dataset.Builder builder = Dataset.builder().column("amount");
        for (double v : values) {
            builder.row(v);
        }
        return builder.build();
    }

    // ============================================================================
    // Positional
    // ============================================================================

    @Test
    @DisplayName("Should report identical datasets")
    void testIdentical() {
        ComparisonResult result = comparator.compare(amounts(1.5, 2.5), amounts(1.5, 2.5), ComparisonOptions.defaults());

        assertTrue(result.isMatch());
        assertEquals("Datasets are identical", result.getMessage());
        assertEquals("positional", result.getRowDifferences().get("comparison_method"));
        assertEquals(0L, result.totalDifferences());
    }

    @Test
    @DisplayName("Should compare numbers within tolerance inclusively")
    void testTolerance() {
        ComparisonOptions options = ComparisonOptions.builder().tolerance(0.5).build();

        assertTrue(comparator.compare(amounts(10.0), amounts(10.5), options).isMatch());
        ComparisonResult outside = comparator.compare(amounts(10.0), amounts(10.5000001), options);
        assertFalse(outside.isMatch());
        assertEquals(1L, outside.totalDifferences());
    }

    @Test
    @DisplayName("Should describe differences and row count mismatch")
    void testRowCountMismatch() {
        ComparisonResult result = comparator.compare(amounts(1.5, 2.5, 3.5), amounts(1.5, 9.5), ComparisonOptions.defaults());

        assertFalse(result.isMatch());
        assertEquals("Differences found: row count mismatch (3 vs 2), 1 value differences", result.getMessage());
        assertEquals(2, result.getSummary().get("rows_compared"));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> differences = (List<Map<String, Object>>) result.getRowDifferences().get("differences");
        assertEquals(1, differences.get(0).get("row_index"));
        assertEquals("2.5", differences.get(0).get("source_value"));
        assertEquals("9.5", differences.get(0).get("target_value"));
    }

    @Test
    @DisplayName("Should cap recorded differences per column but count them all")
    void testDifferenceCap() {
        double[] left = new double[150];
        double[] right = new double[150];
        for (int i = 0; i < 150; i++) {
            left[i] = i + 0.5;
            right[i] = i + 1000.5;
        }
        ComparisonResult result = comparator.compare(amounts(left), amounts(right), ComparisonOptions.defaults());

        assertEquals(150L, result.totalDifferences());
        assertEquals(DatasetComparator.MAX_DIFFERENCES_PER_COLUMN,
                ((List<?>) result.getRowDifferences().get("differences")).size());
    }

    @Test
    @DisplayName("Should normalize text when ignoring case and whitespace")
    void testTextNormalization() {
        Dataset left = Dataset.builder().column("name").row("Alice ").build();
        Dataset right = Dataset.builder().column("name").row("alice").build();

        assertFalse(comparator.compare(left, right, ComparisonOptions.defaults()).isMatch());
        assertTrue(comparator.compare(left, right,
                ComparisonOptions.builder().ignoreCase(true).ignoreWhitespace(true).build()).isMatch());
    }

    // ============================================================================
    // Schema
    // ============================================================================

    @Test
    @DisplayName("Should compare common columns when schemas differ")
    void testSchemaDifference() {
        Dataset left = Dataset.builder().column("id").column("a").row(1, "x").build();
        Dataset right = Dataset.builder().column("id").column("b").row(1, "y").build();
        ComparisonResult result = comparator.compare(left, right, ComparisonOptions.defaults());

        assertFalse(result.isMatch());
        assertEquals("Differences found: schema differences", result.getMessage());
        assertEquals(List.of("a"), result.getColumnDifferences().get("only_in_source"));
        assertEquals(List.of("b"), result.getColumnDifferences().get("only_in_target"));
    }

    @Test
    @DisplayName("Should stop when there are no common columns")
    void testNoCommonColumns() {
        Dataset left = Dataset.builder().column("a").row(1).build();
        Dataset right = Dataset.builder().column("b").row(1).build();
        ComparisonResult result = comparator.compare(left, right, ComparisonOptions.defaults());

        assertFalse(result.isMatch());
        assertEquals("No common columns between datasets", result.getMessage());
    }

    @Test
    @DisplayName("Should report type mismatches")
    void testTypeMismatch() {
        Dataset left = Dataset.builder().column("v").row(1).build();
        Dataset right = Dataset.builder().column("v").row("1").build();
        ComparisonResult result = comparator.compare(left, right, ComparisonOptions.defaults());

        @SuppressWarnings("unchecked")
        Map<String, Object> mismatches = (Map<String, Object>) result.getColumnDifferences().get("type_mismatches");
        assertTrue(mismatches.containsKey("v"));
        assertFalse(result.isMatch());
    }

    // ============================================================================
    // Key based
    // ============================================================================

    @Test
    @DisplayName("Should join on keys and classify rows")
    void testKeyBased() {
        Dataset source = Dataset.builder().column("id").column("val")
                .row(1, "a").row(2, "b").row(3, "c").build();
        Dataset target = Dataset.builder().column("id").column("val")
                .row(2, "b").row(3, "x").row(4, "d").build();
        ComparisonResult result = comparator.compare(source, target,
                ComparisonOptions.builder().keyColumns(List.of("id")).build());

        Map<String, Object> rows = result.getRowDifferences();
        assertEquals("key_based", rows.get("comparison_method"));
        assertEquals(1L, rows.get("only_in_source"));
        assertEquals(1L, rows.get("only_in_target"));
        assertEquals(2L, rows.get("matching_rows"));
        assertEquals(3L, result.totalDifferences());

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> differences = (List<Map<String, Object>>) rows.get("value_differences");
        assertEquals(Map.of("id", "3"), differences.get(0).get("keys"));
        assertEquals("c", differences.get(0).get("source_value"));
        assertEquals("x", differences.get(0).get("target_value"));
    }

    @Test
    @DisplayName("Should fail when a key column is missing")
    void testMissingKey() {
        Dataset source = Dataset.builder().column("id").row(1).build();
        Dataset target = Dataset.builder().column("code").row(1).build();

        ColumnNotFoundException ex = assertThrows(ColumnNotFoundException.class, () -> comparator.compare(source,
                target, ComparisonOptions.builder().keyColumns(List.of("id")).compareColumns(List.of("id")).build()));
        assertEquals(List.of("id"), ex.getMissingColumns());
    }
}
