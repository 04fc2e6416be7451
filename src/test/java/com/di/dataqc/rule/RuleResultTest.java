package com.di.dataqc.rule;

import com.di.dataqc.dataset.Dataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for RuleResult and its builder helpers.
 */
@DisplayName("RuleResult Tests")
class RuleResultTest {

    @Test
    @DisplayName("Should copy failed rows from the dataset and cap them")
    void testFailedRowsOf() {
        Dataset.Builder builder = Dataset.builder().column("id");
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            builder.row(i);
            indices.add(i);
        }

        RuleResult result = RuleResult.builder()
                .ruleName("Null Check")
                .failedRowsOf(builder.build(), indices)
                .build();

        assertEquals(RuleResult.MAX_FAILED_ROWS, result.getFailedRows().size());
        assertEquals(150, result.getFailedRowCount());
        assertEquals(0L, result.getFailedRows().get(0).get("id"));
        assertTrue(result.hasFailedRows());
    }

    @Test
    @DisplayName("Should keep the generated failedRows setter and toBuilder")
    void testGeneratedBuilder() {
        List<Map<String, Object>> rows = List.of(Map.of("id", 7));
        RuleResult result = RuleResult.builder()
                .ruleName("Range Check")
                .failedRows(rows)
                .failedRowCount(1)
                .build();

        RuleResult copy = result.toBuilder().passed(true).build();

        assertEquals(rows, copy.getFailedRows());
        assertEquals(1, copy.getFailedRowCount());
        assertTrue(copy.isPassed());
        assertEquals(1L, copy.toMap().get("failed_row_count"));
    }

    @Test
    @DisplayName("Should omit failed rows from the map when none failed")
    void testToMapWithoutFailures() {
        Map<String, Object> map = RuleResult.builder().ruleName("Count Check").passed(true).build().toMap();

        assertFalse(map.containsKey("failed_rows"));
        assertEquals(Map.of(), map.get("details"));
        assertTrue(RuleResult.error("Null Check", "boom").getFailedRows().isEmpty());
    }
}
