package com.di.dataqc.rule.checks;

import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.ColumnNotFoundException;
import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.rule.RuleConfig;
import com.di.dataqc.rule.RuleResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for RangeCheckRule.
 */
@DisplayName("RangeCheckRule Tests")
class RangeCheckRuleTest {

    private final RangeCheckRule rule = new RangeCheckRule();

    private final Dataset dataset = Dataset.builder()
            .column("score")
            .row(0)
            .row(5)
            .row(10)
            .row("abc")
            .row((Object) null)
            .build();

    private RuleResult run(Map<String, Object> config) {
        return rule.execute(dataset, RuleConfig.of(config));
    }

    @Test
    @DisplayName("Should include bounds by default")
    void testInclusive() {
        RuleResult result = run(Map.of("column", "score", "min_value", 0, "max_value", 10));

        assertTrue(result.isPassed());
        assertEquals(0, result.getStatistics().get("violation_count"));
        assertEquals(1L, result.getStatistics().get("non_numeric_count"));
        assertEquals("All values in 'score' are within range (min=0, max=10)", result.getMessage());
    }

    @Test
    @DisplayName("Should flag boundary values when exclusive")
    void testExclusive() {
        RuleResult result = run(Map.of("column", "score", "min_value", 0, "max_value", 10, "inclusive", false));

        assertFalse(result.isPassed());
        assertEquals(2, result.getStatistics().get("violation_count"));
        assertEquals(1L, result.getDetails().get("below_min"));
        assertEquals(1L, result.getDetails().get("above_max"));
        assertEquals(2L, result.getFailedRowCount());
    }

    @Test
    @DisplayName("Should check a single bound")
    void testSingleBound() {
        RuleResult result = run(Map.of("column", "score", "min_value", 3));
        assertEquals(1, result.getStatistics().get("violation_count"));
        assertEquals("1 values in 'score' are out of range (min=3)", result.getMessage());
    }

    @Test
    @DisplayName("Should summarize the numeric values")
    void testStatistics() {
        RuleResult result = run(Map.of("column", "score"));

        assertEquals(0.0, result.getStatistics().get("min"));
        assertEquals(10.0, result.getStatistics().get("max"));
        assertEquals(5.0, result.getStatistics().get("mean"));
        assertEquals(5.0, result.getStatistics().get("median"));
    }

    @Test
    @DisplayName("Should require the column option")
    void testMissingColumnOption() {
        RuleConfigurationException ex = assertThrows(RuleConfigurationException.class,
                () -> run(Map.of("min_value", 0)));
        assertEquals("Missing required config field: column", ex.getMessage());
    }

    @Test
    @DisplayName("Should reject non-numeric bounds")
    void testInvalidBound() {
        assertThrows(RuleConfigurationException.class, () -> run(Map.of("column", "score", "min_value", "low")));
    }

    @Test
    @DisplayName("Should fail on unknown column")
    void testUnknownColumn() {
        assertThrows(ColumnNotFoundException.class, () -> run(Map.of("column", "grade")));
    }
}
