package com.di.dataqc.rule.checks;

import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.rule.RuleConfig;
import com.di.dataqc.rule.RuleResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for CountCheckRule.
 */
@DisplayName("CountCheckRule Tests")
class CountCheckRuleTest {

    private final CountCheckRule rule = new CountCheckRule();

    private final Dataset dataset = Dataset.builder()
            .column("id")
            .row(1)
            .row(2)
            .row(3)
            .build();

    private RuleResult run(Map<String, Object> config) {
        return rule.execute(dataset, RuleConfig.of(config));
    }

    @Test
    @DisplayName("Should compare exactly by default")
    void testExact() {
        RuleResult pass = run(Map.of("expected_count", 3));
        assertTrue(pass.isPassed());
        assertEquals("Row count: 3 (expected: 3)", pass.getMessage());

        RuleResult fail = run(Map.of("expected_count", 5));
        assertFalse(fail.isPassed());
        assertEquals(-2L, fail.getDetails().get("difference"));
        assertEquals(3L, fail.getDetails().get("actual_count"));
    }

    @Test
    @DisplayName("Should check minimum and maximum counts")
    void testMinMax() {
        assertTrue(run(Map.of("comparison", "min", "min_count", 3)).isPassed());
        assertFalse(run(Map.of("comparison", "min", "min_count", 4)).isPassed());
        assertTrue(run(Map.of("comparison", "max", "max_count", 3)).isPassed());
        assertFalse(run(Map.of("comparison", "max", "max_count", 2)).isPassed());
    }

    @Test
    @DisplayName("Should check an inclusive range")
    void testRange() {
        RuleResult result = run(Map.of("comparison", "range", "min_count", 1, "max_count", 3));
        assertTrue(result.isPassed());
        assertEquals("Row count: 3 (range: 1-3)", result.getMessage());
        assertFalse(run(Map.of("comparison", "range", "min_count", 4, "max_count", 9)).isPassed());
    }

    @Test
    @DisplayName("Should accept counts given as text")
    void testTextCount() {
        assertTrue(run(Map.of("expected_count", "3")).isPassed());
    }

    @Test
    @DisplayName("Should require the option for the selected mode")
    void testMissingOptions() {
        RuleConfigurationException exact = assertThrows(RuleConfigurationException.class, () -> run(Map.of()));
        assertEquals("expected_count is required for exact comparison", exact.getMessage());

        RuleConfigurationException range = assertThrows(RuleConfigurationException.class,
                () -> run(Map.of("comparison", "range", "min_count", 1)));
        assertEquals("min_count and max_count are required for range comparison", range.getMessage());
    }

    @Test
    @DisplayName("Should reject unknown modes and fractional counts")
    void testInvalidOptions() {
        assertThrows(RuleConfigurationException.class, () -> run(Map.of("comparison", "between")));
        assertThrows(RuleConfigurationException.class, () -> run(Map.of("expected_count", 2.5)));
    }
}
