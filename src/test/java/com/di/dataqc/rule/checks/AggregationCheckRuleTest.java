package com.di.dataqc.rule.checks;

import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.rule.RuleConfig;
import com.di.dataqc.rule.RuleResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for AggregationCheckRule.
 */
@DisplayName("AggregationCheckRule Tests")
class AggregationCheckRuleTest {

    private final AggregationCheckRule rule = new AggregationCheckRule();

    private final Dataset dataset = Dataset.builder()
            .column("region")
            .column("amount")
            .row("A", 10)
            .row("B", 20)
            .row("A", 30)
            .build();

    private RuleResult run(Map<String, Object> config) {
        return rule.execute(dataset, RuleConfig.of(config));
    }

    @Test
    @DisplayName("Should compute a single aggregate")
    void testSingle() {
        RuleResult result = run(Map.of("column", "amount", "aggregation", "sum"));

        assertTrue(result.isPassed());
        assertEquals("SUM(amount): 60", result.getMessage());
        assertEquals(60.0, result.getStatistics().get("aggregated_value"));
    }

    @Test
    @DisplayName("Should compare against the expected value")
    void testExpectedValue() {
        assertTrue(run(Map.of("column", "amount", "aggregation", "sum", "expected_value", 60)).isPassed());

        RuleResult result = run(Map.of("column", "amount", "aggregation", "sum", "expected_value", 66, "tolerance", 1));
        assertFalse(result.isPassed());
        assertTrue(result.getMessage().startsWith("SUM(amount): 60 (expected: 66"));
    }

    @Test
    @DisplayName("Should apply percentage tolerance relative to the expected value")
    void testPercentageTolerance() {
        assertTrue(run(Map.of("column", "amount", "aggregation", "sum", "expected_value", 66,
                "tolerance", 10, "tolerance_type", "percentage")).isPassed());
        assertFalse(run(Map.of("column", "amount", "aggregation", "sum", "expected_value", 66,
                "tolerance", 5, "tolerance_type", "percentage")).isPassed());
    }

    @Test
    @DisplayName("Should accept structured tolerance")
    void testStructuredTolerance() {
        RuleResult result = run(Map.of("column", "amount", "aggregation", "sum", "expected_value", 66,
                "tolerance", Map.of("value", 10, "type", "percentage")));
        assertTrue(result.isPassed());

        assertThrows(RuleConfigurationException.class, () -> run(Map.of("column", "amount", "aggregation", "sum",
                "tolerance", Map.of("value", 10), "tolerance_type", "percentage")));
    }

    @Test
    @DisplayName("Should compute grouped values")
    void testGroupBy() {
        RuleResult result = run(Map.of("column", "amount", "aggregation", "mean", "group_by", List.of("region")));

        assertEquals(Map.of("A", 20.0, "B", 20.0), result.getStatistics().get("grouped_values"));
        assertEquals(20.0, result.getStatistics().get("aggregated_value"));
    }

    @Test
    @DisplayName("Should compute several aggregates at once")
    void testMultiple() {
        RuleResult result = run(Map.of("aggregations", List.of(
                Map.of("column", "amount", "function", "min"),
                Map.of("column", "amount", "function", "max"))));

        assertTrue(result.isPassed());
        assertEquals("MIN(amount): 10; MAX(amount): 30", result.getMessage());
        assertEquals(2, ((List<?>) result.getStatistics().get("aggregations")).size());
    }

    @Test
    @DisplayName("Should reject invalid aggregation options")
    void testInvalidOptions() {
        assertThrows(RuleConfigurationException.class, () -> run(Map.of("column", "amount")));
        assertThrows(RuleConfigurationException.class, () -> run(Map.of("column", "amount", "aggregation", "median")));
        assertThrows(RuleConfigurationException.class, () -> run(Map.of(
                "aggregations", List.of(Map.of("column", "amount", "function", "min"),
                        Map.of("column", "amount", "function", "max")),
                "expected_value", 10)));
        assertThrows(RuleConfigurationException.class, () -> run(Map.of("column", "amount", "aggregation", "sum",
                "tolerance_type", "relative")));
    }
}
