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
 * Test cases for ValueSetCheckRule.
 */
@DisplayName("ValueSetCheckRule Tests")
class ValueSetCheckRuleTest {

    private final ValueSetCheckRule rule = new ValueSetCheckRule();

    private final Dataset dataset = Dataset.builder()
            .column("status")
            .row("active")
            .row("inactive")
            .row("ACTIVE")
            .row("unknown")
            .row("unknown")
            .row((Object) null)
            .build();

    private RuleResult run(Map<String, Object> config) {
        return rule.execute(dataset, RuleConfig.of(config));
    }

    @Test
    @DisplayName("Should flag values outside the set and nulls")
    void testCaseSensitive() {
        RuleResult result = run(Map.of("column", "status", "allowed_values", List.of("active", "inactive")));

        assertFalse(result.isPassed());
        assertEquals(4L, result.getStatistics().get("invalid_count"));
        assertEquals(3, result.getStatistics().get("unique_invalid_values"));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> frequency = (List<Map<String, Object>>) result.getDetails().get("invalid_value_frequency");
        assertEquals("unknown", frequency.get(0).get("value"));
        assertEquals(2L, frequency.get(0).get("count"));
    }

    @Test
    @DisplayName("Should fold case and allow nulls when configured")
    void testCaseInsensitiveAllowNull() {
        RuleResult result = run(Map.of("column", "status", "allowed_values", List.of("active", "inactive"),
                "case_sensitive", false, "allow_null", true));

        assertEquals(2L, result.getStatistics().get("invalid_count"));
        assertEquals(1L, result.getStatistics().get("null_count"));
        assertEquals(4, result.getFailedRows().get(0).get("row_number"));
    }

    @Test
    @DisplayName("Should count null and the text NULL as separate invalid values")
    void testNullVersusNullText() {
        Dataset codes = Dataset.builder().column("code").row((Object) null).row("NULL").row("NULL").build();
        RuleResult result = rule.execute(codes, RuleConfig.of(Map.of("column", "code", "allowed_values", List.of("A"))));

        assertEquals(3L, result.getStatistics().get("invalid_count"));
        assertEquals(2, result.getStatistics().get("unique_invalid_values"));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> frequency = (List<Map<String, Object>>) result.getDetails().get("invalid_value_frequency");
        assertEquals(2L, frequency.get(0).get("count"));
        assertEquals(1L, frequency.get(1).get("count"));
    }

    @Test
    @DisplayName("Should compare numbers by canonical text")
    void testNumbers() {
        Dataset codes = Dataset.builder().column("code").row(1).row(2.0).row("3").build();
        RuleResult result = rule.execute(codes, RuleConfig.of(Map.of("column", "code", "allowed_values", List.of("1", 2))));

        assertEquals(1L, result.getStatistics().get("invalid_count"));
        assertEquals("3", result.getFailedRows().get(0).get("code"));
    }

    @Test
    @DisplayName("Should reject an allowed set that is not a non-empty list")
    void testInvalidAllowedValues() {
        RuleConfigurationException notList = assertThrows(RuleConfigurationException.class,
                () -> run(Map.of("column", "status", "allowed_values", "active")));
        assertEquals("allowed_values must be a list", notList.getMessage());

        RuleConfigurationException empty = assertThrows(RuleConfigurationException.class,
                () -> run(Map.of("column", "status", "allowed_values", List.of())));
        assertEquals("allowed_values cannot be empty", empty.getMessage());
    }
}
