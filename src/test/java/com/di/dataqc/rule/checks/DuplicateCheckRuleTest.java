package com.di.dataqc.rule.checks;

import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.rule.RuleConfig;
import com.di.dataqc.rule.RuleResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for DuplicateCheckRule.
 */
@DisplayName("DuplicateCheckRule Tests")
class DuplicateCheckRuleTest {

    private final DuplicateCheckRule rule = new DuplicateCheckRule();

    private final Dataset dataset = Dataset.builder()
            .column("id")
            .column("name")
            .column("seq")
            .row(1, "a", 1)
            .row(1, "a", 2)
            .row(2, "b", 3)
            .row(1, "a", 4)
            .build();

    private RuleResult run(Map<String, Object> config) {
        return rule.execute(dataset, RuleConfig.of(config));
    }

    private static List<Object> failedSeq(RuleResult result) {
        return result.getFailedRows().stream().map(r -> r.get("seq")).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should pass when all columns together are unique")
    void testNoDuplicates() {
        RuleResult result = run(Map.of());
        assertTrue(result.isPassed());
        assertEquals("No duplicates found in 4 rows", result.getMessage());
    }

    @Test
    @DisplayName("Should mark every occurrence after the first with keep=first")
    void testKeepFirst() {
        RuleResult result = run(Map.of("columns", List.of("id", "name")));

        assertFalse(result.isPassed());
        assertEquals(2, result.getStatistics().get("duplicate_rows"));
        assertEquals(2, result.getStatistics().get("unique_rows"));
        assertEquals(50.0, result.getStatistics().get("duplicate_percentage"));
        assertEquals(List.of(2L, 4L), failedSeq(result));
        assertEquals("Found 2 duplicate rows (50%)", result.getMessage());
    }

    @Test
    @DisplayName("Should mark every occurrence before the last with keep=last")
    void testKeepLast() {
        RuleResult result = run(Map.of("columns", List.of("id"), "keep", "last"));
        assertEquals(List.of(1L, 2L), failedSeq(result));
    }

    @Test
    @DisplayName("Should mark all rows of a duplicated group with keep=none")
    void testKeepNone() {
        RuleResult result = run(Map.of("columns", List.of("id"), "keep", "none"));

        assertEquals(3, result.getStatistics().get("duplicate_rows"));
        assertEquals(List.of(1L, 2L, 4L), failedSeq(result));
        assertEquals(Map.of(3, 1L), result.getDetails().get("group_sizes"));
        assertEquals(1, result.getDetails().get("duplicate_groups"));
    }

    @Test
    @DisplayName("Should treat nulls as equal to each other")
    void testNullsEqual() {
        Dataset withNulls = Dataset.builder()
                .column("code")
                .row((Object) null)
                .row((Object) null)
                .row("x")
                .build();
        RuleResult result = rule.execute(withNulls, RuleConfig.empty());
        assertEquals(1, result.getStatistics().get("duplicate_rows"));
    }

    @Test
    @DisplayName("Should reject an unknown keep strategy")
    void testInvalidKeep() {
        RuleConfigurationException ex = assertThrows(RuleConfigurationException.class,
                () -> run(Map.of("keep", "middle")));
        assertTrue(ex.getMessage().startsWith("Invalid value for 'keep'"));
    }
}
