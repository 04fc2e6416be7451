package com.di.dataqc.dataset;

import com.di.dataqc.exception.RuleConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for AggregateFunction and AggregationSpec normalization.
 */
@DisplayName("AggregateFunction Tests")
class AggregateFunctionTest {

    private static List<CellValue> cells(Object... raw) {
        return Arrays.stream(raw).map(CellValue::of).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should compute numeric aggregates ignoring nulls")
    void testNumericAggregates() {
        List<CellValue> values = cells(10, 20, null, 30);
        assertEquals(60.0, AggregateFunction.SUM.apply(values));
        assertEquals(20.0, AggregateFunction.AVG.apply(values));
        assertEquals(10.0, AggregateFunction.MIN.apply(values));
        assertEquals(30.0, AggregateFunction.MAX.apply(values));
        assertEquals(100.0, AggregateFunction.VAR.apply(values));
        assertEquals(10.0, AggregateFunction.STD.apply(values));
    }

    @Test
    @DisplayName("Should count non-null and distinct values of any kind")
    void testCounts() {
        List<CellValue> values = cells("a", "b", "a", null);
        assertEquals(3.0, AggregateFunction.COUNT.apply(values));
        assertEquals(2.0, AggregateFunction.COUNT_DISTINCT.apply(values));
    }

    @Test
    @DisplayName("Should coerce numeric text")
    void testNumericText() {
        assertEquals(3.5, AggregateFunction.SUM.apply(cells("1.5", 2, "x")));
    }

    @Test
    @DisplayName("Should return null for undefined aggregates")
    void testUndefined() {
        assertNull(AggregateFunction.AVG.apply(List.of()));
        assertNull(AggregateFunction.MAX.apply(cells("x")));
        assertNull(AggregateFunction.STD.apply(cells(5)));
        assertEquals(0.0, AggregateFunction.SUM.apply(List.of()));
    }

    @Test
    @DisplayName("Should resolve keywords including mean")
    void testFromId() {
        assertEquals(AggregateFunction.AVG, AggregateFunction.fromId("mean").orElseThrow());
        assertEquals(AggregateFunction.COUNT_DISTINCT, AggregateFunction.fromId(" COUNT_DISTINCT ").orElseThrow());
        assertTrue(AggregateFunction.fromId("median").isEmpty());
        assertTrue(AggregateFunction.fromId(null).isEmpty());
    }

    // ============================================================================
    // AggregationSpec
    // ============================================================================

    @Test
    @DisplayName("Should accept a legacy column and function pair")
    void testNormalizeLegacy() {
        List<AggregationSpec> specs = AggregationSpec.normalize(null, "amount", "sum");
        assertEquals(List.of(new AggregationSpec("amount", AggregateFunction.SUM)), specs);
        assertEquals("SUM(amount)", specs.get(0).label());
    }

    @Test
    @DisplayName("Should accept a list of column and function objects")
    void testNormalizeList() {
        List<AggregationSpec> specs = AggregationSpec.normalize(List.of(
                Map.of("column", "amount", "function", "avg"),
                Map.of("column", "qty", "aggregation", "max")), null, null);
        assertEquals(2, specs.size());
        assertEquals(AggregateFunction.MAX, specs.get(1).function());
    }

    @Test
    @DisplayName("Should reject ambiguous or incomplete aggregation options")
    void testNormalizeErrors() {
        assertThrows(RuleConfigurationException.class,
                () -> AggregationSpec.normalize(List.of(Map.of("column", "a", "function", "sum")), "a", "sum"));
        assertThrows(RuleConfigurationException.class, () -> AggregationSpec.normalize(null, "a", null));
        assertThrows(RuleConfigurationException.class, () -> AggregationSpec.normalize(List.of(), null, null));
        assertThrows(RuleConfigurationException.class, () -> AggregationSpec.normalize("sum", null, null));
        assertThrows(RuleConfigurationException.class,
                () -> AggregationSpec.normalize(List.of(Map.of("column", "a")), null, null));
        RuleConfigurationException ex = assertThrows(RuleConfigurationException.class,
                () -> AggregationSpec.normalize(null, "a", "median"));
        assertTrue(ex.getMessage().startsWith("Unknown aggregation: median"));
    }
}
