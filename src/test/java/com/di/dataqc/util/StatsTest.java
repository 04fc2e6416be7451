package com.di.dataqc.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Stats Tests")
class StatsTest {

    @Test
    @DisplayName("Should round half up")
    void testRound() {
        assertEquals(2.35, Stats.round(2.345, 2));
        assertEquals(-1.5, Stats.round(-1.45, 1));
        assertTrue(Double.isNaN(Stats.round(Double.NaN, 2)));
    }

    @Test
    @DisplayName("Should compute percentages with a zero total as 0")
    void testPercentage() {
        assertEquals(33.33, Stats.percentage(1, 3));
        assertEquals(100.0, Stats.percentage(4, 4));
        assertEquals(0.0, Stats.percentage(1, 0));
    }

    @Test
    @DisplayName("Should return null summaries for empty input")
    void testEmpty() {
        double[] empty = new double[0];
        assertNull(Stats.mean(empty));
        assertNull(Stats.median(empty));
        assertNull(Stats.min(empty));
        assertNull(Stats.max(empty));
        assertEquals(0.0, Stats.sum(empty));
    }

    @Test
    @DisplayName("Should compute the median of odd and even inputs")
    void testMedian() {
        assertEquals(2.0, Stats.median(new double[]{3, 1, 2}));
        assertEquals(2.5, Stats.median(new double[]{4, 1, 3, 2}));
    }

    @Test
    @DisplayName("Should format without trailing zeros")
    void testFormat() {
        assertEquals("5", Stats.format(5.0));
        assertEquals("2.5", Stats.format(2.50));
        assertEquals("0", Stats.format(0.0));
        assertEquals("0.001", Stats.format(0.001));
    }
}
