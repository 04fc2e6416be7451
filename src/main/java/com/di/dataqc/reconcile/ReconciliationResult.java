package com.di.dataqc.reconcile;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a multi-source reconciliation. Sections for disabled analyses are {@code null}.
 */
@Value
@Builder
public class ReconciliationResult {

    List<String> sources;

    String baselineSource;

    List<String> keyColumns;

    int totalKeys;

    DuplicateSection duplicates;

    /** Source name to the rows found only in that source. */
    Map<String, UniqueSection> unique;

    DifferenceSection notMatched;

    List<AggregationComparison> aggregation;

    /**
     * Keys present in two or more sources. {@code count} is the number of such keys;
     * {@code rows} holds their rows, tagged with {@code _source}, for the first keys only.
     */
    @Value
    @Builder
    public static class DuplicateSection {
        long count;
        long rowCount;
        List<Map<String, Object>> rows;
    }

    /**
     * Keys present in exactly one source. {@code count} is the number of rows, {@code keyCount} the number of keys.
     */
    @Value
    @Builder
    public static class UniqueSection {
        long count;
        long keyCount;
        List<Map<String, Object>> rows;
    }

    /**
     * Cell differences among sources sharing a key. {@code count} is the number of differing cells.
     */
    @Value
    @Builder
    public static class DifferenceSection {
        long count;
        long keysWithDifferences;
        Map<String, Long> columnDifferences;
        List<Map<String, Object>> rows;
    }
}
