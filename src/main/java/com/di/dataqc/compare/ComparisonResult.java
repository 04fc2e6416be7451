package com.di.dataqc.compare;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a pairwise comparison between a source and a target dataset.
 */
@Value
@Builder
public class ComparisonResult {

    boolean match;

    String message;

    @Builder.Default
    Map<String, Object> summary = Map.of();

    @Builder.Default
    Map<String, Object> columnDifferences = Map.of();

    @Builder.Default
    Map<String, Object> rowDifferences = Map.of();

    @Builder.Default
    Map<String, Object> statistics = Map.of();

    public long totalDifferences() {
        Object total = rowDifferences.get("total_differences");
        return total instanceof Number ? ((Number) total).longValue() : 0L;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("match", match);
        map.put("message", message);
        map.put("summary", summary);
        map.put("column_differences", columnDifferences);
        map.put("row_differences", rowDifferences);
        map.put("statistics", statistics);
        return map;
    }
}
