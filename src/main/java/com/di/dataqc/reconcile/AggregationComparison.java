package com.di.dataqc.reconcile;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Per-group comparison of one aggregate across sources, relative to the baseline source.
 */
@Value
@Builder
public class AggregationComparison {

    String column;

    String function;

    /** Display label, e.g. {@code SUM(amount)}. */
    String label;

    List<String> groupBy;

    String baselineSource;

    double varianceThreshold;

    int totalGroups;

    /** Rows {group, compare_source, baseline_value, compare_value, difference, variance_pct, exceeds_threshold}. */
    List<Map<String, Object>> results;

    /** The rows of {@link #results} that exceed the threshold. */
    List<Map<String, Object>> variances;

    long varianceCount;

    public boolean isPassed() {
        return varianceCount == 0;
    }
}
