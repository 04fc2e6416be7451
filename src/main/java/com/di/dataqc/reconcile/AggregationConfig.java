package com.di.dataqc.reconcile;

import com.di.dataqc.dataset.AggregationSpec;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Aggregates to compute per source and compare against the baseline.
 */
@Value
@Builder
public class AggregationConfig {

    List<AggregationSpec> aggregations;

    @Builder.Default
    List<String> groupBy = List.of();

    /** Variance percentage above which a group is flagged. */
    @Builder.Default
    double varianceThreshold = 0;
}
