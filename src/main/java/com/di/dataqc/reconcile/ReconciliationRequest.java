package com.di.dataqc.reconcile;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Canonical reconciliation input. {@link ReconciliationRequestMapper} builds it from the external request shape.
 * <p>
 * The first source is the baseline for aggregate variance; source names are unique.
 */
@Value
@Builder
public class ReconciliationRequest {

    List<NamedDataset> sources;

    List<String> keyColumns;

    /** Columns to compare; empty means every common non-key, non-internal column. */
    @Builder.Default
    List<String> valueColumns = List.of();

    @Builder.Default
    ToleranceConfig tolerance = ToleranceConfig.exact();

    @Builder.Default
    MatchOptions options = MatchOptions.defaults();

    @Builder.Default
    AnalysisFlags analysis = AnalysisFlags.all();

    /** Null when no aggregate comparison is requested. */
    AggregationConfig aggregation;
}
