package com.di.dataqc.compare;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Options for {@link DatasetComparator#compare}. Without key columns rows are compared by position.
 */
@Value
@Builder
public class ComparisonOptions {

    @Builder.Default
    List<String> keyColumns = List.of();

    /** Columns to compare; empty means all columns of the source, or the common columns when schemas differ. */
    @Builder.Default
    List<String> compareColumns = List.of();

    @Builder.Default
    double tolerance = 0;

    boolean ignoreCase;

    boolean ignoreWhitespace;

    public static ComparisonOptions defaults() {
        return ComparisonOptions.builder().build();
    }

    public boolean isKeyBased() {
        return keyColumns != null && !keyColumns.isEmpty();
    }
}
