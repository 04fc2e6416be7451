package com.di.dataqc.reconcile;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Normalization applied to keys and string values before they are compared.
 */
@Value
@Builder
public class MatchOptions {

    boolean ignoreCase;

    boolean ignoreWhitespace;

    /** Whether two nulls count as a match. */
    @Builder.Default
    boolean nullEqualsNull = true;

    @Builder.Default
    List<KeyTransform> transformations = List.of();

    public static MatchOptions defaults() {
        return MatchOptions.builder().build();
    }
}
