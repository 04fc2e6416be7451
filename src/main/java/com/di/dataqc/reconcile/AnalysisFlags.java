package com.di.dataqc.reconcile;

import lombok.Builder;
import lombok.Value;

/**
 * Which reconciliation analyses to run.
 */
@Value
@Builder
public class AnalysisFlags {

    @Builder.Default
    boolean duplicates = true;

    @Builder.Default
    boolean unique = true;

    @Builder.Default
    boolean notMatched = true;

    public static AnalysisFlags all() {
        return AnalysisFlags.builder().build();
    }
}
