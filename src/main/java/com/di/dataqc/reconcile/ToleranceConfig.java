package com.di.dataqc.reconcile;

import com.di.dataqc.rule.ToleranceType;
import lombok.Builder;
import lombok.Value;

/**
 * Canonical tolerance for value comparison: a numeric amount read as absolute or percentage,
 * and a date amount in {@link DateUnit}s.
 */
@Value
@Builder
public class ToleranceConfig {

    @Builder.Default
    double numeric = 0;

    @Builder.Default
    ToleranceType numericType = ToleranceType.ABSOLUTE;

    @Builder.Default
    double date = 0;

    @Builder.Default
    DateUnit dateUnit = DateUnit.DAYS;

    public static ToleranceConfig exact() {
        return ToleranceConfig.builder().build();
    }
}
