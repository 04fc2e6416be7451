package com.di.dataqc.reconcile;

/**
 * Outcome of comparing two cell values.
 */
public enum ComparisonStatus {
    MATCH,
    NULL_MISMATCH,
    NUMERIC_MISMATCH,
    DATE_MISMATCH,
    STRING_MISMATCH;

    public boolean isMatch() {
        return this == MATCH;
    }
}
