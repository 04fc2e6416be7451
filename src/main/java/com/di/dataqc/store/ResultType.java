package com.di.dataqc.store;

/**
 * Kind of payload held by a {@link StoredResult}.
 */
public enum ResultType {
    RULE_BATCH("qc_run"),
    COMPARISON("comparison"),
    RECONCILIATION("multi_comparison"),
    FORMULA("formula");

    private final String id;

    ResultType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
