package com.di.dataqc.dataset;

import java.util.Locale;

/**
 * Logical type of a dataset column, resolved once at ingestion.
 */
public enum ColumnType {
    INTEGER,
    FLOAT,
    STRING,
    BOOLEAN,
    DATE,
    DATETIME,
    /** Values of more than one kind, or a kind that could not be resolved. */
    MIXED;

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    public boolean isTemporal() {
        return this == DATE || this == DATETIME;
    }

    /** Lower-case name used in schemas and comparison output. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
