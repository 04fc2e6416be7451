package com.di.dataqc.dataset;

import java.util.Objects;

/**
 * Named, typed column of a {@link Dataset}.
 */
public record Column(String name, ColumnType type) {

    public Column {
        Objects.requireNonNull(name, "column name");
        Objects.requireNonNull(type, "column type");
    }
}
