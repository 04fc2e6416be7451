package com.di.dataqc.exception;

import java.util.List;

/**
 * Columns referenced by a rule or comparison are absent from the dataset.
 */
public class ColumnNotFoundException extends QcException {

    private final List<String> missingColumns;

    public ColumnNotFoundException(List<String> missingColumns) {
        super("Columns not found in data: " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
