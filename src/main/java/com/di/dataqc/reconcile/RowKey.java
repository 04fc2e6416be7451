package com.di.dataqc.reconcile;

import java.util.List;

/**
 * Normalized composite key, one part per key column.
 */
public record RowKey(List<String> parts) {

    public RowKey {
        parts = List.copyOf(parts);
    }

    /** Parts joined with {@code |}, for display. */
    public String display() {
        return String.join("|", parts);
    }
}
