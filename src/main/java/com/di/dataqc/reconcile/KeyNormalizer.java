package com.di.dataqc.reconcile;

import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.Dataset;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds {@link RowKey}s: each key cell is stringified (empty for null), run through the configured
 * transforms in order, then lower-cased and stripped when case or whitespace is ignored.
 */
public final class KeyNormalizer {

    private final List<String> keyColumns;
    private final MatchOptions options;

    public KeyNormalizer(List<String> keyColumns, MatchOptions options) {
        this.keyColumns = List.copyOf(keyColumns);
        this.options = options;
    }

    public RowKey keyFor(Dataset dataset, int row) {
        List<String> parts = new ArrayList<>(keyColumns.size());
        for (String column : keyColumns) {
            parts.add(normalize(dataset.cell(row, column)));
        }
        return new RowKey(parts);
    }

    public String normalize(CellValue cell) {
        String value = cell.asText();
        for (KeyTransform transform : options.getTransformations()) {
            value = transform.apply(value);
        }
        if (options.isIgnoreCase()) {
            value = value.toLowerCase(Locale.ROOT);
        }
        if (options.isIgnoreWhitespace()) {
            value = value.strip();
        }
        return value;
    }
}
