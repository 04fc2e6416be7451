package com.di.dataqc.reconcile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single-pass index of every source: key to {source name to row indices}.
 * <p>
 * Keys keep first-seen order across sources in supplied order; per key, sources keep supplied order.
 */
public final class KeyIndex {

    private final Map<RowKey, Map<String, List<Integer>>> entries;

    private KeyIndex(Map<RowKey, Map<String, List<Integer>>> entries) {
        this.entries = entries;
    }

    public static KeyIndex build(List<NamedDataset> sources, KeyNormalizer normalizer) {
        Map<RowKey, Map<String, List<Integer>>> entries = new LinkedHashMap<>();
        for (NamedDataset source : sources) {
            for (int row = 0; row < source.dataset().rowCount(); row++) {
                RowKey key = normalizer.keyFor(source.dataset(), row);
                entries.computeIfAbsent(key, k -> new LinkedHashMap<>())
                        .computeIfAbsent(source.name(), s -> new ArrayList<>())
                        .add(row);
            }
        }
        return new KeyIndex(entries);
    }

    public Set<RowKey> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    /** Source name to row indices for {@code key}; empty when the key is unknown. */
    public Map<String, List<Integer>> rowsFor(RowKey key) {
        Map<String, List<Integer>> rows = entries.get(key);
        return rows == null ? Map.of() : Collections.unmodifiableMap(rows);
    }

    public int sourceCount(RowKey key) {
        return rowsFor(key).size();
    }
}
