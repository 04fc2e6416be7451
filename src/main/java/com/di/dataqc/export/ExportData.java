package com.di.dataqc.export;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renderer-neutral view of any stored result: a summary table, failed-row tables keyed by label,
 * and optional comparison and aggregation side tables.
 */
@Value
@Builder
public class ExportData {

    List<Map<String, Object>> summary;

    Map<String, List<Map<String, Object>>> failedRows;

    /** Recorded differences of a pairwise comparison, or {@code null}. */
    List<Map<String, Object>> comparison;

    /** Per-group aggregate comparison rows of a reconciliation, or {@code null}. */
    List<Map<String, Object>> aggregation;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("summary", summary);
        map.put("failed_rows", failedRows);
        if (comparison != null) {
            map.put("comparison", comparison);
        }
        if (aggregation != null) {
            map.put("aggregation", aggregation);
        }
        return map;
    }

    /** Union of the keys of {@code rows}, in order of first appearance. */
    static Set<String> columnsOf(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        return columns;
    }
}
