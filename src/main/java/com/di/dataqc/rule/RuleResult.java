package com.di.dataqc.rule;

import com.di.dataqc.dataset.Dataset;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one rule execution. Immutable once built; {@link #toMap()} gives the plain nested form
 * used for transport and export.
 */
@Value
@Builder(toBuilder = true)
public class RuleResult {

    /** Failed rows kept for display; {@link #failedRowCount} carries the full count. */
    public static final int MAX_FAILED_ROWS = 100;

    String ruleName;

    boolean passed;

    String message;

    @Builder.Default
    Map<String, Object> details = Map.of();

    @Builder.Default
    Map<String, Object> statistics = Map.of();

    @Builder.Default
    List<Map<String, Object>> failedRows = List.of();

    long failedRowCount;

    /** Set only when the rule could not run (configuration or missing-column error). */
    String error;

    /**
     * A rule that could not run, downgraded to a failed result so the rest of a batch still executes.
     */
    public static RuleResult error(String ruleName, String errorMessage) {
        return RuleResult.builder()
                .ruleName(ruleName)
                .passed(false)
                .message("Error: " + errorMessage)
                .error(errorMessage)
                .build();
    }

    public boolean hasFailedRows() {
        return failedRowCount > 0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("rule_name", ruleName);
        map.put("passed", passed);
        map.put("message", message);
        map.put("details", details);
        map.put("statistics", statistics);
        if (failedRowCount > 0) {
            map.put("failed_rows", failedRows);
            map.put("failed_row_count", failedRowCount);
        }
        if (error != null) {
            map.put("error", error);
        }
        return map;
    }

    public static class RuleResultBuilder {

        /** Failed rows taken from {@code dataset} at {@code indices}, capped at {@link #MAX_FAILED_ROWS}. */
        public RuleResultBuilder failedRowsOf(Dataset dataset, List<Integer> indices) {
            List<Map<String, Object>> rows = new ArrayList<>(Math.min(indices.size(), MAX_FAILED_ROWS));
            for (int i = 0; i < indices.size() && i < MAX_FAILED_ROWS; i++) {
                rows.add(dataset.record(indices.get(i)));
            }
            return failedRecords(rows, indices.size());
        }

        /** Pre-built failed records; only the first {@link #MAX_FAILED_ROWS} are kept. */
        public RuleResultBuilder failedRecords(List<Map<String, Object>> records, long totalCount) {
            List<Map<String, Object>> capped = records.size() > MAX_FAILED_ROWS
                    ? new ArrayList<>(records.subList(0, MAX_FAILED_ROWS))
                    : new ArrayList<>(records);
            return failedRows(List.copyOf(capped)).failedRowCount(totalCount);
        }
    }
}
