package com.di.dataqc.export;

import com.di.dataqc.compare.ComparisonResult;
import com.di.dataqc.formula.FormulaResult;
import com.di.dataqc.reconcile.AggregationComparison;
import com.di.dataqc.reconcile.ReconciliationResult;
import com.di.dataqc.rule.RuleBatchResult;
import com.di.dataqc.rule.RuleResult;
import com.di.dataqc.store.StoredResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flattens the four result kinds into {@link ExportData}. Every summary row carries {@code Label} and
 * {@code Status} ({@code PASS}, {@code FAIL}, {@code INFO} or {@code DETAIL}).
 */
@Component
public class ExportShaper {

    public static final String LABEL = "Label";
    public static final String STATUS = "Status";

    public ExportData shape(StoredResult result, boolean includeFailedRows) {
        switch (result.getType()) {
            case RULE_BATCH:
                return shapeRuleBatch(result.payload(RuleBatchResult.class), includeFailedRows);
            case COMPARISON:
                return shapeComparison(result.payload(ComparisonResult.class));
            case RECONCILIATION:
                return shapeReconciliation(result.payload(ReconciliationResult.class), includeFailedRows);
            case FORMULA:
                return shapeFormula(result.payload(FormulaResult.class), includeFailedRows);
            default:
                throw new IllegalStateException("Unhandled result type: " + result.getType());
        }
    }

    // ------------------------------------------------------------------------
    // Rule batch
    // ------------------------------------------------------------------------

    private static ExportData shapeRuleBatch(RuleBatchResult batch, boolean includeFailedRows) {
        List<Map<String, Object>> summary = new ArrayList<>();
        Map<String, List<Map<String, Object>>> failed = new LinkedHashMap<>();
        for (RuleResult rule : batch.getResults()) {
            Map<String, Object> row = summaryRow(rule.getRuleName(), rule.isPassed() ? "PASS" : "FAIL");
            row.put("Message", rule.getMessage());
            rule.getStatistics().forEach((key, value) -> {
                if (isScalar(value)) {
                    row.put(titleCase(key), value);
                }
            });
            summary.add(row);
            if (includeFailedRows && !rule.getFailedRows().isEmpty()) {
                failed.put(uniqueLabel(failed, rule.getRuleName()), rule.getFailedRows());
            }
        }
        return ExportData.builder().summary(summary).failedRows(failed).build();
    }

    // ------------------------------------------------------------------------
    // Pairwise comparison
    // ------------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private static ExportData shapeComparison(ComparisonResult comparison) {
        Map<String, Object> row = summaryRow("Dataset Comparison", comparison.isMatch() ? "PASS" : "FAIL");
        row.put("Message", comparison.getMessage());
        row.put("Rows Compared", comparison.getSummary().getOrDefault("rows_compared", 0));
        row.put("Total Differences", comparison.getSummary().getOrDefault("total_differences", 0));

        Map<String, Object> rowDiff = comparison.getRowDifferences();
        Object differences = rowDiff.containsKey("differences")
                ? rowDiff.get("differences") : rowDiff.get("value_differences");
        List<Map<String, Object>> table = differences instanceof List && !((List<?>) differences).isEmpty()
                ? (List<Map<String, Object>>) differences : null;
        return ExportData.builder()
                .summary(List.of(row))
                .failedRows(Map.of())
                .comparison(table)
                .build();
    }

    // ------------------------------------------------------------------------
    // Reconciliation
    // ------------------------------------------------------------------------

    private static ExportData shapeReconciliation(ReconciliationResult result, boolean includeFailedRows) {
        List<Map<String, Object>> summary = new ArrayList<>();
        Map<String, List<Map<String, Object>>> failed = new LinkedHashMap<>();

        ReconciliationResult.DuplicateSection duplicates = result.getDuplicates();
        if (duplicates != null) {
            Map<String, Object> row = summaryRow("Duplicates (In Multiple Sources)",
                    duplicates.getCount() == 0 ? "PASS" : "FAIL");
            row.put("Count", duplicates.getCount());
            summary.add(row);
            if (includeFailedRows && !duplicates.getRows().isEmpty()) {
                failed.put("Duplicates", duplicates.getRows());
            }
        }

        if (result.getUnique() != null) {
            result.getUnique().forEach((source, section) -> {
                Map<String, Object> row = summaryRow("Unique to: " + source, "INFO");
                row.put("Count", section.getCount());
                summary.add(row);
                if (includeFailedRows && !section.getRows().isEmpty()) {
                    failed.put("Unique_" + source, section.getRows());
                }
            });
        }

        ReconciliationResult.DifferenceSection differences = result.getNotMatched();
        if (differences != null) {
            Map<String, Object> row = summaryRow("Value Differences", differences.getCount() == 0 ? "PASS" : "FAIL");
            row.put("Count", differences.getCount());
            summary.add(row);
            if (includeFailedRows && !differences.getRows().isEmpty()) {
                failed.put("Differences", differences.getRows());
            }
            differences.getColumnDifferences().forEach((column, count) -> {
                Map<String, Object> detail = summaryRow("Column Difference: " + column, "DETAIL");
                detail.put("Count", count);
                summary.add(detail);
            });
        }

        List<Map<String, Object>> aggregationTable = null;
        if (result.getAggregation() != null) {
            aggregationTable = new ArrayList<>();
            List<Map<String, Object>> variances = new ArrayList<>();
            for (AggregationComparison comparison : result.getAggregation()) {
                Map<String, Object> row = summaryRow("Aggregation: " + comparison.getLabel(),
                        comparison.isPassed() ? "PASS" : "FAIL");
                row.put("Count", comparison.getTotalGroups());
                summary.add(row);
                aggregationTable.addAll(labelled(comparison.getLabel(), comparison.getResults()));
                variances.addAll(labelled(comparison.getLabel(), comparison.getVariances()));
            }
            if (includeFailedRows && !variances.isEmpty()) {
                failed.put("Aggregation_Variances", variances);
            }
        }

        return ExportData.builder()
                .summary(summary)
                .failedRows(failed)
                .aggregation(aggregationTable)
                .build();
    }

    private static List<Map<String, Object>> labelled(String label, List<Map<String, Object>> rows) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>();
            copy.put("aggregation", label);
            copy.putAll(row);
            out.add(copy);
        }
        return out;
    }

    // ------------------------------------------------------------------------
    // Formula
    // ------------------------------------------------------------------------

    private static ExportData shapeFormula(FormulaResult result, boolean includeFailedRows) {
        Map<String, Object> row = summaryRow("Formula: " + result.getFormula(), "INFO");
        row.put("Calculated Rows", result.getStatistics().get("calculated_rows"));
        row.put("Total Rows", result.getStatistics().get("total_rows"));
        Map<String, List<Map<String, Object>>> failed = new LinkedHashMap<>();
        if (includeFailedRows && !result.getData().isEmpty()) {
            failed.put("Calculated", result.getData());
        }
        return ExportData.builder().summary(List.of(row)).failedRows(failed).build();
    }

    // ------------------------------------------------------------------------

    private static Map<String, Object> summaryRow(String label, String status) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(LABEL, label);
        row.put(STATUS, status);
        return row;
    }

    /** {@code label}, or {@code label (n)} with the first free {@code n} from 2 when already taken. */
    static String uniqueLabel(Map<String, ?> taken, String label) {
        if (!taken.containsKey(label)) {
            return label;
        }
        int n = 2;
        while (taken.containsKey(label + " (" + n + ")")) {
            n++;
        }
        return label + " (" + n + ")";
    }

    private static boolean isScalar(Object value) {
        return value instanceof Number || value instanceof String || value instanceof Boolean;
    }

    /** {@code total_rows} to {@code Total Rows}. */
    static String titleCase(String key) {
        StringBuilder out = new StringBuilder(key.length());
        for (String word : key.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return out.toString();
    }
}
