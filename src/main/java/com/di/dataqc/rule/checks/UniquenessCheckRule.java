package com.di.dataqc.rule.checks;

import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.rule.AbstractQcRule;
import com.di.dataqc.rule.ConfigProperty;
import com.di.dataqc.rule.ConfigSchema;
import com.di.dataqc.rule.RuleConfig;
import com.di.dataqc.rule.RuleKind;
import com.di.dataqc.rule.RuleResult;
import com.di.dataqc.util.Stats;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Occurrence counts per value of one column; any value seen more than once is a violation.
 */
@Component
public class UniquenessCheckRule extends AbstractQcRule {

    private static final String NULL_LABEL = "NULL";
    /** Bucket for null cells, kept apart from the text {@code "NULL"}. */
    private static final Object NULL_KEY = new Object();
    private static final int MAX_DETAILED_VALUES = 20;
    private static final int MAX_ROW_NUMBERS = 10;
    private static final int MAX_DISPLAY_VALUES = 50;
    private static final int MAX_SAMPLE_ROWS = 5;

    public UniquenessCheckRule() {
        super(RuleKind.UNIQUENESS_CHECK, "Uniqueness Check",
                "Validates that a column contains only unique values (no duplicates)");
    }

    @Override
    protected ConfigSchema buildSchema() {
        return ConfigSchema.builder()
                .required("column", ConfigProperty.string("Column to check for uniqueness"))
                .property("case_sensitive", ConfigProperty.flag("Treat values as case-sensitive", true))
                .property("ignore_nulls", ConfigProperty.flag("Exclude null values from the uniqueness check", true))
                .build();
    }

    @Override
    protected RuleResult evaluate(Dataset dataset, RuleConfig config) {
        String column = config.requireString("column");
        boolean caseSensitive = config.getBoolean("case_sensitive", true);
        boolean ignoreNulls = config.getBoolean("ignore_nulls", true);
        requireColumns(dataset, List.of(column));

        Map<Object, List<Integer>> occurrences = new LinkedHashMap<>();
        List<CellValue> values = dataset.values(column);
        for (int i = 0; i < values.size(); i++) {
            CellValue cell = values.get(i);
            if (cell.isNull() && ignoreNulls) {
                continue;
            }
            occurrences.computeIfAbsent(compareKey(cell, caseSensitive), k -> new ArrayList<>()).add(i);
        }

        List<Map.Entry<Object, List<Integer>>> duplicated = occurrences.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .sorted((a, b) -> Integer.compare(b.getValue().size(), a.getValue().size()))
                .collect(Collectors.toList());

        long duplicateRows = 0;
        List<Map<String, Object>> violations = new ArrayList<>();
        List<Map<String, Object>> duplicateDetails = new ArrayList<>();
        List<Map<String, Object>> failedDisplay = new ArrayList<>();
        for (Map.Entry<Object, List<Integer>> entry : duplicated) {
            List<Integer> rows = entry.getValue();
            String label = entry.getKey() == NULL_KEY ? NULL_LABEL : (String) entry.getKey();
            duplicateRows += rows.size();

            Map<String, Object> violation = new LinkedHashMap<>();
            violation.put("value", label);
            violation.put("occurrences", rows.size());
            violations.add(violation);

            List<Integer> rowNumbers = rows.stream().limit(MAX_ROW_NUMBERS).map(r -> r + 1).collect(Collectors.toList());
            if (duplicateDetails.size() < MAX_DETAILED_VALUES) {
                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("value", label);
                detail.put("count", rows.size());
                detail.put("row_numbers", rowNumbers);
                duplicateDetails.add(detail);
            }
            if (failedDisplay.size() < MAX_DISPLAY_VALUES) {
                Map<String, Object> display = new LinkedHashMap<>();
                display.put(column, label);
                display.put("occurrences", rows.size());
                display.put("sample_rows", rowNumbers.stream().limit(MAX_SAMPLE_ROWS)
                        .map(String::valueOf).collect(Collectors.joining(", ")));
                failedDisplay.add(display);
            }
        }

        int totalRows = dataset.rowCount();
        int uniqueValues = occurrences.size();
        boolean passed = duplicateRows == 0;
        String message = passed
                ? String.format("All %d values in '%s' are unique", totalRows, column)
                : String.format("%d duplicate rows found across %d distinct value(s) in '%s'",
                        duplicateRows, violations.size(), column);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("column", column);
        details.put("violations", violations);
        details.put("duplicate_details", duplicateDetails);
        details.put("total_duplicate_rows", duplicateRows);
        details.put("unique_values", uniqueValues);

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("total_rows", totalRows);
        statistics.put("unique_values", uniqueValues);
        statistics.put("duplicate_values", violations.size());
        statistics.put("duplicate_rows", duplicateRows);
        statistics.put("uniqueness_rate", Stats.percentage(uniqueValues, totalRows));

        return result(passed, message)
                .details(details)
                .statistics(statistics)
                .failedRecords(failedDisplay, duplicateRows)
                .build();
    }

    private static Object compareKey(CellValue cell, boolean caseSensitive) {
        if (cell.isNull()) {
            return NULL_KEY;
        }
        String text = cell.asText();
        return caseSensitive || !cell.isText() ? text : text.toLowerCase(Locale.ROOT);
    }
}
