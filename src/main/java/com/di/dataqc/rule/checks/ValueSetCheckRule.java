package com.di.dataqc.rule.checks;

import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.rule.AbstractQcRule;
import com.di.dataqc.rule.ConfigProperty;
import com.di.dataqc.rule.ConfigSchema;
import com.di.dataqc.rule.RuleConfig;
import com.di.dataqc.rule.RuleKind;
import com.di.dataqc.rule.RuleResult;
import com.di.dataqc.util.Stats;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Membership of every value in a configured allowed set. Values are compared by their canonical text,
 * so {@code 1} in the set matches both a numeric {@code 1} and the text {@code "1"}.
 */
@Component
public class ValueSetCheckRule extends AbstractQcRule {

    private static final String NULL_LABEL = "NULL";
    /** Frequency bucket for null cells, kept apart from the text {@code "NULL"}. */
    private static final Object NULL_KEY = new Object();

    public ValueSetCheckRule() {
        super(RuleKind.VALUE_SET_CHECK, "Value Set Check", "Validates that values belong to an allowed set");
    }

    @Override
    protected ConfigSchema buildSchema() {
        return ConfigSchema.builder()
                .required("column", ConfigProperty.string("Column to check"))
                .required("allowed_values", ConfigProperty.builder().type("array").items("string")
                        .description("List of allowed values").build())
                .property("case_sensitive", ConfigProperty.flag("Case-sensitive matching", true))
                .property("allow_null", ConfigProperty.flag("Allow null values", false))
                .build();
    }

    @Override
    public void validateConfig(RuleConfig config) {
        super.validateConfig(config);
        Object allowed = config.get("allowed_values");
        if (!(allowed instanceof List)) {
            throw new RuleConfigurationException("allowed_values must be a list");
        }
        if (((List<?>) allowed).isEmpty()) {
            throw new RuleConfigurationException("allowed_values cannot be empty");
        }
    }

    @Override
    protected RuleResult evaluate(Dataset dataset, RuleConfig config) {
        String column = config.requireString("column");
        List<Object> allowedValues = config.getList("allowed_values");
        boolean caseSensitive = config.getBoolean("case_sensitive", true);
        boolean allowNull = config.getBoolean("allow_null", false);
        requireColumns(dataset, List.of(column));

        Set<String> allowed = new HashSet<>();
        for (Object value : allowedValues) {
            if (value != null) {
                allowed.add(normalize(CellValue.of(value).asText(), caseSensitive));
            }
        }

        List<Map<String, Object>> violations = new ArrayList<>();
        Map<Object, Long> invalidCounts = new LinkedHashMap<>();
        long failedCount = 0;
        long nullCount = 0;
        List<CellValue> values = dataset.values(column);
        for (int i = 0; i < values.size(); i++) {
            CellValue cell = values.get(i);
            String reason = null;
            String display;
            if (cell.isNull()) {
                nullCount++;
                display = NULL_LABEL;
                if (!allowNull) {
                    reason = "NULL value not allowed";
                }
            } else {
                display = cell.asText();
                if (!allowed.contains(normalize(display, caseSensitive))) {
                    reason = "Not in allowed set: " + allowedValues;
                }
            }
            if (reason != null) {
                failedCount++;
                invalidCounts.merge(cell.isNull() ? NULL_KEY : display, 1L, Long::sum);
                if (violations.size() < RuleResult.MAX_FAILED_ROWS) {
                    Map<String, Object> failure = new LinkedHashMap<>();
                    failure.put(column, display);
                    failure.put("row_number", i + 1);
                    failure.put("reason", reason);
                    violations.add(failure);
                }
            }
        }

        List<Map<String, Object>> frequency = invalidCounts.entrySet().stream()
                .sorted((a, b) -> Long.compare(b.getValue(), a.getValue()))
                .map(e -> {
                    Map<String, Object> item = new LinkedHashMap<>();
                    item.put("value", e.getKey() == NULL_KEY ? NULL_LABEL : e.getKey());
                    item.put("count", e.getValue());
                    return item;
                })
                .collect(Collectors.toList());

        int totalRows = dataset.rowCount();
        boolean passed = failedCount == 0;
        String message = passed
                ? String.format("All %d values in '%s' are from allowed set", totalRows, column)
                : String.format("%d of %d values in '%s' are not in allowed set (%d unique invalid value(s))",
                        failedCount, totalRows, column, invalidCounts.size());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("column", column);
        details.put("allowed_values", allowedValues);
        details.put("invalid_value_frequency", frequency);
        details.put("total_violations", failedCount);
        details.put("null_count", nullCount);

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("total_rows", totalRows);
        statistics.put("valid_count", totalRows - failedCount);
        statistics.put("invalid_count", failedCount);
        statistics.put("null_count", nullCount);
        statistics.put("unique_invalid_values", invalidCounts.size());
        statistics.put("compliance_rate", Stats.percentage(totalRows - failedCount, totalRows));

        return result(passed, message)
                .details(details)
                .statistics(statistics)
                .failedRecords(violations, failedCount)
                .build();
    }

    private static String normalize(String text, boolean caseSensitive) {
        return caseSensitive ? text : text.toLowerCase(Locale.ROOT);
    }
}
