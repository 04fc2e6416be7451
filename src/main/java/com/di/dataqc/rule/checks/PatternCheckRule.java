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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regex match per value, either against a named common pattern or a custom expression.
 * Matching is anchored at the start of the value; patterns that must cover the whole value end with {@code $}.
 */
@Component
public class PatternCheckRule extends AbstractQcRule {

    /** Named patterns selectable by key instead of a raw regex. */
    public static final Map<String, String> COMMON_PATTERNS;

    static {
        Map<String, String> patterns = new LinkedHashMap<>();
        patterns.put("email", "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
        patterns.put("phone_us", "^\\d{3}-\\d{3}-\\d{4}$");
        patterns.put("phone_intl", "^\\+\\d{1,3}-\\d{3,14}$");
        patterns.put("date_iso", "^\\d{4}-\\d{2}-\\d{2}$");
        patterns.put("date_us", "^\\d{2}/\\d{2}/\\d{4}$");
        patterns.put("zip_us", "^\\d{5}(-\\d{4})?$");
        patterns.put("ssn_us", "^\\d{3}-\\d{2}-\\d{4}$");
        patterns.put("url", "^https?://[^\\s]+$");
        patterns.put("ipv4", "^\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}$");
        patterns.put("alphanumeric", "^[a-zA-Z0-9]+$");
        patterns.put("alpha_only", "^[a-zA-Z]+$");
        patterns.put("numeric_only", "^\\d+$");
        COMMON_PATTERNS = Collections.unmodifiableMap(patterns);
    }

    public PatternCheckRule() {
        super(RuleKind.PATTERN_CHECK, "Pattern Check", "Validates that values match a regex pattern");
    }

    @Override
    protected ConfigSchema buildSchema() {
        return ConfigSchema.builder()
                .required("column", ConfigProperty.string("Column to check"))
                .required("pattern", ConfigProperty.string(
                        "Regex pattern or common pattern name: " + String.join(", ", COMMON_PATTERNS.keySet())))
                .property("case_sensitive", ConfigProperty.flag("Case-sensitive matching", true))
                .property("allow_null", ConfigProperty.flag("Allow null values", false))
                .build();
    }

    @Override
    public void validateConfig(RuleConfig config) {
        super.validateConfig(config);
        compile(config);
    }

    @Override
    protected RuleResult evaluate(Dataset dataset, RuleConfig config) {
        String column = config.requireString("column");
        String patternInput = config.requireString("pattern");
        boolean allowNull = config.getBoolean("allow_null", false);
        requireColumns(dataset, List.of(column));
        Pattern regex = compile(config);
        String patternDisplay = COMMON_PATTERNS.containsKey(patternInput)
                ? patternInput + " (" + COMMON_PATTERNS.get(patternInput) + ")"
                : patternInput;

        List<Map<String, Object>> violations = new ArrayList<>();
        long failedCount = 0;
        long nullCount = 0;
        List<CellValue> values = dataset.values(column);
        for (int i = 0; i < values.size(); i++) {
            CellValue cell = values.get(i);
            String reason = null;
            if (cell.isNull()) {
                nullCount++;
                if (!allowNull) {
                    reason = "Null value not allowed";
                }
            } else if (!regex.matcher(cell.asText()).lookingAt()) {
                reason = "Does not match pattern: " + patternDisplay;
            }
            if (reason != null) {
                failedCount++;
                if (violations.size() < RuleResult.MAX_FAILED_ROWS) {
                    Map<String, Object> failure = new LinkedHashMap<>();
                    failure.put(column, cell.isNull() ? null : cell.asText());
                    failure.put("row_number", i + 1);
                    failure.put("reason", reason);
                    violations.add(failure);
                }
            }
        }

        int totalRows = dataset.rowCount();
        boolean passed = failedCount == 0;
        String message = passed
                ? String.format("All %d values in '%s' match pattern: %s", totalRows, column, patternDisplay)
                : String.format("%d of %d values in '%s' do not match pattern", failedCount, totalRows, column);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("column", column);
        details.put("pattern", patternDisplay);
        details.put("total_violations", failedCount);
        details.put("null_count", nullCount);

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("total_rows", totalRows);
        statistics.put("valid_count", totalRows - failedCount);
        statistics.put("invalid_count", failedCount);
        statistics.put("null_count", nullCount);
        statistics.put("pass_rate", Stats.percentage(totalRows - failedCount, totalRows));

        return result(passed, message)
                .details(details)
                .statistics(statistics)
                .failedRecords(violations, failedCount)
                .build();
    }

    private static Pattern compile(RuleConfig config) {
        String input = config.requireString("pattern");
        String regex = COMMON_PATTERNS.getOrDefault(input, input);
        int flags = config.getBoolean("case_sensitive", true) ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        try {
            return Pattern.compile(regex, flags);
        } catch (PatternSyntaxException e) {
            throw new RuleConfigurationException("Invalid regex pattern: " + e.getDescription(), e);
        }
    }
}
