package com.di.dataqc.rule.checks;

import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.rule.AbstractQcRule;
import com.di.dataqc.rule.ConfigProperty;
import com.di.dataqc.rule.ConfigSchema;
import com.di.dataqc.rule.RuleConfig;
import com.di.dataqc.rule.RuleKind;
import com.di.dataqc.rule.RuleResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Row count against an exact value, a minimum, a maximum or an inclusive range.
 */
@Component
public class CountCheckRule extends AbstractQcRule {

    private static final List<String> MODES = List.of("exact", "min", "max", "range");

    public CountCheckRule() {
        super(RuleKind.COUNT_CHECK, "Count Check", "Validates row count against expected values");
    }

    @Override
    protected ConfigSchema buildSchema() {
        return ConfigSchema.builder()
                .property("comparison", ConfigProperty.choice("Type of count comparison", MODES, "exact"))
                .property("expected_count", ConfigProperty.builder().type("integer")
                        .description("Expected exact row count").build())
                .property("min_count", ConfigProperty.builder().type("integer")
                        .description("Minimum row count").build())
                .property("max_count", ConfigProperty.builder().type("integer")
                        .description("Maximum row count").build())
                .build();
    }

    @Override
    public void validateConfig(RuleConfig config) {
        super.validateConfig(config);
        switch (mode(config)) {
            case "exact":
                requireField(config, "expected_count", "exact");
                break;
            case "min":
                requireField(config, "min_count", "min");
                break;
            case "max":
                requireField(config, "max_count", "max");
                break;
            default:
                if (!config.has("min_count") || !config.has("max_count")) {
                    throw new RuleConfigurationException("min_count and max_count are required for range comparison");
                }
                break;
        }
    }

    @Override
    protected RuleResult evaluate(Dataset dataset, RuleConfig config) {
        String comparison = mode(config);
        long actual = dataset.rowCount();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("actual_count", actual);
        details.put("comparison_type", comparison);

        boolean passed;
        String message;
        switch (comparison) {
            case "exact": {
                long expected = config.getLong("expected_count");
                passed = actual == expected;
                details.put("expected_count", expected);
                details.put("difference", actual - expected);
                message = String.format("Row count: %d (expected: %d)", actual, expected);
                break;
            }
            case "min": {
                long min = config.getLong("min_count");
                passed = actual >= min;
                details.put("min_count", min);
                message = String.format("Row count: %d (minimum: %d)", actual, min);
                break;
            }
            case "max": {
                long max = config.getLong("max_count");
                passed = actual <= max;
                details.put("max_count", max);
                message = String.format("Row count: %d (maximum: %d)", actual, max);
                break;
            }
            default: {
                long min = config.getLong("min_count");
                long max = config.getLong("max_count");
                passed = min <= actual && actual <= max;
                details.put("min_count", min);
                details.put("max_count", max);
                message = String.format("Row count: %d (range: %d-%d)", actual, min, max);
                break;
            }
        }

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("actual_count", actual);
        return result(passed, message)
                .details(details)
                .statistics(statistics)
                .build();
    }

    private static String mode(RuleConfig config) {
        return config.getString("comparison", "exact").trim().toLowerCase(Locale.ROOT);
    }

    private static void requireField(RuleConfig config, String field, String mode) {
        if (!config.has(field)) {
            throw new RuleConfigurationException(field + " is required for " + mode + " comparison");
        }
    }
}
