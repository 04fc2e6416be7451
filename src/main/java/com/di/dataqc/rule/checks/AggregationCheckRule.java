package com.di.dataqc.rule.checks;

import com.di.dataqc.dataset.AggregateFunction;
import com.di.dataqc.dataset.AggregationSpec;
import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.rule.AbstractQcRule;
import com.di.dataqc.rule.ConfigProperty;
import com.di.dataqc.rule.ConfigSchema;
import com.di.dataqc.rule.RuleConfig;
import com.di.dataqc.rule.RuleKind;
import com.di.dataqc.rule.RuleResult;
import com.di.dataqc.rule.ToleranceType;
import com.di.dataqc.util.Stats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Computes one or more column aggregates, optionally per group, and for a single aggregate checks the
 * overall value against an expected value within an absolute or percentage tolerance.
 */
@Slf4j
@Component
public class AggregationCheckRule extends AbstractQcRule {

    private static final List<String> FUNCTIONS = List.of(
            "sum", "avg", "mean", "min", "max", "count", "count_distinct", "std", "var");

    public AggregationCheckRule() {
        super(RuleKind.AGGREGATION_CHECK, "Aggregation Check", "Validates that aggregation results match expected values");
    }

    @Override
    protected ConfigSchema buildSchema() {
        return ConfigSchema.builder()
                .property("aggregations", ConfigProperty.builder().type("array").items("object")
                        .description("List of {column, function} aggregates (alternative to column + aggregation)").build())
                .property("column", ConfigProperty.string("Column to aggregate"))
                .property("aggregation", ConfigProperty.builder().type("string").allowedValues(FUNCTIONS)
                        .description("Aggregation function to apply").build())
                .property("expected_value", ConfigProperty.number("Expected aggregation result"))
                .property("tolerance", ConfigProperty.builder().type("number").defaultValue(0)
                        .description("Acceptable tolerance for comparison").build())
                .property("tolerance_type", ConfigProperty.choice("Type of tolerance",
                        List.of("absolute", "percentage"), "absolute"))
                .property("group_by", ConfigProperty.stringList("Columns to group by before aggregation"))
                .build();
    }

    @Override
    public void validateConfig(RuleConfig config) {
        super.validateConfig(config);
        List<AggregationSpec> specs = specs(config);
        if (config.has("expected_value") && specs.size() > 1) {
            throw new RuleConfigurationException("expected_value applies to a single aggregation only");
        }
        tolerance(config);
    }

    @Override
    protected RuleResult evaluate(Dataset dataset, RuleConfig config) {
        List<AggregationSpec> specs = specs(config);
        List<String> groupBy = config.getStringList("group_by");
        List<String> referenced = new ArrayList<>(groupBy);
        specs.forEach(s -> referenced.add(s.column()));
        requireColumns(dataset, referenced);

        List<Map<String, Object>> computed = new ArrayList<>();
        for (AggregationSpec spec : specs) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("column", spec.column());
            entry.put("function", spec.function().id());
            entry.put("value", spec.function().apply(dataset.values(spec.column())));
            if (!groupBy.isEmpty()) {
                entry.put("grouped_values", grouped(dataset, spec, groupBy));
            }
            computed.add(entry);
        }

        boolean passed = true;
        Map<String, Object> comparison = new LinkedHashMap<>();
        Double expected = config.getDouble("expected_value");
        Double overall = (Double) computed.get(0).get("value");
        Tolerance tolerance = tolerance(config);
        if (expected != null && overall != null) {
            double allowance = tolerance.type() == ToleranceType.PERCENTAGE
                    ? Math.abs(expected * tolerance.amount() / 100.0)
                    : tolerance.amount();
            double difference = Math.abs(overall - expected);
            passed = difference <= allowance;
            comparison.put("expected", expected);
            comparison.put("actual", overall);
            comparison.put("difference", Stats.round(difference, 4));
            comparison.put("tolerance", tolerance.amount());
            comparison.put("tolerance_type", tolerance.type().id());
            comparison.put("within_tolerance", passed);
        }

        String message = computed.stream()
                .map(e -> describe(e, groupBy))
                .collect(Collectors.joining("; "));
        if (expected != null && overall != null && !passed) {
            message += String.format(" (expected: %s, diff: %.4f)", Stats.format(expected), Math.abs(overall - expected));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        if (specs.size() == 1) {
            details.put("column", specs.get(0).column());
            details.put("aggregation", specs.get(0).function().id());
        }
        details.put("aggregations", specs.stream().map(AggregationSpec::label).collect(Collectors.toList()));
        details.put("group_by", groupBy);
        details.put("comparison", comparison);

        Map<String, Object> statistics = new LinkedHashMap<>();
        if (specs.size() == 1) {
            statistics.put("aggregated_value", overall);
            statistics.put("grouped_values", computed.get(0).get("grouped_values"));
        } else {
            statistics.put("aggregations", computed);
        }
        log.debug("[RULE] aggregation_check: {}", message);

        return result(passed, message)
                .details(details)
                .statistics(statistics)
                .build();
    }

    private static List<AggregationSpec> specs(RuleConfig config) {
        Object list = config.asMap().get("aggregations");
        return AggregationSpec.normalize(list, config.getString("column"), config.getString("aggregation"));
    }

    /** Scalar {@code tolerance} + {@code tolerance_type}, or structured {@code tolerance: {value, type}}. */
    private static Tolerance tolerance(RuleConfig config) {
        Object raw = config.get("tolerance");
        if (raw instanceof Map) {
            Map<?, ?> structured = (Map<?, ?>) raw;
            if (config.has("tolerance_type")) {
                throw new RuleConfigurationException("Give tolerance type inside 'tolerance' or as 'tolerance_type', not both");
            }
            Object value = structured.get("value");
            Object type = structured.get("type");
            return new Tolerance(toNumber(value == null ? 0 : value), ToleranceType.fromId(type == null ? null : type.toString()));
        }
        return new Tolerance(config.getDouble("tolerance", 0.0), ToleranceType.fromId(config.getString("tolerance_type")));
    }

    private static double toNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new RuleConfigurationException("Tolerance value must be a number, got: " + value, e);
        }
    }

    /** Per-group values keyed by the group label; rows with a null group key are dropped. */
    private static Map<String, Double> grouped(Dataset dataset, AggregationSpec spec, List<String> groupBy) {
        Map<String, List<CellValue>> groups = new TreeMap<>();
        List<CellValue> values = dataset.values(spec.column());
        for (int i = 0; i < dataset.rowCount(); i++) {
            String label = groupLabel(dataset, i, groupBy);
            if (label != null) {
                groups.computeIfAbsent(label, k -> new ArrayList<>()).add(values.get(i));
            }
        }
        Map<String, Double> out = new LinkedHashMap<>();
        AggregateFunction function = spec.function();
        groups.forEach((label, cells) -> out.put(label, function.apply(cells)));
        return out;
    }

    private static String groupLabel(Dataset dataset, int row, List<String> groupBy) {
        String[] parts = new String[groupBy.size()];
        for (int g = 0; g < groupBy.size(); g++) {
            CellValue cell = dataset.cell(row, groupBy.get(g));
            if (cell.isNull()) {
                return null;
            }
            parts[g] = cell.asText();
        }
        return String.join(" | ", Arrays.asList(parts));
    }

    private static String describe(Map<String, Object> entry, List<String> groupBy) {
        String label = entry.get("function").toString().toUpperCase(java.util.Locale.ROOT) + "(" + entry.get("column") + ")";
        Object value = entry.get("value");
        String valueText = value == null ? "null" : Stats.format((Double) value);
        return groupBy.isEmpty() ? label + ": " + valueText : label + " by " + groupBy + ": " + valueText;
    }

    private record Tolerance(double amount, ToleranceType type) {
    }
}
