package com.di.dataqc.reconcile;

import com.di.dataqc.dataset.AggregationSpec;
import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.rule.RuleConfig;
import com.di.dataqc.rule.ToleranceType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the external reconciliation request shapes into the canonical {@link ReconciliationRequest} parts.
 * <p>
 * Accepted shapes:
 * <ul>
 *   <li>{@code tolerance}: a number (absolute numeric tolerance) or {@code {numeric, numeric_type, date, date_unit}}</li>
 *   <li>{@code aggregation}: {@code {column, function}} or {@code {aggregations: [{column, function}]}},
 *       each with optional {@code group_by}, {@code variance_threshold} and {@code enabled}</li>
 * </ul>
 * Anything else is a {@link RuleConfigurationException}.
 */
public final class ReconciliationRequestMapper {

    private ReconciliationRequestMapper() {
    }

    public static ToleranceConfig tolerance(Object raw) {
        if (raw == null) {
            return ToleranceConfig.exact();
        }
        if (raw instanceof Number) {
            return ToleranceConfig.builder().numeric(nonNegative("tolerance", ((Number) raw).doubleValue())).build();
        }
        if (!(raw instanceof Map)) {
            throw new RuleConfigurationException(
                    "tolerance must be a number or an object with numeric, numeric_type, date, date_unit; got: " + raw);
        }
        RuleConfig config = RuleConfig.of(stringKeys((Map<?, ?>) raw));
        return ToleranceConfig.builder()
                .numeric(nonNegative("tolerance.numeric", config.getDouble("numeric", 0)))
                .numericType(ToleranceType.fromId(config.getString("numeric_type")))
                .date(nonNegative("tolerance.date", config.getDouble("date", 0)))
                .dateUnit(DateUnit.fromId(config.getString("date_unit")))
                .build();
    }

    public static MatchOptions options(Map<String, ?> raw) {
        if (raw == null) {
            return MatchOptions.defaults();
        }
        RuleConfig config = RuleConfig.of(raw);
        List<KeyTransform> transforms = new ArrayList<>();
        for (String id : config.getStringList("transformations")) {
            transforms.add(KeyTransform.fromId(id));
        }
        return MatchOptions.builder()
                .ignoreCase(config.getBoolean("ignore_case", false))
                .ignoreWhitespace(config.getBoolean("ignore_whitespace", false))
                .nullEqualsNull(config.getBoolean("null_equals_null", true))
                .transformations(List.copyOf(transforms))
                .build();
    }

    public static AnalysisFlags analysis(Map<String, ?> raw) {
        if (raw == null) {
            return AnalysisFlags.all();
        }
        RuleConfig config = RuleConfig.of(raw);
        return AnalysisFlags.builder()
                .duplicates(config.getBoolean("duplicates", true))
                .unique(config.getBoolean("unique", true))
                .notMatched(config.getBoolean("not_matched", true))
                .build();
    }

    /** Returns {@code null} when aggregation is absent or explicitly disabled. */
    public static AggregationConfig aggregation(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        RuleConfig config = RuleConfig.of(raw);
        if (!config.getBoolean("enabled", true)) {
            return null;
        }
        List<AggregationSpec> specs = AggregationSpec.normalize(
                config.get("aggregations"), config.getString("column"), config.getString("function"));
        return AggregationConfig.builder()
                .aggregations(specs)
                .groupBy(config.getStringList("group_by"))
                .varianceThreshold(nonNegative("variance_threshold", config.getDouble("variance_threshold", 0)))
                .build();
    }

    /**
     * Makes display names unique in supplied order: the second {@code sales} becomes {@code sales (2)}.
     */
    public static List<String> uniqueNames(List<String> names) {
        Map<String, Integer> seen = new HashMap<>();
        List<String> unique = new ArrayList<>(names.size());
        for (String name : names) {
            int count = seen.merge(name, 1, Integer::sum);
            String candidate = count == 1 ? name : name + " (" + count + ")";
            while (unique.contains(candidate)) {
                count = seen.merge(name, 1, Integer::sum);
                candidate = name + " (" + count + ")";
            }
            unique.add(candidate);
        }
        return unique;
    }

    private static double nonNegative(String field, double value) {
        if (value < 0) {
            throw new RuleConfigurationException(field + " must not be negative, got: " + value);
        }
        return value;
    }

    private static Map<String, Object> stringKeys(Map<?, ?> raw) {
        Map<String, Object> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }
}
