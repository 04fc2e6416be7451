package com.di.dataqc.dataset;

import com.di.dataqc.exception.RuleConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One {@code {column, function}} aggregate request.
 * <p>
 * {@link #normalize} is the single place where the two accepted external shapes are resolved:
 * a list of {@code {column, function}} objects, or one legacy {@code column} + function keyword pair.
 */
public record AggregationSpec(String column, AggregateFunction function) {

    /** Display label, e.g. {@code SUM(amount)}. */
    public String label() {
        return function.id().toUpperCase(java.util.Locale.ROOT) + "(" + column + ")";
    }

    /**
     * @param list           the {@code aggregations} option, or {@code null}
     * @param legacyColumn   the single {@code column} option, or {@code null}
     * @param legacyFunction the single function keyword, or {@code null}
     * @throws RuleConfigurationException when neither or both shapes are given, or an entry is malformed
     */
    public static List<AggregationSpec> normalize(Object list, String legacyColumn, String legacyFunction) {
        boolean hasLegacy = legacyColumn != null || legacyFunction != null;
        if (list != null && hasLegacy) {
            throw new RuleConfigurationException(
                    "Specify either 'aggregations' or a single 'column' and function, not both");
        }
        if (list != null) {
            return fromList(list);
        }
        if (legacyColumn == null || legacyFunction == null) {
            throw new RuleConfigurationException(
                    "Aggregation requires an 'aggregations' list or both 'column' and a function");
        }
        return List.of(new AggregationSpec(legacyColumn, resolve(legacyFunction)));
    }

    public static AggregateFunction resolve(String keyword) {
        return AggregateFunction.fromId(keyword).orElseThrow(() -> new RuleConfigurationException(
                String.format("Unknown aggregation: %s. Supported: %s", keyword, supported())));
    }

    private static List<AggregationSpec> fromList(Object raw) {
        if (!(raw instanceof List) || ((List<?>) raw).isEmpty()) {
            throw new RuleConfigurationException("'aggregations' must be a non-empty list of {column, function}");
        }
        List<AggregationSpec> specs = new ArrayList<>();
        for (Object item : (List<?>) raw) {
            if (!(item instanceof Map)) {
                throw new RuleConfigurationException("Each aggregation must be an object with column and function, got: " + item);
            }
            Map<?, ?> entry = (Map<?, ?>) item;
            Object column = entry.get("column");
            Object function = entry.get("function") != null ? entry.get("function") : entry.get("aggregation");
            if (column == null || column.toString().isBlank() || function == null) {
                throw new RuleConfigurationException("Each aggregation needs 'column' and 'function': " + item);
            }
            specs.add(new AggregationSpec(column.toString(), resolve(function.toString())));
        }
        return List.copyOf(specs);
    }

    private static List<String> supported() {
        List<String> ids = Arrays.stream(AggregateFunction.values()).map(AggregateFunction::id).collect(Collectors.toList());
        ids.add("mean");
        return ids;
    }
}
