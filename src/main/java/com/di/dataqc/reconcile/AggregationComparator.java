package com.di.dataqc.reconcile;

import com.di.dataqc.dataset.AggregationSpec;
import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.ColumnNotFoundException;
import com.di.dataqc.util.Stats;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Computes each configured aggregate per source (optionally per group) and measures the variance of every
 * other source against the baseline.
 * <p>
 * Variance is {@code |other - baseline| / |baseline| * 100}, rounded to 2 decimals; a zero baseline gives
 * 100 when the other value is non-zero and 0 otherwise. A group missing from a source counts as 0.
 * A group is flagged when its variance is strictly greater than the threshold.
 */
public final class AggregationComparator {

    static final String ALL_GROUPS = "ALL";
    static final String GROUP_SEPARATOR = " | ";
    static final int MAX_RESULTS = 100;
    static final int MAX_VARIANCES = 50;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private AggregationComparator() {
    }

    public static List<AggregationComparison> compare(List<NamedDataset> sources, AggregationConfig config) {
        validateColumns(sources, config);
        NamedDataset baseline = sources.get(0);
        List<AggregationComparison> comparisons = new ArrayList<>(config.getAggregations().size());
        for (AggregationSpec spec : config.getAggregations()) {
            Map<String, Map<String, Double>> perSource = new LinkedHashMap<>();
            Set<String> groups = new TreeSet<>();
            for (NamedDataset source : sources) {
                Map<String, Double> values = aggregate(source.dataset(), spec, config.getGroupBy());
                perSource.put(source.name(), values);
                groups.addAll(values.keySet());
            }
            comparisons.add(compareSpec(spec, config, baseline.name(), perSource, groups));
        }
        return comparisons;
    }

    private static AggregationComparison compareSpec(AggregationSpec spec, AggregationConfig config, String baselineName,
                                                     Map<String, Map<String, Double>> perSource, Set<String> groups) {
        Map<String, Double> baselineValues = perSource.get(baselineName);
        List<Map<String, Object>> results = new ArrayList<>();
        List<Map<String, Object>> variances = new ArrayList<>();
        long varianceCount = 0;
        for (String group : groups) {
            double baselineValue = valueOrZero(baselineValues.get(group));
            for (Map.Entry<String, Map<String, Double>> entry : perSource.entrySet()) {
                if (entry.getKey().equals(baselineName)) {
                    continue;
                }
                double compareValue = valueOrZero(entry.getValue().get(group));
                double variance = variancePct(baselineValue, compareValue);
                boolean exceeds = variance > config.getVarianceThreshold();

                Map<String, Object> row = new LinkedHashMap<>();
                row.put("group", group);
                row.put("baseline_source", baselineName);
                row.put("compare_source", entry.getKey());
                row.put("baseline_value", baselineValue);
                row.put("compare_value", compareValue);
                row.put("difference", BigDecimal.valueOf(compareValue).subtract(BigDecimal.valueOf(baselineValue)).doubleValue());
                row.put("variance_pct", variance);
                row.put("exceeds_threshold", exceeds);
                if (results.size() < MAX_RESULTS) {
                    results.add(row);
                }
                if (exceeds) {
                    varianceCount++;
                    if (variances.size() < MAX_VARIANCES) {
                        variances.add(row);
                    }
                }
            }
        }
        return AggregationComparison.builder()
                .column(spec.column())
                .function(spec.function().id())
                .label(spec.label())
                .groupBy(config.getGroupBy())
                .baselineSource(baselineName)
                .varianceThreshold(config.getVarianceThreshold())
                .totalGroups(groups.size())
                .results(results)
                .variances(variances)
                .varianceCount(varianceCount)
                .build();
    }

    static double variancePct(double baseline, double other) {
        if (baseline == 0) {
            return other == 0 ? 0.0 : 100.0;
        }
        BigDecimal b = BigDecimal.valueOf(baseline);
        BigDecimal delta = BigDecimal.valueOf(other).subtract(b).abs();
        return Stats.round(delta.multiply(HUNDRED).divide(b.abs(), MathContext.DECIMAL64).doubleValue(), 2);
    }

    private static Map<String, Double> aggregate(Dataset dataset, AggregationSpec spec, List<String> groupBy) {
        List<CellValue> values = dataset.values(spec.column());
        Map<String, Double> out = new TreeMap<>();
        if (groupBy.isEmpty()) {
            out.put(ALL_GROUPS, spec.function().apply(values));
            return out;
        }
        Map<String, List<CellValue>> grouped = new TreeMap<>();
        for (int row = 0; row < dataset.rowCount(); row++) {
            String label = groupLabel(dataset, groupBy, row);
            if (label != null) {
                grouped.computeIfAbsent(label, k -> new ArrayList<>()).add(values.get(row));
            }
        }
        grouped.forEach((label, cells) -> out.put(label, spec.function().apply(cells)));
        return out;
    }

    /** Group label, or {@code null} when any group-by value is null. */
    private static String groupLabel(Dataset dataset, List<String> groupBy, int row) {
        List<String> parts = new ArrayList<>(groupBy.size());
        for (String column : groupBy) {
            CellValue cell = dataset.cell(row, column);
            if (cell.isNull()) {
                return null;
            }
            parts.add(cell.asText());
        }
        return String.join(GROUP_SEPARATOR, parts);
    }

    private static double valueOrZero(Double value) {
        return value == null ? 0.0 : value;
    }

    private static void validateColumns(List<NamedDataset> sources, AggregationConfig config) {
        Set<String> required = new LinkedHashSet<>(config.getGroupBy());
        config.getAggregations().forEach(spec -> required.add(spec.column()));
        Set<String> missing = new LinkedHashSet<>();
        for (NamedDataset source : sources) {
            missing.addAll(source.dataset().missingColumns(required));
        }
        if (!missing.isEmpty()) {
            throw new ColumnNotFoundException(new ArrayList<>(missing));
        }
    }
}
