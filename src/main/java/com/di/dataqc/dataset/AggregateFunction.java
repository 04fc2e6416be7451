package com.di.dataqc.dataset;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Column aggregates shared by the aggregation rule and the reconciliation engine.
 * Numeric functions coerce cells with {@link TypeConverter#toNumber} and ignore nulls;
 * {@code COUNT} and {@code COUNT_DISTINCT} count non-null cells of any kind.
 */
public enum AggregateFunction {
    SUM("sum"),
    AVG("avg"),
    MIN("min"),
    MAX("max"),
    COUNT("count"),
    COUNT_DISTINCT("count_distinct"),
    STD("std"),
    VAR("var");

    private final String id;

    AggregateFunction(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /** Resolves a function keyword; {@code mean} is accepted for {@code avg}. */
    public static Optional<AggregateFunction> fromId(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        String normalized = keyword.trim().toLowerCase(Locale.ROOT);
        if ("mean".equals(normalized)) {
            return Optional.of(AVG);
        }
        for (AggregateFunction f : values()) {
            if (f.id.equals(normalized)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }

    /**
     * Applies the function. Returns {@code null} when the aggregate is undefined
     * (mean/min/max of no values, std/var of fewer than two).
     */
    public Double apply(List<CellValue> cells) {
        if (this == COUNT) {
            return (double) cells.stream().filter(c -> !c.isNull()).count();
        }
        if (this == COUNT_DISTINCT) {
            Set<CellValue> distinct = new HashSet<>();
            for (CellValue c : cells) {
                if (!c.isNull()) {
                    distinct.add(c);
                }
            }
            return (double) distinct.size();
        }
        double[] values = numeric(cells);
        int n = values.length;
        switch (this) {
            case SUM:
                double sum = 0;
                for (double v : values) {
                    sum += v;
                }
                return sum;
            case AVG:
                return n == 0 ? null : mean(values);
            case MIN:
                if (n == 0) {
                    return null;
                }
                double min = values[0];
                for (double v : values) {
                    min = Math.min(min, v);
                }
                return min;
            case MAX:
                if (n == 0) {
                    return null;
                }
                double max = values[0];
                for (double v : values) {
                    max = Math.max(max, v);
                }
                return max;
            case VAR:
                return n < 2 ? null : sampleVariance(values);
            case STD:
                return n < 2 ? null : Math.sqrt(sampleVariance(values));
            default:
                throw new IllegalStateException("Unhandled aggregate " + this);
        }
    }

    private static double[] numeric(List<CellValue> cells) {
        double[] out = new double[cells.size()];
        int n = 0;
        for (CellValue cell : cells) {
            CellValue number = TypeConverter.toNumber(cell);
            if (!number.isNull()) {
                out[n++] = number.asDouble();
            }
        }
        return java.util.Arrays.copyOf(out, n);
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double sampleVariance(double[] values) {
        double mean = mean(values);
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return squares / (values.length - 1);
    }
}
