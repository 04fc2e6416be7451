package com.di.dataqc.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;

/**
 * Small numeric helpers for rule statistics.
 */
public final class Stats {

    private Stats() {
    }

    /** Half-up rounding to {@code places} decimals. */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    /** {@code 100 * part / total} rounded to 2 decimals; 0 when total is 0. */
    public static double percentage(long part, long total) {
        if (total == 0) {
            return 0.0;
        }
        return round(100.0 * part / total, 2);
    }

    public static Double mean(double[] values) {
        if (values.length == 0) {
            return null;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static Double median(double[] values) {
        if (values.length == 0) {
            return null;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    public static Double min(double[] values) {
        return values.length == 0 ? null : Arrays.stream(values).min().getAsDouble();
    }

    public static Double max(double[] values) {
        return values.length == 0 ? null : Arrays.stream(values).max().getAsDouble();
    }

    public static double sum(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum;
    }

    /** Plain decimal text without trailing zeros ({@code 5.0} prints as {@code 5}). */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        BigDecimal d = BigDecimal.valueOf(value);
        return d.signum() == 0 ? "0" : d.stripTrailingZeros().toPlainString();
    }
}
