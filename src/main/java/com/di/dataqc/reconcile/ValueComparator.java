package com.di.dataqc.reconcile;

import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.rule.ToleranceType;
import com.di.dataqc.util.DateFormatUtils;
import com.di.dataqc.util.Stats;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Typed comparison of two cells under a tolerance and match options.
 * <p>
 * Dispatch is on the cell kinds: nulls first, then number/number, then any pair that is temporal on both
 * sides (a date cell, or text in a known date format), and finally canonical text.
 */
public final class ValueComparator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ToleranceConfig tolerance;
    private final MatchOptions options;

    public ValueComparator(ToleranceConfig tolerance, MatchOptions options) {
        this.tolerance = tolerance;
        this.options = options;
    }

    public ValueComparison compare(CellValue left, CellValue right) {
        if (left.isNull() || right.isNull()) {
            return compareNulls(left, right);
        }
        if (left.isNumber() && right.isNumber()) {
            return compareNumbers(left.asDecimal(), right.asDecimal());
        }
        Optional<LocalDateTime> leftDate = temporal(left);
        Optional<LocalDateTime> rightDate = temporal(right);
        if (leftDate.isPresent() && rightDate.isPresent()) {
            return compareDates(leftDate.get(), rightDate.get());
        }
        return compareText(left.asText(), right.asText());
    }

    ValueComparison compareNulls(CellValue left, CellValue right) {
        if (left.isNull() && right.isNull()) {
            return options.isNullEqualsNull()
                    ? ValueComparison.MATCH
                    : new ValueComparison(ComparisonStatus.NULL_MISMATCH, "Both values are null");
        }
        return new ValueComparison(ComparisonStatus.NULL_MISMATCH,
                left.isNull() ? "Baseline value is null" : "Compared value is null");
    }

    ValueComparison compareNumbers(BigDecimal left, BigDecimal right) {
        BigDecimal difference = left.subtract(right).abs();
        BigDecimal allowed = BigDecimal.valueOf(tolerance.getNumeric());
        if (tolerance.getNumericType() == ToleranceType.PERCENTAGE) {
            BigDecimal magnitude = left.abs().max(right.abs());
            // diff / magnitude * 100 <= tol, rearranged to avoid dividing by zero
            if (difference.multiply(HUNDRED).compareTo(allowed.multiply(magnitude)) <= 0) {
                return ValueComparison.MATCH;
            }
            BigDecimal pct = difference.multiply(HUNDRED).divide(magnitude, MathContext.DECIMAL64);
            return new ValueComparison(ComparisonStatus.NUMERIC_MISMATCH, String.format(
                    "Difference %s%% exceeds tolerance %s%%",
                    Stats.format(Stats.round(pct.doubleValue(), 2)), Stats.format(tolerance.getNumeric())));
        }
        if (difference.compareTo(allowed) <= 0) {
            return ValueComparison.MATCH;
        }
        return new ValueComparison(ComparisonStatus.NUMERIC_MISMATCH, String.format(
                "Difference %s exceeds tolerance %s",
                plain(difference), Stats.format(tolerance.getNumeric())));
    }

    ValueComparison compareDates(LocalDateTime left, LocalDateTime right) {
        Duration delta = Duration.between(left, right).abs();
        double seconds = delta.getSeconds() + delta.getNano() / 1_000_000_000.0;
        if (seconds <= tolerance.getDateUnit().toSeconds(tolerance.getDate())) {
            return ValueComparison.MATCH;
        }
        return new ValueComparison(ComparisonStatus.DATE_MISMATCH, String.format(
                "Dates differ by %s %s (tolerance %s %s)",
                Stats.format(Stats.round(seconds / tolerance.getDateUnit().toSeconds(1), 2)),
                tolerance.getDateUnit().id(),
                Stats.format(tolerance.getDate()),
                tolerance.getDateUnit().id()));
    }

    ValueComparison compareText(String left, String right) {
        if (normalize(left).equals(normalize(right))) {
            return ValueComparison.MATCH;
        }
        return new ValueComparison(ComparisonStatus.STRING_MISMATCH, "Values differ");
    }

    private String normalize(String value) {
        String out = value;
        if (options.isIgnoreCase()) {
            out = out.toLowerCase(Locale.ROOT);
        }
        if (options.isIgnoreWhitespace()) {
            out = out.strip();
        }
        return out;
    }

    private static Optional<LocalDateTime> temporal(CellValue cell) {
        if (cell.isDate()) {
            return Optional.of(cell.asDateTime());
        }
        if (cell.isText()) {
            return DateFormatUtils.parseDateTime(cell.asText());
        }
        return Optional.empty();
    }

    private static String plain(BigDecimal value) {
        return value.signum() == 0 ? "0" : value.stripTrailingZeros().toPlainString();
    }

    /**
     * Status plus a human-readable detail; {@link #MATCH} carries no detail.
     */
    public record ValueComparison(ComparisonStatus status, String detail) {

        public static final ValueComparison MATCH = new ValueComparison(ComparisonStatus.MATCH, null);

        public boolean isMatch() {
            return status.isMatch();
        }
    }
}
