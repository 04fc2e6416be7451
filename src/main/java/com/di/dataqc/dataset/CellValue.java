package com.di.dataqc.dataset;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Tagged scalar held in a {@link Dataset} cell.
 * <p>
 * The kind is fixed when the value enters the system, so comparison code dispatches on {@link Kind}
 * instead of probing runtime types. Numbers are kept as {@code Long}, {@code Double} or {@code BigDecimal};
 * temporal values as {@link LocalDate} or {@link LocalDateTime}.
 */
public final class CellValue {

    public enum Kind {
        NULL,
        NUMBER,
        BOOLEAN,
        DATE,
        TEXT
    }

    private static final CellValue NULL = new CellValue(Kind.NULL, null);
    private static final CellValue TRUE = new CellValue(Kind.BOOLEAN, Boolean.TRUE);
    private static final CellValue FALSE = new CellValue(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object value;

    private CellValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static CellValue nullValue() {
        return NULL;
    }

    public static CellValue text(String text) {
        return text == null ? NULL : new CellValue(Kind.TEXT, text);
    }

    public static CellValue bool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static CellValue number(long n) {
        return new CellValue(Kind.NUMBER, n);
    }

    public static CellValue number(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return NULL;
        }
        return new CellValue(Kind.NUMBER, d);
    }

    public static CellValue date(LocalDate date) {
        return date == null ? NULL : new CellValue(Kind.DATE, date);
    }

    public static CellValue dateTime(LocalDateTime dateTime) {
        return dateTime == null ? NULL : new CellValue(Kind.DATE, dateTime);
    }

    /**
     * Wraps an arbitrary Java value, normalizing numeric and temporal types.
     * Strings are kept as text; use {@link TypeConverter#inferCell(String)} to type raw text.
     */
    public static CellValue of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof CellValue) {
            return (CellValue) raw;
        }
        if (raw instanceof String) {
            return text((String) raw);
        }
        if (raw instanceof Boolean) {
            return bool((Boolean) raw);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return number(((Number) raw).longValue());
        }
        if (raw instanceof Float || raw instanceof Double) {
            return number(((Number) raw).doubleValue());
        }
        if (raw instanceof BigInteger) {
            return new CellValue(Kind.NUMBER, new BigDecimal((BigInteger) raw));
        }
        if (raw instanceof BigDecimal) {
            return new CellValue(Kind.NUMBER, raw);
        }
        if (raw instanceof Number) {
            return number(((Number) raw).doubleValue());
        }
        if (raw instanceof LocalDate) {
            return date((LocalDate) raw);
        }
        if (raw instanceof LocalDateTime) {
            return dateTime((LocalDateTime) raw);
        }
        if (raw instanceof java.sql.Timestamp) {
            return dateTime(((java.sql.Timestamp) raw).toLocalDateTime());
        }
        if (raw instanceof java.sql.Date) {
            return date(((java.sql.Date) raw).toLocalDate());
        }
        if (raw instanceof java.util.Date) {
            return dateTime(LocalDateTime.ofInstant(((java.util.Date) raw).toInstant(), ZoneOffset.UTC));
        }
        if (raw instanceof Instant) {
            return dateTime(LocalDateTime.ofInstant((Instant) raw, ZoneOffset.UTC));
        }
        if (raw instanceof OffsetDateTime) {
            return dateTime(((OffsetDateTime) raw).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (raw instanceof ZonedDateTime) {
            return dateTime(((ZonedDateTime) raw).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        return text(raw.toString());
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isDate() {
        return kind == Kind.DATE;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    public boolean isBoolean() {
        return kind == Kind.BOOLEAN;
    }

    /** True for integral numbers ({@code 3}, {@code 3.0}). */
    public boolean isIntegral() {
        if (kind != Kind.NUMBER) {
            return false;
        }
        if (value instanceof Long) {
            return true;
        }
        BigDecimal d = asDecimal();
        return d.signum() == 0 || d.stripTrailingZeros().scale() <= 0;
    }

    public double asDouble() {
        requireKind(Kind.NUMBER);
        return ((Number) value).doubleValue();
    }

    /** Exact decimal form; doubles go through their shortest decimal representation. */
    public BigDecimal asDecimal() {
        requireKind(Kind.NUMBER);
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Long) {
            return BigDecimal.valueOf((Long) value);
        }
        return BigDecimal.valueOf(((Number) value).doubleValue());
    }

    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) value;
    }

    /** Temporal value at minute precision or better; plain dates map to midnight. */
    public LocalDateTime asDateTime() {
        requireKind(Kind.DATE);
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        return (LocalDateTime) value;
    }

    /**
     * Canonical string form: empty for null, plain decimal notation without trailing zeros for numbers,
     * ISO-8601 for dates (date only when the time is midnight).
     */
    public String asText() {
        switch (kind) {
            case NULL:
                return "";
            case NUMBER:
                if (value instanceof Long) {
                    return value.toString();
                }
                BigDecimal d = asDecimal();
                return d.signum() == 0 ? "0" : d.stripTrailingZeros().toPlainString();
            case DATE:
                if (value instanceof LocalDate) {
                    return value.toString();
                }
                LocalDateTime dt = (LocalDateTime) value;
                return dt.toLocalTime().equals(LocalTime.MIDNIGHT) ? dt.toLocalDate().toString() : dt.toString();
            default:
                return value.toString();
        }
    }

    /** JSON-safe plain value for transport: {@code null}, Number, Boolean or String. */
    public Object toPlain() {
        switch (kind) {
            case NULL:
                return null;
            case NUMBER:
                if (value instanceof BigDecimal) {
                    return ((BigDecimal) value).doubleValue();
                }
                return value;
            case BOOLEAN:
                return value;
            default:
                return asText();
        }
    }

    public Object raw() {
        return value;
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Cell is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        if (kind != other.kind) {
            return false;
        }
        if (kind == Kind.NUMBER) {
            return asDecimal().compareTo(other.asDecimal()) == 0;
        }
        if (kind == Kind.DATE) {
            return asDateTime().equals(other.asDateTime());
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (kind == Kind.NUMBER || kind == Kind.DATE) {
            return Objects.hash(kind, asText());
        }
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.NULL ? "null" : asText();
    }
}
