package com.di.dataqc.dataset;

import com.di.dataqc.util.DateFormatUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.sql.Clob;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Converts raw source values (CSV text, JDBC objects) into typed {@link CellValue}s and resolves
 * column types from the resulting cells.
 * <p>
 * Text handling follows what analysts expect from spreadsheet-like tools:
 * <ul>
 *   <li>empty strings and common null markers ({@code NA}, {@code N/A}, {@code null}, {@code NaN}) become null</li>
 *   <li>integral text becomes a {@code Long} (a {@code BigDecimal} past the long range), decimal text a {@code Double}</li>
 *   <li>{@code true}/{@code false} in any case become booleans</li>
 *   <li>dates and datetimes in the patterns of {@link DateFormatUtils} become temporal cells</li>
 * </ul>
 */
@Slf4j
public final class TypeConverter {

    private TypeConverter() {
        // Utility class - prevent instantiation
    }

    private static final Set<String> NULL_MARKERS = Set.of(
            "", "NA", "N/A", "n/a", "NaN", "nan", "NULL", "null", "None", "#N/A");

    private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    /**
     * Types a single raw text value.
     */
    public static CellValue inferCell(String raw) {
        if (raw == null) {
            return CellValue.nullValue();
        }
        String text = raw.trim();
        if (NULL_MARKERS.contains(text)) {
            return CellValue.nullValue();
        }
        CellValue number = parseNumber(text);
        if (number != null) {
            return number;
        }
        if ("true".equalsIgnoreCase(text)) {
            return CellValue.bool(true);
        }
        if ("false".equalsIgnoreCase(text)) {
            return CellValue.bool(false);
        }
        if (DateFormatUtils.hasTimeComponent(text)) {
            return DateFormatUtils.parseDateTime(text).map(CellValue::dateTime).orElse(CellValue.text(raw));
        }
        Optional<java.time.LocalDate> date = DateFormatUtils.parseDate(text);
        if (date.isPresent()) {
            return CellValue.date(date.get());
        }
        return CellValue.text(raw);
    }

    /**
     * Converts a JDBC result value. Large objects are read fully; unknown types fall back to their string form.
     */
    public static CellValue fromJdbc(Object value, String columnName) {
        if (value == null) {
            return CellValue.nullValue();
        }
        if (value instanceof Clob) {
            return CellValue.text(readClob((Clob) value, columnName));
        }
        if (value instanceof byte[]) {
            return CellValue.text(new String((byte[]) value, java.nio.charset.StandardCharsets.UTF_8));
        }
        if (value instanceof UUID) {
            return CellValue.text(value.toString());
        }
        if (value instanceof java.sql.Time) {
            return CellValue.text(value.toString());
        }
        return CellValue.of(value);
    }

    /**
     * Coerces a cell to a number: numbers pass through, numeric text is parsed, anything else is null.
     */
    public static CellValue toNumber(CellValue cell) {
        if (cell.isNumber()) {
            return cell;
        }
        if (cell.isText()) {
            CellValue parsed = parseNumber(cell.asText().trim());
            return parsed != null ? parsed : CellValue.nullValue();
        }
        return CellValue.nullValue();
    }

    /**
     * Coerces a cell to a datetime when possible; text goes through the lenient date parser.
     */
    public static Optional<LocalDateTime> toDateTime(CellValue cell) {
        if (cell.isDate()) {
            return Optional.of(cell.asDateTime());
        }
        if (cell.isText()) {
            return DateFormatUtils.parseDateTimeLenient(cell.asText());
        }
        return Optional.empty();
    }

    /**
     * Resolves the logical type of a column from its cells. Nulls are ignored; an all-null column is STRING.
     */
    public static ColumnType inferColumnType(List<CellValue> cells) {
        boolean sawInteger = false;
        boolean sawFloat = false;
        boolean sawBoolean = false;
        boolean sawDate = false;
        boolean sawDateTime = false;
        boolean sawText = false;
        for (CellValue cell : cells) {
            switch (cell.kind()) {
                case NULL:
                    break;
                case NUMBER:
                    if (cell.raw() instanceof Long) {
                        sawInteger = true;
                    } else {
                        sawFloat = true;
                    }
                    break;
                case BOOLEAN:
                    sawBoolean = true;
                    break;
                case DATE:
                    if (cell.raw() instanceof java.time.LocalDate) {
                        sawDate = true;
                    } else {
                        sawDateTime = true;
                    }
                    break;
                default:
                    sawText = true;
                    break;
            }
        }
        boolean numeric = sawInteger || sawFloat;
        boolean temporal = sawDate || sawDateTime;
        int families = (numeric ? 1 : 0) + (sawBoolean ? 1 : 0) + (temporal ? 1 : 0) + (sawText ? 1 : 0);
        if (families == 0) {
            return ColumnType.STRING;
        }
        if (families > 1) {
            return ColumnType.MIXED;
        }
        if (numeric) {
            return sawFloat ? ColumnType.FLOAT : ColumnType.INTEGER;
        }
        if (sawBoolean) {
            return ColumnType.BOOLEAN;
        }
        if (temporal) {
            return sawDateTime ? ColumnType.DATETIME : ColumnType.DATE;
        }
        return ColumnType.STRING;
    }

    /**
     * Maps a JDBC type name (from result set metadata) to a logical column type.
     */
    public static ColumnType fromSqlTypeName(String typeName) {
        if (typeName == null) {
            return ColumnType.MIXED;
        }
        String normalized = typeName.toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "int2":
            case "int4":
            case "int8":
            case "smallint":
            case "integer":
            case "bigint":
            case "serial":
            case "bigserial":
                return ColumnType.INTEGER;
            case "float4":
            case "float8":
            case "real":
            case "double precision":
            case "numeric":
            case "decimal":
            case "money":
                return ColumnType.FLOAT;
            case "bool":
            case "boolean":
                return ColumnType.BOOLEAN;
            case "date":
                return ColumnType.DATE;
            case "timestamp":
            case "timestamptz":
                return ColumnType.DATETIME;
            default:
                return ColumnType.STRING;
        }
    }

    private static CellValue parseNumber(String text) {
        if (text.isEmpty()) {
            return null;
        }
        if (INTEGER.matcher(text).matches()) {
            try {
                return CellValue.number(Long.parseLong(text.startsWith("+") ? text.substring(1) : text));
            } catch (NumberFormatException e) {
                return CellValue.of(new BigDecimal(text));
            }
        }
        if (DECIMAL.matcher(text).matches()) {
            return CellValue.number(Double.parseDouble(text));
        }
        return null;
    }

    private static String readClob(Clob clob, String columnName) {
        try (Reader reader = clob.getCharacterStream()) {
            StringBuilder sb = new StringBuilder();
            char[] buffer = new char[8192];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                sb.append(buffer, 0, read);
            }
            return sb.toString();
        } catch (SQLException | IOException e) {
            log.warn("[CONNECTOR] Failed to read CLOB column {}: {}", columnName, e.getMessage());
            throw new IllegalStateException("Failed to read CLOB column " + columnName, e);
        }
    }
}
