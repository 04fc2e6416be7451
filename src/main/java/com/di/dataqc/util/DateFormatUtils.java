package com.di.dataqc.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Parses date and datetime text in the formats analysts actually upload.
 */
public final class DateFormatUtils {

    private DateFormatUtils() {
    }

    private static final List<String> KNOWN_PATTERNS = Arrays.asList(
            "uuuu-MM-dd",   // ISO standard
            "dd/MM/uuuu",   // UK / EU
            "MM-dd-uuuu",   // US
            "uuuu/MM/dd",   // Logs
            "dd-MM-uuuu",   // Forms
            "MM/dd/uuuu",   // US alternate
            "dd.MM.uuuu",   // Central Europe
            "uuuu.MM.dd"    // Asia / Legacy systems
    );

    private static final List<String> DATETIME_PATTERNS = Arrays.asList(
            "uuuu-MM-dd HH:mm:ss",
            "uuuu-MM-dd HH:mm",
            "uuuu-MM-dd HH:mm:ss.SSS",
            "uuuu/MM/dd HH:mm:ss",
            "MM/dd/uuuu HH:mm:ss",
            "dd/MM/uuuu HH:mm:ss"
    );

    private static final String COMPACT_PATTERN = "uuuuMMdd";

    private static final List<DateTimeFormatter> DATE_FORMATTERS = compile(KNOWN_PATTERNS);
    private static final List<DateTimeFormatter> DATETIME_FORMATTERS = compile(DATETIME_PATTERNS);
    private static final DateTimeFormatter COMPACT_FORMATTER = DateTimeFormatter.ofPattern(COMPACT_PATTERN)
            .withResolverStyle(ResolverStyle.STRICT);

    private static List<DateTimeFormatter> compile(List<String> patterns) {
        return patterns.stream()
                .map(p -> DateTimeFormatter.ofPattern(p).withResolverStyle(ResolverStyle.STRICT))
                .collect(Collectors.toList());
    }

    /**
     * Parses a date-only value in any of the known patterns.
     */
    public static Optional<LocalDate> parseDate(String input) {
        if (!looksTemporal(input)) {
            return Optional.empty();
        }
        String text = input.trim();
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            LocalDate date = tryParseDate(text, formatter);
            if (date != null) {
                return Optional.of(date);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a datetime; date-only inputs resolve to midnight. ISO-8601 with offset is normalized to UTC.
     */
    public static Optional<LocalDateTime> parseDateTime(String input) {
        if (!looksTemporal(input)) {
            return Optional.empty();
        }
        String text = input.trim();
        Optional<LocalDateTime> dateTime = parseDateTimeOnly(text);
        if (dateTime.isPresent()) {
            return dateTime;
        }
        return parseDate(text).map(LocalDate::atStartOfDay);
    }

    /**
     * Like {@link #parseDateTime(String)} but also accepts the compact {@code yyyyMMdd} form.
     */
    public static Optional<LocalDateTime> parseDateTimeLenient(String input) {
        Optional<LocalDateTime> parsed = parseDateTime(input);
        if (parsed.isPresent() || input == null) {
            return parsed;
        }
        String text = input.trim();
        if (text.length() != COMPACT_PATTERN.length()) {
            return Optional.empty();
        }
        return Optional.ofNullable(tryParseDate(text, COMPACT_FORMATTER)).map(LocalDate::atStartOfDay);
    }

    /**
     * True when the text carries a time-of-day component and parses as a datetime.
     */
    public static boolean hasTimeComponent(String input) {
        return looksTemporal(input) && parseDateTimeOnly(input.trim()).isPresent();
    }

    private static Optional<LocalDateTime> parseDateTimeOnly(String text) {
        for (DateTimeFormatter formatter : DATETIME_FORMATTERS) {
            LocalDateTime dateTime = tryParseDateTime(text, formatter);
            if (dateTime != null) {
                return Optional.of(dateTime);
            }
        }
        LocalDateTime iso = tryParseDateTime(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        if (iso != null) {
            return Optional.of(iso);
        }
        try {
            return Optional.of(OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    .withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static LocalDate tryParseDate(String text, DateTimeFormatter formatter) {
        try {
            return LocalDate.parse(text, formatter);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDateTime tryParseDateTime(String text, DateTimeFormatter formatter) {
        try {
            return LocalDateTime.parse(text, formatter);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Cheap pre-check so free text never reaches the formatters. */
    private static boolean looksTemporal(String input) {
        if (input == null) {
            return false;
        }
        String text = input.trim();
        if (text.length() < 8 || text.length() > 35 || !Character.isDigit(text.charAt(0))) {
            return false;
        }
        int digits = 0;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isDigit(text.charAt(i))) {
                digits++;
            }
        }
        return digits >= 6;
    }
}
