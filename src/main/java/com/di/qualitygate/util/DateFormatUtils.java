package com.di.qualitygate.util;

import com.di.qualitygate.rules.UnparsableValueException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;

/**
 * Date parsing for untyped staging values.
 */
public final class DateFormatUtils {

    /**
     * Patterns accepted for free-form date columns, tried in order. Day-first and
     * month-first layouts are not accepted.
     */
    private static final List<DateTimeFormatter> KNOWN_PATTERNS = List.of(
            strict("uuuu-MM-dd"),   // ISO standard
            strict("uuuuMMdd"),     // compact
            strict("uuuu/MM/dd"),   // logs
            strict("uuuu.MM.dd")    // legacy systems
    );

    private static final DateTimeFormatter COMPACT = strict("uuuuMMdd");
    private static final int COMPACT_LENGTH = 8;

    private DateFormatUtils() {
    }

    /**
     * Parses a free-form date column. A time part after the date
     * ({@code 2021-01-01 00:00:00}, {@code 2021-01-01T10:15}) is ignored.
     *
     * @return the date, or null when the value is null or blank
     * @throws UnparsableValueException when no known pattern matches
     */
    public static LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String candidate = stripTime(value.trim());
        for (DateTimeFormatter formatter : KNOWN_PATTERNS) {
            try {
                return LocalDate.parse(candidate, formatter);
            } catch (DateTimeParseException ignored) {
                // try the next pattern
            }
        }
        throw new UnparsableValueException(field, value, "DATE");
    }

    /**
     * Parses a date stored as a fixed-width {@code yyyyMMdd} number.
     * A value that is not exactly eight characters long, or that is zero or
     * negative, is a known placeholder and maps to null.
     *
     * @throws UnparsableValueException when an eight-character value is not
     *         numeric or not a calendar date (e.g. {@code 2010AB29}, {@code 20211345})
     */
    public static LocalDate parseCompactDate(String field, String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() != COMPACT_LENGTH) {
            return null;
        }
        long numeric;
        try {
            numeric = Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            throw new UnparsableValueException(field, value, "yyyyMMdd DATE", e);
        }
        if (numeric <= 0) {
            return null;
        }
        try {
            return LocalDate.parse(trimmed, COMPACT);
        } catch (DateTimeParseException e) {
            throw new UnparsableValueException(field, value, "yyyyMMdd DATE", e);
        }
    }

    private static String stripTime(String value) {
        if (value.length() > 10 && (value.charAt(10) == ' ' || value.charAt(10) == 'T')) {
            return value.substring(0, 10);
        }
        return value;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
