package com.di.qualitygate.util;

import com.di.qualitygate.rules.UnparsableValueException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Numeric and code conversions for untyped staging values.
 * All methods take the trimmed text (null when blank) and the column name used
 * in error reports.
 */
public final class TypeConverter {

    /** Scale of every monetary column in the cleansed store ({@code DECIMAL(18,2)}). */
    public static final int MONEY_SCALE = 2;

    private TypeConverter() {
    }

    public static Integer toInteger(String field, String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new UnparsableValueException(field, value, "INTEGER", e);
        }
    }

    /**
     * Reads a monetary amount, rounded to {@link #MONEY_SCALE} decimals.
     */
    public static BigDecimal toMoney(String field, String value) {
        if (value == null) {
            return null;
        }
        try {
            return money(new BigDecimal(value));
        } catch (NumberFormatException | ArithmeticException e) {
            throw new UnparsableValueException(field, value, "DECIMAL(18,2)", e);
        }
    }

    public static BigDecimal money(BigDecimal amount) {
        return amount == null ? null : amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /** Upper-cased code for case-insensitive lookups, or null. */
    public static String code(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }
}
