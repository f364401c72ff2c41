/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/// Lenient number parsing for raw tag values.
///
/// Tag values arrive either as JSON numbers or as strings, so every method here accepts
/// any object and returns `null` instead of throwing.
public final class NumberUtil {

    private static final Pattern FLOAT_PATTERN = Pattern.compile("^[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?$");

    private static final Pattern INT_PATTERN = Pattern.compile("^[+-]?\\d+$");

    private NumberUtil() {
        // util
    }

    /// Whether the given value is a finite number.
    public static boolean isNumber(@Nullable Object value) {
        if (value instanceof Double d) {
            return Double.isFinite(d);
        }

        if (value instanceof Float f) {
            return Float.isFinite(f);
        }

        return value instanceof Number;
    }

    /// Whether the given string is a plain (optionally signed, optionally exponential) decimal number.
    public static boolean isNumeric(@Nullable String value) {
        return value != null && FLOAT_PATTERN.matcher(value.trim()).matches();
    }

    /// Converts the given value to a double.
    ///
    /// @param value a [Number] or a string holding a plain decimal number
    /// @return the finite double value, or `null` if the value is missing or not a number
    public static @Nullable Double toDouble(@Nullable Object value) {
        if (value == null) {
            return null;
        }

        if (value instanceof Number number) {
            final double d = number.doubleValue();
            return Double.isFinite(d) ? d : null;
        }

        final String trimmed = value.toString().trim();
        if (!FLOAT_PATTERN.matcher(trimmed).matches()) {
            return null;
        }

        try {
            final double d = Double.parseDouble(trimmed);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException nfe) {
            return null;
        }
    }

    /// Converts the given value to an integer. Fractional numbers are floored.
    ///
    /// @param value a [Number] or a string holding a plain integer
    /// @return the integer value, or `null` if the value is missing, not an integer or out of range
    public static @Nullable Integer toInt(@Nullable Object value) {
        if (value == null) {
            return null;
        }

        if (value instanceof Number number) {
            final double d = Math.floor(number.doubleValue());
            if (!Double.isFinite(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
                return null;
            }
            return (int) d;
        }

        final String trimmed = value.toString().trim();
        if (!INT_PATTERN.matcher(trimmed).matches()) {
            return null;
        }

        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException nfe) {
            return null;
        }
    }

    /// Rounds half-up to the given number of decimal places.
    public static double roundToDecimalPlaces(double value, int places) {
        if (!Double.isFinite(value)) {
            return value;
        }

        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    /// Renders a number without exponent notation, e.g. for `1.0E-7`.
    public static String toPlainString(Number number) {
        if (number instanceof Double || number instanceof Float) {
            final double d = number.doubleValue();
            if (!Double.isFinite(d)) {
                return String.valueOf(d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }

        return number.toString();
    }
}
