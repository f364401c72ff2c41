/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.util;

import java.util.Locale;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

public final class StringUtil {

    // Some cameras emit "0" or "00" for missing sub-second or time fields.
    private static final Pattern ONLY_ZEROS = Pattern.compile("^0+$");

    private StringUtil() {
        // util
    }

    public static boolean isBlank(@Nullable Object value) {
        return value == null || value.toString().isBlank();
    }

    public static boolean isNotBlank(@Nullable Object value) {
        return !isBlank(value);
    }

    /// @return the trimmed string, or `null` if it is `null` or blank
    public static @Nullable String toNotBlank(@Nullable Object value) {
        if (value == null) {
            return null;
        }

        final String trimmed = value.toString().trim();

        return trimmed.isEmpty() ? null : trimmed;
    }

    /// @return `""` for `null`, otherwise the string representation
    public static String toS(@Nullable Object value) {
        return value == null ? "" : value.toString();
    }

    public static boolean isOnlyZeros(@Nullable String value) {
        return value != null && ONLY_ZEROS.matcher(value.trim()).matches();
    }

    public static String pad2(int value) {
        return String.format(Locale.ROOT, "%02d", value);
    }

    public static String pad4(int value) {
        return String.format(Locale.ROOT, "%04d", value);
    }
}
