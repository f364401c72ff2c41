/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.time;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * One textual date-time layout tried by {@link DateTimeParser}.
 *
 * @param pattern the {@link DateTimeFormatter} pattern, for logging
 * @param formatter the compiled, strict formatter
 * @param millisecondsPresent whether the layout reads sub-seconds
 * @param fixedZone a zone forced onto every value parsed with this layout
 */
public record DateTimeLayout(
        String pattern, DateTimeFormatter formatter, boolean millisecondsPresent, @Nullable ZoneId fixedZone) {

    /// Prefixes of the native `2014:07:17 08:46:27` form.
    static final List<String> EXIF_DATE_PREFIXES = List.of("u:MM:dd ", "u:M:d ");

    static final List<String> ISO_DATE_PREFIXES = List.of("u-MM-dd'T'", "u-MM-dd ", "u-M-d ");

    /// Forms seen in the wild, e.g. `Thu Oct 13 00:12:27 2016`.
    static final List<String> LOOSE_PATTERNS = List.of("MMM d u HH:mm:ss", "MMM d u, HH:mm:ss", "EEE MMM d HH:mm:ss u");

    /// A layout with an optional, variable length fraction after the seconds.
    static DateTimeLayout withFraction(String pattern, @Nullable ZoneId fixedZone) {
        final DateTimeFormatter formatter = new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);

        return new DateTimeLayout(pattern + ".S", formatter, true, fixedZone);
    }

    static DateTimeLayout of(String pattern, @Nullable ZoneId fixedZone) {
        final DateTimeFormatter formatter = new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);

        return new DateTimeLayout(pattern, formatter, false, fixedZone);
    }

    /// For each prefix: with sub-seconds, with seconds, with minutes only.
    static List<DateTimeLayout> timeLayouts(List<String> datePrefixes, @Nullable ZoneId fixedZone) {
        final List<DateTimeLayout> layouts = new ArrayList<>();
        for (final String prefix : datePrefixes) {
            layouts.add(withFraction(prefix + "HH:mm:ss", fixedZone));
            layouts.add(of(prefix + "HH:mm:ss", fixedZone));
            layouts.add(of(prefix + "HH:mm", fixedZone));
        }

        return List.copyOf(layouts);
    }

    static List<DateTimeLayout> looseLayouts(@Nullable ZoneId fixedZone) {
        return LOOSE_PATTERNS.stream().map(pattern -> of(pattern, fixedZone)).toList();
    }

    /// @return the wall clock, or `null` if the text does not match this layout
    @Nullable LocalDateTime parse(String text) {
        try {
            return this.formatter.parse(text, LocalDateTime::from);
        } catch (DateTimeParseException dtpe) {
            return null;
        }
    }
}
