/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.time;

import de.bmarwell.home.exif.normalizer.util.StringUtil;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses raw date-time tag values by trying an ordered list of {@link DateTimeLayout}s.
 *
 * <p>Before matching, a trailing time zone abbreviation is removed and a trailing offset is extracted with
 * {@link Zones#extractZone(Object, boolean)}. Strict layouts are always tried before loose ones.</p>
 */
public final class DateTimeParser {

    private static final Logger LOG = LoggerFactory.getLogger(DateTimeParser.class);

    private static final Pattern DIGITS_ONLY = Pattern.compile("^\\d+$");

    // a four digit year, so times like 12:05:09 are never read as dates
    private static final Pattern STRICT_DATE = Pattern.compile("^\\d{4}:\\d+:\\d+$|^\\d{4}-\\d+-\\d+$");

    // e.g. "Apr 9 2018"
    private static final Pattern LOOSE_DATE = Pattern.compile("^\\S+\\s+\\S+\\s+\\S+$");

    private static final List<DateTimeFormatter> STRICT_DATE_FORMATS =
            List.of(dateFormatter("u:MM:dd"), dateFormatter("u-MM-dd"), dateFormatter("u:M:d"));

    private static final List<DateTimeFormatter> LOOSE_DATE_FORMATS =
            List.of(dateFormatter("MMM d u"), dateFormatter("MMMM d u"));

    private static final DateTimeFormatter TIME_WITH_FRACTION = new DateTimeFormatterBuilder()
            .appendPattern("HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter TIME =
            DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeParser EXIF = new DateTimeParser(layouts(null, true));

    private static final DateTimeParser STRICT = new DateTimeParser(layouts(null, false));

    private static final DateTimeParser UTC = new DateTimeParser(layouts(ZoneOffset.UTC, true));

    private final List<DateTimeLayout> layouts;

    public DateTimeParser(List<DateTimeLayout> layouts) {
        this.layouts = List.copyOf(layouts);
    }

    private static List<DateTimeLayout> layouts(@Nullable ZoneId fixedZone, boolean loose) {
        final List<DateTimeLayout> result = new ArrayList<>();
        result.addAll(DateTimeLayout.timeLayouts(DateTimeLayout.EXIF_DATE_PREFIXES, fixedZone));
        result.addAll(DateTimeLayout.timeLayouts(DateTimeLayout.ISO_DATE_PREFIXES, fixedZone));
        if (loose) {
            result.addAll(DateTimeLayout.looseLayouts(fixedZone));
        }

        return result;
    }

    private static DateTimeFormatter dateFormatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    /// Native, ISO and loose layouts.
    public static DateTimeParser exif() {
        return EXIF;
    }

    /// Native and ISO layouts only.
    public static DateTimeParser strict() {
        return STRICT;
    }

    /// All layouts, with every value put into UTC. For tags like `GPSDateTime`.
    public static DateTimeParser utc() {
        return UTC;
    }

    public List<DateTimeLayout> layouts() {
        return this.layouts;
    }

    public @Nullable DateTimeWithZone parse(@Nullable String text) {
        return parse(text, null);
    }

    /**
     * Parses a date and time.
     *
     * @param text the raw value, e.g. {@code 2014:07:17 08:46:27-07:00 DST}
     * @param defaultZone the zone for values without one; the result then reports
     *     {@link DateTimeWithZone#inferredZone()}
     * @return the value, or {@code null} if no layout matches or the value is a known placeholder
     */
    public @Nullable DateTimeWithZone parse(@Nullable String text, @Nullable ZoneId defaultZone) {
        final String trimmed = StringUtil.toNotBlank(text);
        if (trimmed == null || StringUtil.isOnlyZeros(trimmed) || DIGITS_ONLY.matcher(trimmed).matches()) {
            return null;
        }

        final String withoutTza = Zones.stripTimeZoneAbbreviation(trimmed);
        final ExtractedZone extracted = Zones.extractZone(withoutTza, false);
        final String input =
                extracted != null && extracted.leftovers() != null ? extracted.leftovers() : withoutTza;
        final ZoneId fallbackZone = Zones.normalizeZone(defaultZone);

        for (final DateTimeLayout layout : this.layouts) {
            final LocalDateTime parsed = layout.parse(input);
            if (parsed == null) {
                continue;
            }

            LOG.debug("Parsed [{}] with layout [{}].", trimmed, layout.pattern());

            final Integer millisecond =
                    layout.millisecondsPresent() ? FractionalSeconds.toMillisecond(parsed.getNano()) : null;

            if (layout.fixedZone() != null) {
                final LocalDateTime local = extracted == null
                        ? parsed
                        : parsed.atZone(extracted.zone())
                                .withZoneSameInstant(layout.fixedZone())
                                .toLocalDateTime();
                return DateTimeWithZone.of(local, millisecond, layout.fixedZone(), trimmed, false);
            }

            if (extracted != null) {
                return DateTimeWithZone.of(parsed, millisecond, extracted.zone(), trimmed, false);
            }

            return DateTimeWithZone.of(parsed, millisecond, fallbackZone, trimmed, fallbackZone != null);
        }

        return null;
    }

    /**
     * Parses a date without time, e.g. {@code 2018:04:09}, {@code 2018-04-09} or {@code Apr 9 2018}.
     *
     * @param text the raw value
     * @return the date, or {@code null} if it is not a date or a known placeholder
     */
    public static @Nullable PartialDate parseDate(@Nullable String text) {
        final String trimmed = StringUtil.toNotBlank(text);
        if (trimmed == null || StringUtil.isOnlyZeros(trimmed)) {
            return null;
        }

        final List<DateTimeFormatter> formats;
        if (STRICT_DATE.matcher(trimmed).matches()) {
            formats = STRICT_DATE_FORMATS;
        } else if (LOOSE_DATE.matcher(trimmed).matches()) {
            formats = LOOSE_DATE_FORMATS;
        } else {
            return null;
        }

        for (final DateTimeFormatter format : formats) {
            final LocalDate date = tryParse(format, trimmed, LocalDate::from);
            if (date == null) {
                continue;
            }

            if (date.getYear() == 0 || date.getYear() == 1 || date.toEpochDay() == 0) {
                return null;
            }

            return PartialDate.of(date);
        }

        return null;
    }

    /**
     * Parses a time of day without date, e.g. {@code 23:59:41.001}.
     *
     * @param text the raw value
     * @return the time, or {@code null} if it is not a time
     */
    public static @Nullable PartialTime parseTime(@Nullable String text) {
        final String trimmed = StringUtil.toNotBlank(text);
        if (trimmed == null || StringUtil.isOnlyZeros(trimmed)) {
            return null;
        }

        final LocalTime withFraction = tryParse(TIME_WITH_FRACTION, trimmed, LocalTime::from);
        if (withFraction != null) {
            return new PartialTime(
                    withFraction.getHour(),
                    withFraction.getMinute(),
                    withFraction.getSecond(),
                    FractionalSeconds.toMillisecond(withFraction.getNano()));
        }

        final LocalTime time = tryParse(TIME, trimmed, LocalTime::from);
        return time == null ? null : new PartialTime(time.getHour(), time.getMinute(), time.getSecond(), null);
    }

    private static <T> @Nullable T tryParse(DateTimeFormatter formatter, String text, TemporalQuery<T> query) {
        try {
            return formatter.parse(text, query);
        } catch (DateTimeParseException dtpe) {
            return null;
        }
    }
}
