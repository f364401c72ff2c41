/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.time;

import de.bmarwell.home.exif.normalizer.util.NumberUtil;
import de.bmarwell.home.exif.normalizer.util.StringUtil;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/// Zone normalization and extraction of zones from raw tag values.
///
/// Canonical zone names are `UTC`, `UTC+7`, `UTC-5:30` or an IANA id like `America/Los_Angeles`.
public final class Zones {

    /// Offsets in use in the tz database within the last 50 years.
    private static final List<String> VALID_OFFSETS = List.of(
            "-11:00",
            "-10:00",
            "-09:30",
            "-09:00",
            "-08:30",
            "-08:00",
            "-07:00",
            "-06:00",
            "-05:00",
            "-04:30",
            "-04:00",
            "-03:30",
            "-03:00",
            "-02:30",
            "-02:00",
            "-01:00",
            "+00:00",
            "+01:00",
            "+02:00",
            "+03:00",
            "+03:30",
            "+04:00",
            "+04:30",
            "+05:00",
            "+05:30",
            "+05:45",
            "+06:00",
            "+06:30",
            "+07:00",
            "+07:30",
            "+08:00",
            "+08:30",
            "+08:45",
            "+09:00",
            "+09:30",
            "+09:45",
            "+10:00",
            "+10:30",
            "+11:00",
            "+12:00",
            "+12:45",
            "+13:45",
            "+14:00");

    private static final Set<Long> VALID_OFFSET_MINUTES =
            VALID_OFFSETS.stream().map(Zones::offsetToMinutes).collect(Collectors.toUnmodifiableSet());

    // 15 minute offsets are often spurious for old GPS fixes, so heuristics snap to half hours.
    private static final List<Long> LIKELY_OFFSET_MINUTES = VALID_OFFSETS.stream()
            .filter(offset -> offset.endsWith(":00") || offset.endsWith(":30"))
            .map(Zones::offsetToMinutes)
            .toList();

    private static final long MAX_OFFSET_SECONDS = 14 * 60 * 60;

    private static final Set<String> UTC_NAMES =
            Set.of("UTC", "GMT", "Z", "+0", "+00:00", "UTC+0", "GMT+0", "UTC+00:00");

    private static final Pattern ZULU_PREFIX = Pattern.compile("^(?:Zulu|Z|GMT)(?:\\b|$)");

    private static final Pattern IANA_FORMAT = Pattern.compile("^\\w{2,15}(?:/[\\w+-]{2,30}){0,2}$");

    private static final Pattern FIXED_FORMAT =
            Pattern.compile("^UTC(?<sign>[+-])(?<hours>\\d{1,2})(?::(?<minutes>\\d\\d))?$");

    private static final Pattern TRAILING_UTC = Pattern.compile("[.\\d\\s](?:UTC|Z)$");

    /// Time zone abbreviations like `AT`, `PST` or `WEST` are never trusted.
    private static final Pattern TRAILING_TZA = Pattern.compile("\\s[a-zA-Z]{2,5}$");

    private static final Pattern TRAILING_OFFSET = Pattern.compile(
            "(?:(?<z>Z|UTC)|(?:UTC)?(?<sign>[+-])(?<hours>\\d\\d?)(?::(?<minutes>\\d\\d))?)$");

    private Zones() {
        // util
    }

    private static long offsetToMinutes(String offset) {
        final long hours = Long.parseLong(offset.substring(1, 3));
        final long minutes = Long.parseLong(offset.substring(4, 6));
        final long total = hours * 60 + minutes;

        return offset.charAt(0) == '-' ? -total : total;
    }

    public static boolean isValidOffsetMinutes(long offsetMinutes) {
        return VALID_OFFSET_MINUTES.contains(offsetMinutes);
    }

    /// @return e.g. `UTC`, `UTC+7`, `UTC-9:30`, or `null` if the offset is not in use
    public static @Nullable String offsetMinutesToZoneName(long offsetMinutes) {
        if (!isValidOffsetMinutes(offsetMinutes)) {
            return null;
        }

        if (offsetMinutes == 0) {
            return "UTC";
        }

        final String sign = offsetMinutes < 0 ? "-" : "+";
        final long abs = Math.abs(offsetMinutes);
        final long hours = abs / 60;
        final long minutes = abs % 60;

        return "UTC" + sign + hours + (minutes == 0 ? "" : ":" + StringUtil.pad2((int) minutes));
    }

    /// @return the fixed zone for the given offset, or `null` if the offset is not in use
    public static @Nullable ZoneOffset offsetMinutesToZone(long offsetMinutes) {
        if (!isValidOffsetMinutes(offsetMinutes)) {
            return null;
        }

        return offsetMinutes == 0 ? ZoneOffset.UTC : ZoneOffset.ofTotalSeconds((int) offsetMinutes * 60);
    }

    /// @return `±HH:MM`, e.g. `+00:00` or `-07:00`
    public static String formatOffset(int offsetMinutes) {
        final int abs = Math.abs(offsetMinutes);

        return (offsetMinutes < 0 ? "-" : "+") + StringUtil.pad2(abs / 60) + ":" + StringUtil.pad2(abs % 60);
    }

    /// The canonical name of an already normalized zone.
    public static String zoneName(ZoneId zone) {
        if (zone instanceof ZoneOffset offset) {
            final String name = offsetMinutesToZoneName(offset.getTotalSeconds() / 60);
            return name != null ? name : "UTC" + offset.getId();
        }

        return zone.getId();
    }

    /**
     * Parses a zone name.
     *
     * <p>Accepts IANA names ({@code America/Los_Angeles}, {@code Japan}), {@code UTC±H[:MM]} with an offset in
     * use, and {@code Z}, {@code Zulu} and {@code GMT} as synonyms for {@code UTC}.</p>
     *
     * @param input the zone name, may be {@code null}
     * @return the normalized zone, or {@code null} if the input is blank or not a zone name
     */
    public static @Nullable ZoneId normalizeZone(@Nullable String input) {
        if (StringUtil.isBlank(input)) {
            return null;
        }

        final String name = ZULU_PREFIX.matcher(input.trim()).replaceFirst("UTC");

        final Matcher fixed = FIXED_FORMAT.matcher(name);
        if (fixed.matches()) {
            return offsetMinutesToZone(toOffsetMinutes(fixed));
        }

        if (!IANA_FORMAT.matcher(name).matches()) {
            return null;
        }

        try {
            return normalizeZone(ZoneId.of(name));
        } catch (DateTimeException dte) {
            return null;
        }
    }

    /// Collapses fixed-offset regions (`UTC`, `Etc/GMT+5`) to their [ZoneOffset].
    ///
    /// @return the normalized zone, or `null` for offsets that are not in use
    public static @Nullable ZoneId normalizeZone(@Nullable ZoneId zone) {
        if (zone == null) {
            return null;
        }

        final ZoneId normalized = zone.normalized();
        if (normalized instanceof ZoneOffset offset) {
            if (offset.getTotalSeconds() % 60 != 0) {
                return null;
            }

            return offsetMinutesToZone(offset.getTotalSeconds() / 60);
        }

        final ZoneOffset current = normalized.getRules().getOffset(Instant.now());
        return Math.abs(current.getTotalSeconds()) <= MAX_OFFSET_SECONDS ? normalized : null;
    }

    /// Whether the given zone, zone name or hour offset means UTC.
    public static boolean isUtc(@Nullable Object zone) {
        if (zone == null) {
            return false;
        }

        if (zone instanceof ZoneId zoneId) {
            return ZoneOffset.UTC.equals(zoneId.normalized());
        }

        if (zone instanceof ExtractedZone extracted) {
            return isUtc(extracted.zone());
        }

        if (zone instanceof Number number) {
            return number.doubleValue() == 0;
        }

        return UTC_NAMES.contains(zone.toString().trim().toUpperCase(Locale.ROOT));
    }

    /// Snaps the difference between a local and a UTC timestamp to the closest whole or half hour offset.
    ///
    /// @param deltaMinutes local minus UTC
    /// @return the likely offset, or the (rounded) delta itself if it is more than a day
    public static long inferLikelyOffsetMinutes(double deltaMinutes) {
        if (Math.abs(deltaMinutes) > 24 * 60) {
            return Math.round(deltaMinutes);
        }

        long best = LIKELY_OFFSET_MINUTES.get(0);
        for (final long candidate : LIKELY_OFFSET_MINUTES) {
            if (Math.abs(candidate - deltaMinutes) < Math.abs(best - deltaMinutes)) {
                best = candidate;
            }
        }

        return best;
    }

    public static @Nullable ExtractedZone extractZone(@Nullable Object value) {
        return extractZone(value, true);
    }

    /**
     * Finds a zone in a raw tag value.
     *
     * <p>Numbers are hour offsets. Lists contribute their first non-null element. Strings may be a zone name
     * or end in {@code Z}, {@code UTC} or an offset like {@code +02:00}, {@code -7} or {@code UTC+5:30}.
     * Date-only values, booleans and binary values never carry a zone.</p>
     *
     * @param value the raw tag value
     * @param stripTza whether to remove a trailing time zone abbreviation like {@code PST} first
     * @return the zone, or {@code null} if the value does not carry one
     */
    public static @Nullable ExtractedZone extractZone(@Nullable Object value, boolean stripTza) {
        if (value == null || value instanceof Boolean || value instanceof byte[] || value instanceof PartialDate) {
            return null;
        }

        if (value instanceof List<?> list) {
            return list.stream()
                    .filter(element -> element != null)
                    .findFirst()
                    .map(first -> extractZone(first, stripTza))
                    .orElse(null);
        }

        if (value instanceof DateTimeWithZone dateTime) {
            final ZoneId zone = dateTime.zone();
            return zone == null ? null : ExtractedZone.of(zone, null, "DateTimeWithZone.zone");
        }

        if (value instanceof Number hours) {
            return extractHourOffset(hours);
        }

        if (!(value instanceof String text) || text.isBlank()) {
            return null;
        }

        final ZoneId direct = normalizeZone(text);
        if (direct != null) {
            return ExtractedZone.of(direct, null, "normalizeZone");
        }

        String str = text.trim();
        if (stripTza) {
            str = stripTimeZoneAbbreviation(str);
        }

        if (str.isBlank()) {
            return null;
        }

        final ZoneId stripped = normalizeZone(str);
        if (stripped != null) {
            return ExtractedZone.of(stripped, null, "normalizeZone");
        }

        final Matcher matcher = TRAILING_OFFSET.matcher(str);
        if (!matcher.find()) {
            return null;
        }

        final String leftovers = str.substring(0, matcher.start()).trim();
        if (matcher.group("z") != null) {
            return ExtractedZone.of(ZoneOffset.UTC, leftovers, "Z");
        }

        final ZoneOffset offset = offsetMinutesToZone(toOffsetMinutes(matcher));
        return offset == null ? null : ExtractedZone.of(offset, leftovers, "offsetMinutesToZoneName");
    }

    /// Removes a trailing abbreviation like ` PST`, unless the value ends in `UTC` or `Z`.
    public static String stripTimeZoneAbbreviation(String value) {
        if (TRAILING_UTC.matcher(value).find()) {
            return value;
        }

        return TRAILING_TZA.matcher(value).replaceFirst("");
    }

    private static @Nullable ExtractedZone extractHourOffset(Number hours) {
        if (!NumberUtil.isNumber(hours)) {
            return null;
        }

        final double minutes = hours.doubleValue() * 60;
        if (minutes != Math.rint(minutes)) {
            return null;
        }

        final ZoneOffset offset = offsetMinutesToZone((long) minutes);
        return offset == null ? null : ExtractedZone.of(offset, null, "hourOffset");
    }

    private static long toOffsetMinutes(Matcher matcher) {
        final String minutes = matcher.group("minutes");
        final long total = Long.parseLong(matcher.group("hours")) * 60 + (minutes == null ? 0 : Long.parseLong(minutes));

        return "-".equals(matcher.group("sign")) ? -total : total;
    }
}
