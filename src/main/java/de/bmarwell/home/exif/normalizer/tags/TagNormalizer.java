/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tags;

import de.bmarwell.home.exif.normalizer.gps.GpsCoordinates;
import de.bmarwell.home.exif.normalizer.gps.GpsLocationTags;
import de.bmarwell.home.exif.normalizer.gps.GpsResult;
import de.bmarwell.home.exif.normalizer.time.DateTimeParser;
import de.bmarwell.home.exif.normalizer.time.DateTimeWithZone;
import de.bmarwell.home.exif.normalizer.time.PartialDate;
import de.bmarwell.home.exif.normalizer.tz.TimezoneContext;
import de.bmarwell.home.exif.normalizer.tz.TzOptions;
import de.bmarwell.home.exif.normalizer.tz.TzSource;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes the tags of one file.
 *
 * <p>The zone and the GPS position are resolved once. Every tag whose name mentions {@code Date} or {@code Time}
 * (but not a zone or offset) is then parsed, using the resolved zone for values without one. A value that cannot
 * be parsed is kept as it is.</p>
 */
public final class TagNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(TagNormalizer.class);

    /// Date-time tags that are always UTC.
    static final Set<String> UTC_TAG_NAMES = Set.of("GPSDateTime", "DateTimeUTC", "SonyDateTime2");

    /// Dropped when the GPS position is invalid.
    static final List<String> GPS_POSITION_TAG_NAMES = List.of(
            GpsLocationTags.GPS_LATITUDE,
            GpsLocationTags.GPS_LATITUDE_REF,
            GpsLocationTags.GPS_LONGITUDE,
            GpsLocationTags.GPS_LONGITUDE_REF,
            GpsLocationTags.GPS_POSITION);

    private final TzOptions options;

    public TagNormalizer(TzOptions options) {
        this.options = options;
    }

    public TzOptions options() {
        return this.options;
    }

    public NormalizedTags normalize(RawTags tags) {
        final TimezoneContext context = new TimezoneContext(tags, this.options);
        final GpsResult gps = context.gps();
        final TzSource tzSource = context.timezone();

        final List<String> warnings = new ArrayList<>(gps.warnings());
        warnings.addAll(context.warnings());

        final Map<String, Object> values = new LinkedHashMap<>();
        for (final Map.Entry<String, Object> entry : tags.asMap().entrySet()) {
            final String name = RawTags.localName(entry.getKey());
            final Object raw = entry.getValue();

            if (raw instanceof String text && isDateOrTimeTag(name)) {
                values.put(entry.getKey(), normalizeOrKeep(name, text, tzSource, warnings));
            } else {
                values.put(entry.getKey(), raw);
            }
        }

        applyGps(values, gps);

        return new NormalizedTags(values, gps, tzSource, warnings);
    }

    static boolean isDateOrTimeTag(String name) {
        return (name.contains("Date") || name.contains("Time")) && !name.contains("Zone") && !name.contains("Offset");
    }

    private static Object normalizeOrKeep(String name, String text, @Nullable TzSource tzSource, List<String> warnings) {
        try {
            final Object normalized = normalizeValue(name, text, tzSource == null ? null : tzSource.zone());
            if (normalized == null) {
                LOG.debug("Keeping raw value [{}] of tag [{}].", text, name);
                return text;
            }

            return normalized;
        } catch (RuntimeException rtEx) {
            warnings.add("Failed to parse " + name + " with value \"" + text + "\": " + rtEx.getMessage());
            return text;
        }
    }

    /**
     * Parses one date or time value.
     *
     * @param name the tag name without group
     * @param text the raw value
     * @param defaultZone the zone for date-time values without one
     * @return a {@link DateTimeWithZone}, {@link PartialDate} or
     *     {@link de.bmarwell.home.exif.normalizer.time.PartialTime}, or {@code null} if the value is none of these
     */
    static @Nullable Object normalizeValue(String name, String text, @Nullable ZoneId defaultZone) {
        final DateTimeWithZone dateTime = UTC_TAG_NAMES.contains(name)
                ? DateTimeParser.utc().parse(text)
                : DateTimeParser.exif().parse(text, defaultZone);
        if (dateTime != null) {
            return dateTime;
        }

        final PartialDate date = DateTimeParser.parseDate(text);
        if (date != null) {
            return date;
        }

        return DateTimeParser.parseTime(text);
    }

    private static void applyGps(Map<String, Object> values, GpsResult gps) {
        if (gps instanceof GpsResult.Invalid) {
            values.keySet().removeIf(key -> GPS_POSITION_TAG_NAMES.contains(RawTags.localName(key)));
            return;
        }

        if (gps instanceof GpsResult.Valid valid) {
            final GpsCoordinates result = valid.result();
            replace(values, GpsLocationTags.GPS_LATITUDE, result.latitude());
            replace(values, GpsLocationTags.GPS_LATITUDE_REF, result.latitudeRef().name());
            replace(values, GpsLocationTags.GPS_LONGITUDE, result.longitude());
            replace(values, GpsLocationTags.GPS_LONGITUDE_REF, result.longitudeRef().name());
        }
    }

    /// Replaces the value of every key with the given local name, or adds the plain name.
    private static void replace(Map<String, Object> values, String name, Object value) {
        boolean replaced = false;
        for (final Map.Entry<String, Object> entry : values.entrySet()) {
            if (RawTags.localName(entry.getKey()).equals(name)) {
                entry.setValue(value);
                replaced = true;
            }
        }

        if (!replaced) {
            values.put(name, value);
        }
    }
}
