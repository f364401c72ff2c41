/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tz;

import de.bmarwell.home.exif.normalizer.gps.GpsCoordinates;
import de.bmarwell.home.exif.normalizer.gps.GpsResult;
import de.bmarwell.home.exif.normalizer.tags.RawTags;
import de.bmarwell.home.exif.normalizer.time.DateTimeParser;
import de.bmarwell.home.exif.normalizer.time.DateTimeWithZone;
import de.bmarwell.home.exif.normalizer.time.ExtractedZone;
import de.bmarwell.home.exif.normalizer.time.Zones;
import de.bmarwell.home.exif.normalizer.util.StringUtil;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * One way of finding the zone of a file. See {@link TimezoneResolver#chain(TzOptions)} for the order.
 */
public enum TimezoneStrategy {

    /** Tags that hold nothing but an offset or zone name. */
    EXPLICIT_OFFSET_TAGS {
        @Override
        public @Nullable TzSource resolve(TimezoneContext context) {
            for (final String tagName : OFFSET_TAG_NAMES) {
                final ExtractedZone zone = Zones.extractZone(context.tags().get(tagName));
                if (zone != null) {
                    return TzSource.of(zone.zone(), tagName);
                }
            }

            return null;
        }
    },

    /** {@code GeolocationTimeZone}, or the zone at the reconciled GPS position. */
    GPS {
        @Override
        public @Nullable TzSource resolve(TimezoneContext context) {
            if (!(context.gps() instanceof GpsResult.Valid valid)) {
                return null;
            }

            final ZoneId geolocationZone = Zones.normalizeZone(context.tags().getString(GEOLOCATION_TIME_ZONE));
            if (geolocationZone != null) {
                return TzSource.of(geolocationZone, GEOLOCATION_TIME_ZONE);
            }

            final GpsCoordinates position = valid.result();
            try {
                final String zoneName =
                        context.options().geoTimezoneLookup().lookup(position.latitude(), position.longitude());
                final ZoneId zone = Zones.normalizeZone(zoneName);

                return zone == null ? null : TzSource.of(zone, "GPSLatitude/GPSLongitude");
            } catch (RuntimeException rtEx) {
                context.addWarning(String.format(
                        Locale.ROOT,
                        "Failed to find timezone for GPS position %s,%s: %s",
                        position.latitude(),
                        position.longitude(),
                        rtEx.getMessage()));
                return null;
            }
        }
    },

    /** Offsets carried by the date-time values themselves. Ignores UTC, which some apps add to any value. */
    DATESTAMPS {
        @Override
        public @Nullable TzSource resolve(TimezoneContext context) {
            if (!context.options().inferTimezoneFromDatestamps()) {
                return null;
            }

            for (final String tagName : context.options().inferTimezoneFromDatestampTags()) {
                final ExtractedZone zone = Zones.extractZone(context.tags().get(tagName));
                if (zone != null && !Zones.isUtc(zone)) {
                    return TzSource.of(zone.zone(), tagName);
                }
            }

            return null;
        }
    },

    /** Video containers store UTC without saying so. */
    VIDEO_DEFAULT {
        @Override
        public @Nullable TzSource resolve(TimezoneContext context) {
            if (context.options().defaultVideosToUtc() && context.tags().isVideo()) {
                return TzSource.utc(TzSource.DEFAULT_VIDEOS_TO_UTC);
            }

            return null;
        }
    },

    /** The difference between a local captured-at value and a value known to be UTC, like {@code GPSDateTime}. */
    UTC_OFFSET {
        @Override
        public @Nullable TzSource resolve(TimezoneContext context) {
            final RawTags tags = context.tags();
            final Stamp utc = firstUtcStamp(tags);
            if (utc == null) {
                return null;
            }

            final Stamp local = firstZonelessStamp(tags, CapturedAtTagNames.NAMES);
            return local == null ? null : offsetBetween(local, utc);
        }
    },

    /** The difference between a local captured-at value and the {@code TimeStamp} instant. */
    TIMESTAMP {
        @Override
        public @Nullable TzSource resolve(TimezoneContext context) {
            if (!context.options().inferTimezoneFromTimeStamp()) {
                return null;
            }

            final DateTimeWithZone timeStamp =
                    DateTimeParser.utc().parse(context.tags().getString(TIME_STAMP));
            if (timeStamp == null) {
                return null;
            }

            final Stamp local =
                    firstZonelessStamp(context.tags(), context.options().inferTimezoneFromDatestampTags());
            if (local == null) {
                return null;
            }

            return offsetBetween(local, new Stamp(TIME_STAMP, timeStamp.toEpochSecondsOrLocal()));
        }
    };

    static final String GEOLOCATION_TIME_ZONE = "GeolocationTimeZone";

    static final String TIME_STAMP = "TimeStamp";

    static final String GPS_DATE_TIME_STAMP = "GPSDateTimeStamp";

    /// Tags holding only an offset or zone, in order of trust.
    static final List<String> OFFSET_TAG_NAMES =
            List.of("TimeZone", "OffsetTime", "OffsetTimeOriginal", "OffsetTimeDigitized", "TimeZoneOffset");

    /// Tags that are always in UTC. `GPSDateTimeStamp` is `GPSDateStamp` and `GPSTimeStamp` combined.
    static final List<String> UTC_TAG_NAMES =
            List.of("GPSDateTime", "DateTimeUTC", GPS_DATE_TIME_STAMP, "SonyDateTime2");

    /**
     * Tries to find the zone.
     *
     * @param context the file being read
     * @return the zone, or {@code null} if this strategy does not apply
     */
    public abstract @Nullable TzSource resolve(TimezoneContext context);

    static @Nullable Stamp firstUtcStamp(RawTags tags) {
        for (final String tagName : UTC_TAG_NAMES) {
            final DateTimeWithZone value = DateTimeParser.strict().parse(utcTagValue(tags, tagName));
            if (value != null && (!value.hasZone() || Zones.isUtc(value.zone()))) {
                return new Stamp(tagName, value.toLocalDateTime().toEpochSecond(ZoneOffset.UTC));
            }
        }

        return null;
    }

    private static @Nullable String utcTagValue(RawTags tags, String tagName) {
        if (!GPS_DATE_TIME_STAMP.equals(tagName)) {
            return tags.getString(tagName);
        }

        final String date = StringUtil.toNotBlank(tags.getString("GPSDateStamp"));
        final String time = StringUtil.toNotBlank(tags.getString("GPSTimeStamp"));

        return date == null || time == null ? null : date + " " + time;
    }

    static @Nullable Stamp firstZonelessStamp(RawTags tags, List<String> tagNames) {
        for (final String tagName : tagNames) {
            final DateTimeWithZone value = DateTimeParser.strict().parse(tags.getString(tagName));
            if (value != null && !value.hasZone()) {
                return new Stamp(tagName, value.toEpochSecondsOrLocal());
            }
        }

        return null;
    }

    static @Nullable TzSource offsetBetween(Stamp local, Stamp utc) {
        final double deltaMinutes = (local.epochSeconds() - utc.epochSeconds()) / 60.0;
        final ZoneOffset offset = Zones.offsetMinutesToZone(Zones.inferLikelyOffsetMinutes(deltaMinutes));

        return offset == null
                ? null
                : TzSource.of(offset, "offset between " + local.tagName() + " and " + utc.tagName());
    }

    /// A tag value as seconds since the epoch, reading a zoneless wall clock as UTC.
    record Stamp(String tagName, long epochSeconds) {}
}
