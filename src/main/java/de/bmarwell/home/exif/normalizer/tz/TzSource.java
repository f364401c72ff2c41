/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tz;

import de.bmarwell.home.exif.normalizer.time.Zones;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * The zone of a file, with the strategy that found it.
 *
 * @param zoneName the canonical zone name, e.g. {@code UTC-7} or {@code America/Los_Angeles}
 * @param zone the normalized zone
 * @param source a tag name, {@code GPSLatitude/GPSLongitude}, {@code defaultVideosToUTC} or
 *     {@code offset between <tag> and <tag>}
 */
public record TzSource(String zoneName, ZoneId zone, String source) {

    public static final String DEFAULT_VIDEOS_TO_UTC = "defaultVideosToUTC";

    public static TzSource of(ZoneId zone, String source) {
        return new TzSource(Zones.zoneName(zone), zone, source);
    }

    static TzSource utc(String source) {
        return of(ZoneOffset.UTC, source);
    }
}
