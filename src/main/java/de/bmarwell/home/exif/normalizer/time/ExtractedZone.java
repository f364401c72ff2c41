/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.time;

import java.time.ZoneId;
import org.jspecify.annotations.Nullable;

/**
 * A zone found in a raw tag value.
 *
 * @param zoneName the canonical zone name, see {@link Zones#zoneName(ZoneId)}
 * @param zone the normalized zone
 * @param leftovers for string input, the text preceding the offset, e.g. the date-time part
 * @param source how the zone was found, e.g. {@code hourOffset} or {@code Z}
 */
public record ExtractedZone(String zoneName, ZoneId zone, @Nullable String leftovers, String source) {

    static ExtractedZone of(ZoneId zone, @Nullable String leftovers, String source) {
        return new ExtractedZone(Zones.zoneName(zone), zone, leftovers, source);
    }
}
