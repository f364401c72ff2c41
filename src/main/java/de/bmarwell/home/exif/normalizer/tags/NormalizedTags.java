/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tags;

import de.bmarwell.home.exif.normalizer.gps.GpsResult;
import de.bmarwell.home.exif.normalizer.tz.TzSource;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The tags of one file after normalization.
 *
 * @param values tag values by original key; date and time values are
 *     {@link de.bmarwell.home.exif.normalizer.time.DateTimeWithZone},
 *     {@link de.bmarwell.home.exif.normalizer.time.PartialDate} or
 *     {@link de.bmarwell.home.exif.normalizer.time.PartialTime}, everything else is the raw value
 * @param gps the GPS reconciliation
 * @param tzSource the zone of the file, or {@code null} if unknown
 * @param warnings problems found while normalizing
 */
public record NormalizedTags(
        Map<String, Object> values, GpsResult gps, @Nullable TzSource tzSource, List<String> warnings) {

    public NormalizedTags {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        warnings = List.copyOf(warnings);
    }

    public @Nullable Object get(String name) {
        return new RawTags(this.values).get(name);
    }
}
