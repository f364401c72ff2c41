/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tz;

import org.jspecify.annotations.Nullable;

/// Finds the zone name for a position, e.g. backed by a timezone boundary table.
///
/// Implementations may block and may throw; a failure is reported as a warning.
@FunctionalInterface
public interface GeoTimezoneLookup {

    /// Never finds a zone.
    GeoTimezoneLookup NONE = (latitude, longitude) -> null;

    /// @return an IANA zone name like `America/Los_Angeles`, or `null` if unknown
    @Nullable String lookup(double latitude, double longitude);
}
