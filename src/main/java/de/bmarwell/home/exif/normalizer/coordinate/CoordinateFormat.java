/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.coordinate;

public enum CoordinateFormat {
    /** Degrees, minutes and (decimal) seconds. */
    DMS,
    /** Degrees and decimal minutes. */
    DM,
    /** Decimal degrees. */
    D
}
