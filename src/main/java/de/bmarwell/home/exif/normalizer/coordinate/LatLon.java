/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.coordinate;

/**
 * A signed latitude/longitude pair in decimal degrees.
 *
 * @param latitude in {@code [-90, 90]}
 * @param longitude in {@code [-180, 180]}
 */
public record LatLon(double latitude, double longitude) {

    public boolean isZeroZero() {
        return this.latitude == 0 && this.longitude == 0;
    }
}
