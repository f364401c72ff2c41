/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.gps;

import de.bmarwell.home.exif.normalizer.coordinate.Direction;
import de.bmarwell.home.exif.normalizer.coordinate.LatLon;

/**
 * Corrected GPS fields. Each reference letter always agrees with the sign of its value.
 *
 * @param latitude signed latitude
 * @param latitudeRef {@link Direction#N} or {@link Direction#S}
 * @param longitude signed longitude
 * @param longitudeRef {@link Direction#E} or {@link Direction#W}
 */
public record GpsCoordinates(double latitude, Direction latitudeRef, double longitude, Direction longitudeRef) {

    public LatLon toLatLon() {
        return new LatLon(this.latitude, this.longitude);
    }
}
