/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.gps;

import de.bmarwell.home.exif.normalizer.coordinate.Axis;
import de.bmarwell.home.exif.normalizer.coordinate.Coordinate;
import de.bmarwell.home.exif.normalizer.coordinate.CoordinateParseException;
import de.bmarwell.home.exif.normalizer.coordinate.CoordinateParser;
import de.bmarwell.home.exif.normalizer.coordinate.LatLon;
import de.bmarwell.home.exif.normalizer.util.NumberUtil;
import de.bmarwell.home.exif.normalizer.util.StringUtil;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles the GPS tags of one file into a single signed position.
 *
 * <p>The position is taken from {@code GPSPosition} if it parses, otherwise from {@code GPSLatitude} and
 * {@code GPSLongitude}. Each axis then runs through {@link AxisCorrection}, with {@code GeolocationPosition} as
 * the tie-breaker for the hemisphere.</p>
 */
public final class GpsReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(GpsReconciler.class);

    static final String ZERO_ZERO_WARNING = "Ignoring zero coordinates from GPSLatitude/GPSLongitude";

    private GpsReconciler() {
        // util
    }

    /**
     * Reconciles the given GPS tags.
     *
     * @param tags the raw GPS tag values
     * @param ignoreZeroZero whether {@code 0,0} ("Null Island") means "no fix"
     * @return {@link GpsResult.Empty} if there is no position, {@link GpsResult.Invalid} if the position must be
     *     dropped, otherwise {@link GpsResult.Valid}
     */
    public static GpsResult reconcile(GpsLocationTags tags, boolean ignoreZeroZero) {
        final List<String> warnings = new ArrayList<>();

        Double latitude = null;
        Double longitude = null;
        String latitudeRef = null;
        String longitudeRef = null;

        if (StringUtil.isNotBlank(tags.gpsPosition())) {
            try {
                final LatLon position = CoordinateParser.parseCoordinates(tags.gpsPosition());
                latitude = position.latitude();
                longitude = position.longitude();
                latitudeRef = Axis.LATITUDE.directionOf(position.latitude()).name();
                longitudeRef = Axis.LONGITUDE.directionOf(position.longitude()).name();
            } catch (CoordinateParseException cpe) {
                warnings.add("Error parsing " + GpsLocationTags.GPS_POSITION + ": " + cpe.getMessage());
            }
        }

        if ((latitude == null || longitude == null)
                && StringUtil.isNotBlank(tags.gpsLatitude())
                && StringUtil.isNotBlank(tags.gpsLongitude())) {
            final ParsedAxis lat = parseAxis(
                    GpsLocationTags.GPS_LATITUDE, tags.gpsLatitude(), tags.gpsLatitudeRef(), warnings);
            final ParsedAxis lon = parseAxis(
                    GpsLocationTags.GPS_LONGITUDE, tags.gpsLongitude(), tags.gpsLongitudeRef(), warnings);
            if (lat != null && lon != null) {
                latitude = lat.value();
                latitudeRef = lat.ref();
                longitude = lon.value();
                longitudeRef = lon.ref();
            }
        }

        if (latitude == null || longitude == null) {
            return new GpsResult.Empty(warnings);
        }

        // also covers zeros coming from plain numeric tags
        if (ignoreZeroZero && latitude == 0 && longitude == 0) {
            warnings.add(ZERO_ZERO_WARNING);
            return new GpsResult.Invalid(warnings);
        }

        final LatLon geo = parseGeolocation(tags.geolocationPosition(), warnings);

        final AxisCorrection.CorrectedAxis lat = AxisCorrection.correct(
                Axis.LATITUDE, latitude, latitudeRef, geo == null ? null : geo.latitude(), warnings);
        final AxisCorrection.CorrectedAxis lon = AxisCorrection.correct(
                Axis.LONGITUDE, longitude, longitudeRef, geo == null ? null : geo.longitude(), warnings);

        if (lat.invalid() || lon.invalid()) {
            LOG.debug("Dropping GPS position {},{}: {}", latitude, longitude, warnings);
            return new GpsResult.Invalid(warnings);
        }

        return new GpsResult.Valid(new GpsCoordinates(lat.value(), lat.ref(), lon.value(), lon.ref()), warnings);
    }

    private static @Nullable ParsedAxis parseAxis(
            String tagName, @Nullable String value, @Nullable String tagRef, List<String> warnings) {
        if (value == null) {
            return null;
        }

        if (NumberUtil.isNumeric(value)) {
            return new ParsedAxis(NumberUtil.toDouble(value), tagRef);
        }

        try {
            final Coordinate coordinate = CoordinateParser.parseCoordinate(value);
            final String ref = coordinate.direction() == null
                    ? tagRef
                    : coordinate.direction().name();
            return new ParsedAxis(coordinate.decimal(), ref);
        } catch (CoordinateParseException cpe) {
            warnings.add("Error parsing " + tagName + ": " + cpe.getMessage());
            return null;
        }
    }

    private static @Nullable LatLon parseGeolocation(@Nullable String geolocationPosition, List<String> warnings) {
        if (StringUtil.isBlank(geolocationPosition)) {
            return null;
        }

        try {
            return CoordinateParser.parseCoordinates(geolocationPosition);
        } catch (CoordinateParseException cpe) {
            warnings.add("Error parsing " + GpsLocationTags.GEOLOCATION_POSITION + ": " + cpe.getMessage());
            return null;
        }
    }

    private record ParsedAxis(Double value, @Nullable String ref) {}
}
