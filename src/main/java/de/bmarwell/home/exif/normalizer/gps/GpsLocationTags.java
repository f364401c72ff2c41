/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.gps;

import de.bmarwell.home.exif.normalizer.tags.RawTags;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The raw, GPS-related tag values of one file, as text.
 *
 * @param gpsLatitude a number or a coordinate string
 * @param gpsLatitudeRef {@code N} or {@code S}, or a word starting with one of them
 * @param gpsLongitude a number or a coordinate string
 * @param gpsLongitudeRef {@code E} or {@code W}, or a word starting with one of them
 * @param gpsPosition latitude and longitude in one string
 * @param geolocationPosition ExifTool's geolocation estimate, e.g. {@code "7.3397, 134.4733"}
 */
public record GpsLocationTags(
        @Nullable String gpsLatitude,
        @Nullable String gpsLatitudeRef,
        @Nullable String gpsLongitude,
        @Nullable String gpsLongitudeRef,
        @Nullable String gpsPosition,
        @Nullable String geolocationPosition) {

    public static final String GPS_LATITUDE = "GPSLatitude";
    public static final String GPS_LATITUDE_REF = "GPSLatitudeRef";
    public static final String GPS_LONGITUDE = "GPSLongitude";
    public static final String GPS_LONGITUDE_REF = "GPSLongitudeRef";
    public static final String GPS_POSITION = "GPSPosition";
    public static final String GEOLOCATION_POSITION = "GeolocationPosition";

    /** All tag names read by {@link #from(RawTags)}. */
    public static final List<String> TAG_NAMES = List.of(
            GPS_LATITUDE, GPS_LATITUDE_REF, GPS_LONGITUDE, GPS_LONGITUDE_REF, GPS_POSITION, GEOLOCATION_POSITION);

    public static GpsLocationTags from(RawTags tags) {
        return new GpsLocationTags(
                tags.getString(GPS_LATITUDE),
                tags.getString(GPS_LATITUDE_REF),
                tags.getString(GPS_LONGITUDE),
                tags.getString(GPS_LONGITUDE_REF),
                tags.getString(GPS_POSITION),
                tags.getString(GEOLOCATION_POSITION));
    }
}
