/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tz;

import java.util.List;
import java.util.Objects;

/**
 * Options for timezone inference and GPS reconciliation.
 *
 * @param ignoreZeroZeroLatLon treat {@code 0,0} as "no GPS fix"
 * @param preferTimezoneInferenceFromGps try the GPS position before explicit offset tags
 * @param inferTimezoneFromDatestamps look for offsets in the values of {@code inferTimezoneFromDatestampTags}
 * @param inferTimezoneFromDatestampTags the tags to look at, in order
 * @param inferTimezoneFromTimeStamp compare the {@code TimeStamp} tag with the captured-at tags
 * @param defaultVideosToUtc assume UTC for videos without any other zone information
 * @param geoTimezoneLookup finds the zone of a GPS position
 */
public record TzOptions(
        boolean ignoreZeroZeroLatLon,
        boolean preferTimezoneInferenceFromGps,
        boolean inferTimezoneFromDatestamps,
        List<String> inferTimezoneFromDatestampTags,
        boolean inferTimezoneFromTimeStamp,
        boolean defaultVideosToUtc,
        GeoTimezoneLookup geoTimezoneLookup) {

    public TzOptions {
        inferTimezoneFromDatestampTags = List.copyOf(inferTimezoneFromDatestampTags);
        Objects.requireNonNull(geoTimezoneLookup, "geoTimezoneLookup");
    }

    public static TzOptions defaults() {
        return new TzOptions(true, false, false, CapturedAtTagNames.NAMES, false, true, GeoTimezoneLookup.NONE);
    }

    public TzOptions withIgnoreZeroZeroLatLon(boolean value) {
        return new TzOptions(
                value,
                this.preferTimezoneInferenceFromGps,
                this.inferTimezoneFromDatestamps,
                this.inferTimezoneFromDatestampTags,
                this.inferTimezoneFromTimeStamp,
                this.defaultVideosToUtc,
                this.geoTimezoneLookup);
    }

    public TzOptions withPreferTimezoneInferenceFromGps(boolean value) {
        return new TzOptions(
                this.ignoreZeroZeroLatLon,
                value,
                this.inferTimezoneFromDatestamps,
                this.inferTimezoneFromDatestampTags,
                this.inferTimezoneFromTimeStamp,
                this.defaultVideosToUtc,
                this.geoTimezoneLookup);
    }

    public TzOptions withInferTimezoneFromDatestamps(boolean value) {
        return new TzOptions(
                this.ignoreZeroZeroLatLon,
                this.preferTimezoneInferenceFromGps,
                value,
                this.inferTimezoneFromDatestampTags,
                this.inferTimezoneFromTimeStamp,
                this.defaultVideosToUtc,
                this.geoTimezoneLookup);
    }

    public TzOptions withInferTimezoneFromDatestampTags(List<String> value) {
        return new TzOptions(
                this.ignoreZeroZeroLatLon,
                this.preferTimezoneInferenceFromGps,
                this.inferTimezoneFromDatestamps,
                value,
                this.inferTimezoneFromTimeStamp,
                this.defaultVideosToUtc,
                this.geoTimezoneLookup);
    }

    public TzOptions withInferTimezoneFromTimeStamp(boolean value) {
        return new TzOptions(
                this.ignoreZeroZeroLatLon,
                this.preferTimezoneInferenceFromGps,
                this.inferTimezoneFromDatestamps,
                this.inferTimezoneFromDatestampTags,
                value,
                this.defaultVideosToUtc,
                this.geoTimezoneLookup);
    }

    public TzOptions withDefaultVideosToUtc(boolean value) {
        return new TzOptions(
                this.ignoreZeroZeroLatLon,
                this.preferTimezoneInferenceFromGps,
                this.inferTimezoneFromDatestamps,
                this.inferTimezoneFromDatestampTags,
                this.inferTimezoneFromTimeStamp,
                value,
                this.geoTimezoneLookup);
    }

    public TzOptions withGeoTimezoneLookup(GeoTimezoneLookup value) {
        return new TzOptions(
                this.ignoreZeroZeroLatLon,
                this.preferTimezoneInferenceFromGps,
                this.inferTimezoneFromDatestamps,
                this.inferTimezoneFromDatestampTags,
                this.inferTimezoneFromTimeStamp,
                this.defaultVideosToUtc,
                value);
    }
}
