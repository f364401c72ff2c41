/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.gps;

import java.util.List;

/// Outcome of [GpsReconciler#reconcile(GpsLocationTags, boolean)].
///
/// Warnings never abort reconciliation. Only [Invalid] asks the caller to drop the GPS fields.
public sealed interface GpsResult permits GpsResult.Empty, GpsResult.Invalid, GpsResult.Valid {

    List<String> warnings();

    /**
     * No GPS data was present, which is not an error.
     *
     * @param warnings problems with partial data, e.g. an unparseable {@code GPSPosition}
     */
    record Empty(List<String> warnings) implements GpsResult {
        public Empty {
            warnings = List.copyOf(warnings);
        }
    }

    /**
     * GPS data was present but must not be emitted.
     *
     * @param warnings why the data was rejected
     */
    record Invalid(List<String> warnings) implements GpsResult {
        public Invalid {
            warnings = List.copyOf(warnings);
        }
    }

    /**
     * Corrected GPS data.
     *
     * @param result the corrected fields
     * @param warnings corrections that were applied
     */
    record Valid(GpsCoordinates result, List<String> warnings) implements GpsResult {
        public Valid {
            warnings = List.copyOf(warnings);
        }
    }
}
