/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.gps;

import de.bmarwell.home.exif.normalizer.coordinate.Axis;
import de.bmarwell.home.exif.normalizer.coordinate.CoordinateParser;
import de.bmarwell.home.exif.normalizer.coordinate.Direction;
import de.bmarwell.home.exif.normalizer.util.NumberUtil;
import de.bmarwell.home.exif.normalizer.util.StringUtil;
import java.util.List;
import org.jspecify.annotations.Nullable;

/// Sign and reference-letter correction for one GPS axis.
///
/// Reference letters written by camera firmware are often stale, while the magnitude is
/// usually right. A geolocation estimate within [#MAX_GEO_DIFF_DEGREES] of the magnitude
/// is trusted over both.
final class AxisCorrection {

    static final double MAX_GEO_DIFF_DEGREES = 1.0;

    private AxisCorrection() {
        // util
    }

    /**
     * Corrects one axis.
     *
     * @param axis the axis being corrected
     * @param value the parsed value, possibly with the wrong sign
     * @param refText the reference letter as given, may be blank
     * @param geoValue the same axis from {@code GeolocationPosition}, if any
     * @param warnings receives one message per correction
     * @return the corrected axis
     */
    static CorrectedAxis correct(
            Axis axis, double value, @Nullable String refText, @Nullable Double geoValue, List<String> warnings) {
        final boolean refGiven = StringUtil.isNotBlank(refText);
        final String tagName = "GPS" + axis.label();
        double corrected = value;
        Direction ref = Direction.fromLetter(refText);

        if (refGiven && (ref == null || ref.axis() != axis)) {
            warnings.add("Invalid " + tagName + "Ref: \"" + refText + "\".");
            ref = axis.directionOf(corrected);
        } else if (ref == null) {
            ref = axis.directionOf(corrected);
        }

        if (Math.abs(corrected) > axis.maxDegrees()) {
            warnings.add("Invalid " + tagName + ": " + NumberUtil.toPlainString(corrected) + " is out of range");
            return new CorrectedAxis(corrected, ref, true);
        }

        if (ref == axis.negative()) {
            corrected = -Math.abs(corrected);
        }

        if (geoValue != null && Math.abs(Math.abs(geoValue) - Math.abs(corrected)) < MAX_GEO_DIFF_DEGREES) {
            if ((geoValue < 0) != (corrected < 0)) {
                corrected = -corrected;
                warnings.add("Corrected " + tagName + " sign based on GeolocationPosition");
            }

            final Direction geoRef = axis.directionOf(geoValue);
            if (ref != geoRef) {
                ref = geoRef;
                if (refGiven) {
                    warnings.add("Corrected " + tagName + "Ref to " + geoRef + " based on GeolocationPosition");
                }
            }
        }

        // the ref must never contradict the sign we return
        final Direction signRef = axis.directionOf(corrected);
        if (ref != signRef && refGiven) {
            warnings.add("Corrected " + tagName + "Ref to " + signRef + " to match coordinate sign");
        }

        return new CorrectedAxis(CoordinateParser.roundGpsDecimal(corrected), signRef, false);
    }

    record CorrectedAxis(double value, Direction ref, boolean invalid) {}
}
