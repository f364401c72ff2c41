/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.coordinate;

import java.io.Serial;

/// Thrown when a coordinate string cannot be parsed or is out of range.
public class CoordinateParseException extends Exception {

    @Serial
    private static final long serialVersionUID = 1L;

    private final Reason reason;

    public CoordinateParseException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return this.reason;
    }

    public enum Reason {
        INVALID_FORMAT,
        INVALID_MINUTES,
        INVALID_SECONDS,
        INVALID_DEGREES,
        MISSING_DIRECTION,
        DUPLICATE_AXIS,
        MISSING_AXIS
    }
}
