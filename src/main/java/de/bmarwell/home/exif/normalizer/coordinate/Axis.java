/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.coordinate;

import java.util.Locale;

/// One of the two axes of a geographic position.
public enum Axis {
    LATITUDE("Latitude", Direction.N, Direction.S, 90),
    LONGITUDE("Longitude", Direction.E, Direction.W, 180);

    private final String label;
    private final Direction positive;
    private final Direction negative;
    private final int maxDegrees;

    Axis(String label, Direction positive, Direction negative, int maxDegrees) {
        this.label = label;
        this.positive = positive;
        this.negative = negative;
        this.maxDegrees = maxDegrees;
    }

    /// @return `Latitude` or `Longitude`, as used in ExifTool tag names
    public String label() {
        return this.label;
    }

    public Direction positive() {
        return this.positive;
    }

    public Direction negative() {
        return this.negative;
    }

    public int maxDegrees() {
        return this.maxDegrees;
    }

    /// @return the reference direction matching the sign of `value`
    public Direction directionOf(double value) {
        return value < 0 ? this.negative : this.positive;
    }

    @Override
    public String toString() {
        return this.label.toLowerCase(Locale.ROOT);
    }
}
