/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.coordinate;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/// Compass direction of a coordinate, also used as GPS reference letter.
public enum Direction {
    N,
    S,
    E,
    W;

    public Axis axis() {
        return this == N || this == S ? Axis.LATITUDE : Axis.LONGITUDE;
    }

    public boolean isNegative() {
        return this == S || this == W;
    }

    /// Reads the first letter of the given text, case-insensitive.
    ///
    /// @param text e.g. `N`, `s`, `West`
    /// @return the direction, or `null` if the text is blank or does not start with `N`, `S`, `E` or `W`
    public static @Nullable Direction fromLetter(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return null;
        }

        return switch (text.trim().substring(0, 1).toUpperCase(Locale.ROOT)) {
            case "N" -> N;
            case "S" -> S;
            case "E" -> E;
            case "W" -> W;
            default -> null;
        };
    }
}
