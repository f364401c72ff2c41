/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.coordinate;

import org.jspecify.annotations.Nullable;

/**
 * A single parsed coordinate token.
 *
 * <p>{@code minutes} is only set for {@link CoordinateFormat#DM} and {@link CoordinateFormat#DMS},
 * {@code seconds} only for {@link CoordinateFormat#DMS}.</p>
 *
 * @param decimal the signed decimal degrees, rounded to six decimal places
 * @param degrees the degrees as written, possibly signed
 * @param minutes the minutes, in {@code [0, 60)}
 * @param seconds the seconds, in {@code [0, 60)}
 * @param direction the direction letter, if one was given
 * @param format the layout the token was written in
 * @param remainder trimmed text following the token, empty if none
 */
public record Coordinate(
        double decimal,
        double degrees,
        @Nullable Double minutes,
        @Nullable Double seconds,
        @Nullable Direction direction,
        CoordinateFormat format,
        String remainder) {}
