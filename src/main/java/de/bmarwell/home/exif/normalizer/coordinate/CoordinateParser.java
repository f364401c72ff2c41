/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.coordinate;

import de.bmarwell.home.exif.normalizer.coordinate.CoordinateParseException.Reason;
import de.bmarwell.home.exif.normalizer.util.NumberUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Parses coordinates as written by ExifTool and by cameras.
 *
 * <p>Three layouts are understood, and tried in this order:</p>
 * <ol>
 *   <li>DMS: {@code 40° 26' 46" N}, {@code 37 deg 46' 29.64" N}</li>
 *   <li>DM: {@code 40° 26.767' N}</li>
 *   <li>D: {@code 40.44611° N}</li>
 * </ol>
 *
 * <p>Degree, minute and second markers may be ASCII or typographic ({@code °}/{@code DEG}, {@code '}/{@code ′},
 * {@code "}/{@code ″}). A trailing direction letter is case-insensitive and wins over the sign of the degrees
 * when computing the decimal value.</p>
 */
public final class CoordinateParser {

    /** Six decimal places is about 0.11 m, beyond what consumer GPS receivers resolve. */
    private static final int GPS_DECIMAL_PLACES = 6;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Pattern DECIMAL_PAIR =
            Pattern.compile("^(-?\\d+(?:\\.\\d+)?)[,\\s]+(-?\\d+(?:\\.\\d+)?)$");

    private static final Pattern DECIMAL_SINGLE = Pattern.compile("^-?\\d+(?:\\.\\d+)?$");

    private static final Pattern DMS = Pattern.compile(
            "^(?<degrees>-?\\d+)\\s*(?:°|DEG)\\s*(?<minutes>\\d+)\\s*['′]\\s*"
                    + "(?<seconds>\\d+(?:\\.\\d+)?)\\s*[\"″][\\s,]{0,2}(?<direction>[NSEW])?"
                    + "[\\s,]{0,3}(?<remainder>.*)$",
            FLAGS);

    private static final Pattern DM = Pattern.compile(
            "^(?<degrees>-?\\d+)\\s*(?:°|DEG)\\s*(?<minutes>\\d+(?:\\.\\d+)?)\\s?['′]"
                    + "[\\s,]{0,2}(?<direction>[NSEW])?[\\s,]{0,3}(?<remainder>.*)$",
            FLAGS);

    private static final Pattern D = Pattern.compile(
            "^(?<degrees>-?\\d+(?:\\.\\d+)?)\\s*(?:°|DEG)[\\s,]{0,2}(?<direction>[NSEW])?[\\s,]{0,3}(?<remainder>.*)$",
            FLAGS);

    private static final String INVALID_FORMAT_MESSAGE = "Invalid coordinate format. Expected one of:\n"
            + "  DDD° MM' SS.S\" k (deg/min/sec)\n"
            + "  DDD° MM.MMM' k (deg/decimal minutes)\n"
            + "  DDD.DDDDD° (decimal degrees)\n"
            + "  (where k indicates direction: N, S, E, or W)";

    private CoordinateParser() {
        // util
    }

    /// Parses a single coordinate that must not be followed by any other text.
    ///
    /// @see #parseCoordinate(String, boolean)
    public static Coordinate parseCoordinate(String input) throws CoordinateParseException {
        return parseCoordinate(input, false);
    }

    /**
     * Parses a single coordinate token.
     *
     * @param input the coordinate, e.g. {@code 40° 26' 46" N}
     * @param allowRemainder whether text may follow the coordinate. The text is returned in
     *     {@link Coordinate#remainder()}.
     * @return the parsed coordinate
     * @throws CoordinateParseException if the input does not match any layout, or minutes, seconds or degrees
     *     are out of range
     * @throws IllegalArgumentException if the input is blank
     */
    public static Coordinate parseCoordinate(String input, boolean allowRemainder) throws CoordinateParseException {
        final String trimmed = requireNotBlank(input);

        if (DECIMAL_SINGLE.matcher(trimmed).matches()) {
            final double value = roundGpsDecimal(Double.parseDouble(trimmed));
            checkDegrees(value, null);
            return new Coordinate(value, value, null, null, null, CoordinateFormat.D, "");
        }

        CoordinateFormat format = null;
        Matcher matcher = DMS.matcher(trimmed);
        if (matcher.matches()) {
            format = CoordinateFormat.DMS;
        } else if ((matcher = DM.matcher(trimmed)).matches()) {
            format = CoordinateFormat.DM;
        } else if ((matcher = D.matcher(trimmed)).matches()) {
            format = CoordinateFormat.D;
        }

        if (format == null) {
            throw new CoordinateParseException(Reason.INVALID_FORMAT, INVALID_FORMAT_MESSAGE);
        }

        final String remainder = matcher.group("remainder") == null
                ? ""
                : matcher.group("remainder").trim();
        if (!allowRemainder && !remainder.isEmpty()) {
            throw new CoordinateParseException(Reason.INVALID_FORMAT, INVALID_FORMAT_MESSAGE);
        }

        final Direction direction = Direction.fromLetter(matcher.group("direction"));
        final double degrees = Double.parseDouble(matcher.group("degrees"));
        Double minutes = null;
        Double seconds = null;

        if (format == CoordinateFormat.DMS) {
            minutes = Double.parseDouble(matcher.group("minutes"));
            seconds = Double.parseDouble(matcher.group("seconds"));
            if (minutes >= 60) {
                throw new CoordinateParseException(Reason.INVALID_MINUTES, "Minutes must be between 0 and 59");
            }
            if (seconds >= 60) {
                throw new CoordinateParseException(
                        Reason.INVALID_SECONDS, "Seconds must be between 0 and 59.999...");
            }
        } else if (format == CoordinateFormat.DM) {
            minutes = Double.parseDouble(matcher.group("minutes"));
            if (minutes >= 60) {
                throw new CoordinateParseException(Reason.INVALID_MINUTES, "Minutes must be between 0 and 59.999...");
            }
        }

        checkDegrees(degrees, direction);

        final double decimal = toDecimalDegrees(degrees, minutes, seconds, direction);

        return new Coordinate(decimal, degrees, minutes, seconds, direction, format, remainder);
    }

    /**
     * Parses a single coordinate which must be written in decimal degrees and carry a direction.
     *
     * @param input e.g. {@code 40.44611° N}
     * @return the parsed coordinate
     * @throws CoordinateParseException if the coordinate is not in decimal degrees or lacks a direction
     */
    public static Coordinate parseDecimalCoordinate(String input) throws CoordinateParseException {
        final Coordinate coordinate = parseCoordinate(input);
        if (coordinate.format() != CoordinateFormat.D) {
            throw new CoordinateParseException(Reason.INVALID_FORMAT, "Expected decimal degrees format");
        }
        if (coordinate.direction() == null) {
            throw new CoordinateParseException(Reason.MISSING_DIRECTION, "Missing direction");
        }

        return coordinate;
    }

    /**
     * Parses a string holding both latitude and longitude.
     *
     * <p>Either two plain signed decimals ({@code 37.5, -122.5}, latitude first), or any number of
     * coordinate tokens, each with a direction letter which tells the axis it belongs to.</p>
     *
     * @param input the position
     * @return the signed decimal position
     * @throws CoordinateParseException if a token fails to parse, lacks a direction, an axis is given twice or
     *     is missing, or a value is out of range for its axis
     * @throws IllegalArgumentException if the input is blank
     */
    public static LatLon parseCoordinates(String input) throws CoordinateParseException {
        final String trimmed = requireNotBlank(input);

        final Matcher decimalPair = DECIMAL_PAIR.matcher(trimmed);
        if (decimalPair.matches()) {
            final double latitude = roundGpsDecimal(Double.parseDouble(decimalPair.group(1)));
            final double longitude = roundGpsDecimal(Double.parseDouble(decimalPair.group(2)));
            checkAxisRange(latitude, Axis.LATITUDE);
            checkAxisRange(longitude, Axis.LONGITUDE);
            return new LatLon(latitude, longitude);
        }

        Double latitude = null;
        Double longitude = null;
        String rest = trimmed;

        while (!rest.isBlank()) {
            final Coordinate coordinate = parseCoordinate(rest, true);
            final Direction direction = coordinate.direction();
            if (direction == null) {
                throw new CoordinateParseException(
                        Reason.MISSING_DIRECTION, "Direction is required for position parsing");
            }

            if (direction.axis() == Axis.LATITUDE) {
                if (latitude != null) {
                    throw new CoordinateParseException(Reason.DUPLICATE_AXIS, "Multiple latitude values found");
                }
                latitude = coordinate.decimal();
            } else {
                if (longitude != null) {
                    throw new CoordinateParseException(Reason.DUPLICATE_AXIS, "Multiple longitude values found");
                }
                longitude = coordinate.decimal();
            }

            rest = coordinate.remainder();
        }

        if (latitude == null || longitude == null) {
            final List<String> missing = new ArrayList<>();
            if (latitude == null) {
                missing.add(Axis.LATITUDE.toString());
            }
            if (longitude == null) {
                missing.add(Axis.LONGITUDE.toString());
            }
            throw new CoordinateParseException(Reason.MISSING_AXIS, "Missing " + String.join(" and ", missing));
        }

        return new LatLon(latitude, longitude);
    }

    /// Rounds to the precision kept for GPS values.
    public static double roundGpsDecimal(double decimal) {
        return NumberUtil.roundToDecimalPlaces(decimal, GPS_DECIMAL_PLACES);
    }

    static double toDecimalDegrees(
            double degrees, @Nullable Double minutes, @Nullable Double seconds, @Nullable Direction direction)
            throws CoordinateParseException {
        double decimal = Math.abs(degrees);
        if (minutes != null) {
            decimal += Math.abs(minutes) / 60.0;
        }
        if (seconds != null) {
            decimal += Math.abs(seconds) / 3600.0;
        }

        final boolean negative = direction != null ? direction.isNegative() : degrees < 0;
        if (negative) {
            decimal = -decimal;
        }

        final Axis axis = direction == null ? Axis.LONGITUDE : direction.axis();
        checkAxisRange(decimal, axis);

        return roundGpsDecimal(decimal);
    }

    private static void checkDegrees(double degrees, @Nullable Direction direction) throws CoordinateParseException {
        final int max = direction == null ? Axis.LONGITUDE.maxDegrees() : direction.axis().maxDegrees();
        if (Math.abs(degrees) > max) {
            final String suffix = direction == null ? "" : " for " + direction + " direction";
            throw new CoordinateParseException(
                    Reason.INVALID_DEGREES, "Degrees must be between -" + max + " and " + max + suffix);
        }
    }

    private static void checkAxisRange(double decimal, Axis axis) throws CoordinateParseException {
        if (Math.abs(decimal) > axis.maxDegrees()) {
            throw new CoordinateParseException(
                    Reason.INVALID_DEGREES,
                    String.format(
                            Locale.ROOT,
                            "Degrees must be between -%d and %d for %s",
                            axis.maxDegrees(),
                            axis.maxDegrees(),
                            axis));
        }
    }

    private static String requireNotBlank(@Nullable String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Input string cannot be empty");
        }

        return input.trim();
    }
}
