/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.time;

import de.bmarwell.home.exif.normalizer.util.StringUtil;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A date and time with an optional zone.
 *
 * <p>Instances are immutable. A missing zone stays missing: the wall clock is never silently interpreted in the
 * system zone. Milliseconds are tracked separately from the wall clock, so that a value without sub-seconds
 * renders without them.</p>
 *
 * <p>Two instances are equal if they have the same wall clock, the same milliseconds (or lack of) and the same
 * offset (or lack of). The raw value, the zone id and the inferred flag are not compared.</p>
 */
public final class DateTimeWithZone {

    private static final LocalDateTime EPOCH = LocalDateTime.of(1970, 1, 1, 0, 0);

    private final LocalDateTime localDateTime;
    private final @Nullable Integer millisecond;
    private final @Nullable ZoneId zone;
    private final @Nullable String rawValue;
    private final boolean inferredZone;

    private DateTimeWithZone(
            LocalDateTime localDateTime,
            @Nullable Integer millisecond,
            @Nullable ZoneId zone,
            @Nullable String rawValue,
            boolean inferredZone) {
        final int nanos = millisecond == null ? 0 : millisecond * 1_000_000;
        this.localDateTime = localDateTime.withNano(nanos);
        this.millisecond = millisecond;
        this.zone = zone;
        this.rawValue = rawValue;
        this.inferredZone = zone != null && inferredZone;
    }

    /**
     * Creates a new instance.
     *
     * @param localDateTime the wall clock; sub-seconds are replaced by {@code millisecond}
     * @param millisecond 0 to 999, or {@code null} if the source had no sub-seconds
     * @param zone the zone; dropped if it cannot be normalized
     * @param rawValue the text this value was parsed from
     * @param inferredZone whether the zone was supplied as a default rather than found in {@code rawValue}
     * @return the value, or {@code null} for placeholder values (year 0 or 1, or the epoch itself)
     */
    public static @Nullable DateTimeWithZone of(
            LocalDateTime localDateTime,
            @Nullable Integer millisecond,
            @Nullable ZoneId zone,
            @Nullable String rawValue,
            boolean inferredZone) {
        if (millisecond != null && (millisecond < 0 || millisecond > 999)) {
            throw new IllegalArgumentException("Millisecond must be between 0 and 999: " + millisecond);
        }

        final ZoneId normalized = Zones.normalizeZone(zone);
        final DateTimeWithZone result =
                new DateTimeWithZone(localDateTime, millisecond, normalized, rawValue, inferredZone);

        return result.isPlaceholder() ? null : result;
    }

    public static @Nullable DateTimeWithZone of(LocalDateTime localDateTime, @Nullable ZoneId zone) {
        final int nanos = localDateTime.getNano();
        final Integer millisecond = nanos == 0 ? null : FractionalSeconds.toMillisecond(nanos);

        return of(localDateTime, millisecond, zone, null, false);
    }

    /**
     * Creates an instance from epoch milliseconds.
     *
     * @param epochMillis milliseconds since 1970-01-01T00:00:00Z
     * @param zone the zone to express the instant in; without one, the system wall clock is used and the
     *     result has no zone
     * @return the value, or {@code null} for placeholder values
     */
    public static @Nullable DateTimeWithZone fromEpochMillis(long epochMillis, @Nullable ZoneId zone) {
        final Instant instant = Instant.ofEpochMilli(epochMillis);
        final ZoneId normalized = Zones.normalizeZone(zone);
        final LocalDateTime local =
                LocalDateTime.ofInstant(instant, normalized == null ? ZoneId.systemDefault() : normalized);
        final int millisecond = (int) Math.floorMod(epochMillis, 1000L);

        return of(local, millisecond, normalized, null, false);
    }

    public static DateTimeWithZone now(@Nullable ZoneId zone) {
        return Objects.requireNonNull(fromEpochMillis(System.currentTimeMillis(), zone));
    }

    private boolean isPlaceholder() {
        final int year = this.localDateTime.getYear();
        if (year == 0 || year == 1) {
            return true;
        }

        final Integer offset = offsetMinutes();
        return (offset == null || offset == 0) && EPOCH.equals(this.localDateTime);
    }

    /// The wall clock, including milliseconds.
    public LocalDateTime toLocalDateTime() {
        return this.localDateTime;
    }

    public @Nullable Integer millisecond() {
        return this.millisecond;
    }

    public @Nullable ZoneId zone() {
        return this.zone;
    }

    public boolean hasZone() {
        return this.zone != null;
    }

    /// @return the canonical zone name, e.g. `UTC-7` or `Europe/Berlin`, or `null` without a zone
    public @Nullable String zoneName() {
        return this.zone == null ? null : Zones.zoneName(this.zone);
    }

    /// @return the offset from UTC at this wall clock, or `null` without a zone
    public @Nullable Integer offsetMinutes() {
        if (this.zone == null) {
            return null;
        }

        return this.zone.getRules().getOffset(this.localDateTime).getTotalSeconds() / 60;
    }

    public @Nullable String rawValue() {
        return this.rawValue;
    }

    /// Whether the zone was a default rather than part of the raw value.
    public boolean inferredZone() {
        return this.inferredZone;
    }

    /// @return the instant, or `null` without a zone
    public @Nullable Instant toInstant() {
        return this.zone == null ? null : this.localDateTime.atZone(this.zone).toInstant();
    }

    /// Seconds since the epoch, reading the wall clock as UTC if there is no zone.
    public long toEpochSecondsOrLocal() {
        final Instant instant = toInstant();
        return instant != null ? instant.getEpochSecond() : this.localDateTime.toEpochSecond(ZoneOffset.UTC);
    }

    /**
     * Moves this value into another zone.
     *
     * <p>Without a zone, the wall clock is kept and only the zone is attached. With a zone, the instant is kept
     * and the wall clock converted.</p>
     *
     * @param newZone the target zone
     * @return the new value, with {@link #inferredZone()} set if the wall clock was kept
     * @throws IllegalArgumentException if the zone is not a valid offset
     */
    public DateTimeWithZone withZone(ZoneId newZone) {
        final ZoneId normalized = Zones.normalizeZone(newZone);
        if (normalized == null) {
            throw new IllegalArgumentException("Invalid zone: " + newZone);
        }

        if (this.zone == null) {
            return new DateTimeWithZone(this.localDateTime, this.millisecond, normalized, this.rawValue, true);
        }

        final LocalDateTime converted =
                this.localDateTime.atZone(this.zone).withZoneSameInstant(normalized).toLocalDateTime();
        return new DateTimeWithZone(converted, this.millisecond, normalized, this.rawValue, this.inferredZone);
    }

    /// @throws IllegalArgumentException if the name is not a zone name, see [Zones#normalizeZone(String)]
    public DateTimeWithZone withZone(String zoneName) {
        final ZoneId normalized = Zones.normalizeZone(zoneName);
        if (normalized == null) {
            throw new IllegalArgumentException("Invalid zone: " + zoneName);
        }

        return withZone(normalized);
    }

    /// Adds the given duration. With a zone this is instant arithmetic, across DST changes.
    public DateTimeWithZone plus(Duration duration) {
        final LocalDateTime result;
        if (this.zone == null) {
            result = this.localDateTime.plus(duration);
        } else {
            final ZonedDateTime zoned = this.localDateTime.atZone(this.zone).plus(duration);
            result = zoned.toLocalDateTime();
        }

        final int resultMillis = FractionalSeconds.toMillisecond(result.getNano());
        final Integer millis = this.millisecond == null && resultMillis == 0 ? null : resultMillis;

        return new DateTimeWithZone(result, millis, this.zone, this.rawValue, this.inferredZone);
    }

    /// @return `YYYY:MM:DD HH:MM:SS[.fff][±HH:MM]`
    public String toExifString() {
        final Integer offset = offsetMinutes();
        return render(":", " ") + (offset == null ? "" : Zones.formatOffset(offset));
    }

    /// @return `YYYY-MM-DDTHH:MM:SS[.fff][±HH:MM]`, with `Z` for UTC
    public String toIsoString() {
        final Integer offset = offsetMinutes();
        final String suffix;
        if (offset == null) {
            suffix = "";
        } else if (offset == 0) {
            suffix = "Z";
        } else {
            suffix = Zones.formatOffset(offset);
        }

        return render("-", "T") + suffix;
    }

    private String render(String dateSeparator, String timeSeparator) {
        final LocalDateTime ldt = this.localDateTime;
        return StringUtil.pad4(ldt.getYear())
                + dateSeparator
                + StringUtil.pad2(ldt.getMonthValue())
                + dateSeparator
                + StringUtil.pad2(ldt.getDayOfMonth())
                + timeSeparator
                + StringUtil.pad2(ldt.getHour())
                + ":"
                + StringUtil.pad2(ldt.getMinute())
                + ":"
                + StringUtil.pad2(ldt.getSecond())
                + FractionalSeconds.render(this.millisecond);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DateTimeWithZone that)) {
            return false;
        }

        return this.localDateTime.equals(that.localDateTime)
                && Objects.equals(this.millisecond, that.millisecond)
                && Objects.equals(offsetMinutes(), that.offsetMinutes());
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.localDateTime, this.millisecond, offsetMinutes());
    }

    @Override
    public String toString() {
        return toIsoString();
    }
}
