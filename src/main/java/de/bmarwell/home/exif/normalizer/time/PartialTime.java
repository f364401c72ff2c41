/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.time;

import de.bmarwell.home.exif.normalizer.util.StringUtil;
import java.time.LocalTime;
import org.jspecify.annotations.Nullable;

/**
 * A time of day without date and zone, e.g. from {@code GPSTimeStamp}.
 *
 * @param hour 0 to 23
 * @param minute 0 to 59
 * @param second 0 to 59
 * @param millisecond 0 to 999, or {@code null} if the source had no sub-seconds
 */
public record PartialTime(int hour, int minute, int second, @Nullable Integer millisecond) {

    public PartialTime {
        LocalTime.of(hour, minute, second);
        if (millisecond != null && (millisecond < 0 || millisecond > 999)) {
            throw new IllegalArgumentException("Millisecond must be between 0 and 999: " + millisecond);
        }
    }

    public LocalTime toLocalTime() {
        final int millis = this.millisecond == null ? 0 : this.millisecond;
        return LocalTime.of(this.hour, this.minute, this.second, millis * 1_000_000);
    }

    /// @return `HH:MM:SS[.fff]`
    public String toExifString() {
        return StringUtil.pad2(this.hour)
                + ":"
                + StringUtil.pad2(this.minute)
                + ":"
                + StringUtil.pad2(this.second)
                + FractionalSeconds.render(this.millisecond);
    }

    /// Same as [#toExifString()], times have no separate ISO form.
    public String toIsoString() {
        return toExifString();
    }

    @Override
    public String toString() {
        return toIsoString();
    }
}
