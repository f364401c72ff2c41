/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.time;

import de.bmarwell.home.exif.normalizer.util.StringUtil;
import java.time.LocalDate;

/**
 * A date without time and zone, e.g. from {@code GPSDateStamp} or {@code DateCreated}.
 *
 * @param year the full year
 * @param month 1 to 12
 * @param day 1 to 31
 */
public record PartialDate(int year, int month, int day) {

    public PartialDate {
        // throws for impossible dates like the 30th of February
        LocalDate.of(year, month, day);
    }

    public static PartialDate of(LocalDate date) {
        return new PartialDate(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    public LocalDate toLocalDate() {
        return LocalDate.of(this.year, this.month, this.day);
    }

    /// @return `YYYY:MM:DD`
    public String toExifString() {
        return render(":");
    }

    /// @return `YYYY-MM-DD`
    public String toIsoString() {
        return render("-");
    }

    private String render(String separator) {
        return StringUtil.pad4(this.year) + separator + StringUtil.pad2(this.month) + separator + StringUtil.pad2(this.day);
    }

    @Override
    public String toString() {
        return toIsoString();
    }
}
