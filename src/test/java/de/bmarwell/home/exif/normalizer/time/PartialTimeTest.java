/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.time;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.DateTimeException;
import java.time.LocalTime;
import org.junit.jupiter.api.Test;

class PartialTimeTest {

    @Test
    void testRender_withMilliseconds() {
        final PartialTime time = new PartialTime(7, 4, 3, 79);

        assertEquals("07:04:03.079", time.toExifString());
        assertEquals("07:04:03.079", time.toIsoString());
        assertEquals(LocalTime.of(7, 4, 3, 79_000_000), time.toLocalTime());
    }

    @Test
    void testRender_withoutMilliseconds() {
        final PartialTime time = new PartialTime(23, 59, 41, null);

        assertEquals("23:59:41", time.toExifString());
        assertEquals(LocalTime.of(23, 59, 41), time.toLocalTime());
    }

    @Test
    void testConstructor_rejectsOutOfRange() {
        assertThrows(DateTimeException.class, () -> new PartialTime(24, 0, 0, null));
        assertThrows(DateTimeException.class, () -> new PartialTime(12, 60, 0, null));
        assertThrows(IllegalArgumentException.class, () -> new PartialTime(12, 0, 0, 1000));
    }
}
