/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.time;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ZonesTest {

    @ParameterizedTest
    @ValueSource(strings = {"UCT", "GB", "Japan", "US/Hawaii", "America/Los_Angeles", "America/Argentina/Buenos_Aires"})
    void testNormalizeZone_acceptsIanaNames(String name) {
        assertNotNull(Zones.normalizeZone(name), name);
    }

    @ParameterizedTest
    @ValueSource(strings = {"BAD", "GMT/invalid", "UTC+21", "UTC-15", "+BAD", "+1", "UTC-00:01", " "})
    void testNormalizeZone_rejectsGarbage(String name) {
        assertNull(Zones.normalizeZone(name), name);
    }

    @ParameterizedTest
    @CsvSource({"Z,UTC", "Zulu,UTC", "GMT,UTC", "UTC,UTC", "Etc/UTC,UTC", "UTC+7,UTC+7", "UTC-9:30,UTC-9:30",
        "UTC+05:45,UTC+5:45", "Europe/Berlin,Europe/Berlin"})
    void testNormalizeZone_canonicalNames(String input, String expected) {
        final ZoneId zone = Zones.normalizeZone(input);

        assertNotNull(zone, input);
        assertEquals(expected, Zones.zoneName(zone));
    }

    @Test
    void testNormalizeZone_fixedOffsetRegionsBecomeOffsets() {
        assertEquals(ZoneOffset.UTC, Zones.normalizeZone(ZoneId.of("UTC")));
        assertEquals(ZoneOffset.ofHours(-5), Zones.normalizeZone(ZoneId.of("Etc/GMT+5")));
        assertNull(Zones.normalizeZone(ZoneOffset.ofHoursMinutes(0, -1)));
        assertNull(Zones.normalizeZone(ZoneOffset.ofHours(-12)));
    }

    @Test
    void testOffsetMinutesToZoneName() {
        assertEquals("UTC", Zones.offsetMinutesToZoneName(0));
        assertEquals("UTC+7", Zones.offsetMinutesToZoneName(420));
        assertEquals("UTC-9:30", Zones.offsetMinutesToZoneName(-570));
        assertEquals("UTC+13:45", Zones.offsetMinutesToZoneName(825));
        assertNull(Zones.offsetMinutesToZoneName(-1));
        assertNull(Zones.offsetMinutesToZoneName(15 * 60));
    }

    @Test
    void testFormatOffset() {
        assertEquals("+00:00", Zones.formatOffset(0));
        assertEquals("-07:00", Zones.formatOffset(-420));
        assertEquals("+05:30", Zones.formatOffset(330));
    }

    @Test
    void testExtractZone_offsetString() {
        // when
        final ExtractedZone zone = Zones.extractZone("+09:00");

        // then
        assertNotNull(zone);
        assertEquals("UTC+9", zone.zoneName());
        assertEquals(ZoneOffset.ofHours(9), zone.zone());
        assertEquals("", zone.leftovers());
        assertEquals("offsetMinutesToZoneName", zone.source());
    }

    @Test
    void testExtractZone_hourOffsets() {
        final ExtractedZone plusThree = Zones.extractZone(3);
        assertNotNull(plusThree);
        assertEquals("UTC+3", plusThree.zoneName());
        assertEquals("hourOffset", plusThree.source());

        final ExtractedZone minusTen = Zones.extractZone(-10);
        assertNotNull(minusTen);
        assertEquals("UTC-10", minusTen.zoneName());

        final ExtractedZone halfHour = Zones.extractZone(5.5);
        assertNotNull(halfHour);
        assertEquals("UTC+5:30", halfHour.zoneName());

        assertNull(Zones.extractZone(0.1));
        assertNull(Zones.extractZone(15));
    }

    @Test
    void testExtractZone_trailingOffsetKeepsLeftovers() {
        final ExtractedZone zone = Zones.extractZone("2014:07:17 08:46:27-07:00");

        assertNotNull(zone);
        assertEquals("UTC-7", zone.zoneName());
        assertEquals("2014:07:17 08:46:27", zone.leftovers());
    }

    @Test
    void testExtractZone_trailingZ() {
        final ExtractedZone zone = Zones.extractZone("2016:07:18 07:41:01Z");

        assertNotNull(zone);
        assertEquals("UTC", zone.zoneName());
        assertEquals("Z", zone.source());
        assertEquals("2016:07:18 07:41:01", zone.leftovers());
    }

    @Test
    void testExtractZone_abbreviationIsStripped() {
        final ExtractedZone zone = Zones.extractZone("2014:07:17 08:46:27-07:00 DST");

        assertNotNull(zone);
        assertEquals("UTC-7", zone.zoneName());
    }

    @Test
    void testExtractZone_ianaName() {
        final ExtractedZone zone = Zones.extractZone("America/New_York");

        assertNotNull(zone);
        assertEquals("America/New_York", zone.zoneName());
        assertNull(zone.leftovers());
        assertEquals("normalizeZone", zone.source());
    }

    @Test
    void testExtractZone_listUsesFirstElement() {
        final ExtractedZone zone = Zones.extractZone(Arrays.asList(null, "-05:00", "+02:00"));

        assertNotNull(zone);
        assertEquals("UTC-5", zone.zoneName());
    }

    @Test
    void testExtractZone_dateTimeWithZone() {
        final DateTimeWithZone value =
                DateTimeWithZone.of(LocalDateTime.of(2020, 5, 6, 7, 8, 9), ZoneOffset.ofHours(2));

        final ExtractedZone zone = Zones.extractZone(value);

        assertNotNull(zone);
        assertEquals("UTC+2", zone.zoneName());
        assertEquals("DateTimeWithZone.zone", zone.source());
    }

    @Test
    void testExtractZone_noZone() {
        assertNull(Zones.extractZone(null));
        assertNull(Zones.extractZone(true));
        assertNull(Zones.extractZone("2014:07:17 08:46:27"));
        assertNull(Zones.extractZone("UTC-00:01"));
        assertNull(Zones.extractZone(new PartialDate(2020, 1, 1)));
        assertNull(Zones.extractZone(List.of()));
    }

    @Test
    void testIsUtc() {
        assertTrue(Zones.isUtc("UTC"));
        assertTrue(Zones.isUtc("gmt"));
        assertTrue(Zones.isUtc("+00:00"));
        assertTrue(Zones.isUtc(0));
        assertTrue(Zones.isUtc(ZoneOffset.UTC));
        assertTrue(Zones.isUtc(ZoneId.of("Etc/UTC")));
        assertFalse(Zones.isUtc("UTC+1"));
        assertFalse(Zones.isUtc(ZoneId.of("Europe/London")));
        assertFalse(Zones.isUtc(null));
    }

    @Test
    void testInferLikelyOffsetMinutes() {
        assertEquals(-420, Zones.inferLikelyOffsetMinutes(-396.95));
        assertEquals(120, Zones.inferLikelyOffsetMinutes(132.97));
        assertEquals(330, Zones.inferLikelyOffsetMinutes(330));
        assertEquals(0, Zones.inferLikelyOffsetMinutes(-3));
        assertEquals(14 * 60, Zones.inferLikelyOffsetMinutes(15 * 60));
        assertEquals(2_000, Zones.inferLikelyOffsetMinutes(2_000.2));
    }

    @Test
    void testStripTimeZoneAbbreviation() {
        assertEquals("2014:07:17 08:46:27-07:00", Zones.stripTimeZoneAbbreviation("2014:07:17 08:46:27-07:00 DST"));
        assertEquals("2016:07:18 07:41:01 UTC", Zones.stripTimeZoneAbbreviation("2016:07:18 07:41:01 UTC"));
        assertEquals("2016:07:18 07:41:01", Zones.stripTimeZoneAbbreviation("2016:07:18 07:41:01"));
    }
}
