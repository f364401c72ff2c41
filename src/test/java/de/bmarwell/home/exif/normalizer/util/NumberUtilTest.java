/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class NumberUtilTest {

    @ParameterizedTest
    @ValueSource(strings = {"1", "-1", "+2.5", "0.000001", ".5", "1e-7", " 37.7749 "})
    void testIsNumeric_acceptsPlainNumbers(String input) {
        assertTrue(NumberUtil.isNumeric(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "N", "37 deg", "1,5", "NaN", "Infinity", "--1"})
    void testIsNumeric_rejectsEverythingElse(String input) {
        assertFalse(NumberUtil.isNumeric(input));
    }

    @Test
    void testIsNumber_rejectsNonFinite() {
        assertTrue(NumberUtil.isNumber(3));
        assertTrue(NumberUtil.isNumber(-1.5d));
        assertFalse(NumberUtil.isNumber(Double.NaN));
        assertFalse(NumberUtil.isNumber(Float.POSITIVE_INFINITY));
        assertFalse(NumberUtil.isNumber("3"));
        assertFalse(NumberUtil.isNumber(null));
    }

    @Test
    void testToDouble_numbersAndStrings() {
        assertEquals(37.7749, NumberUtil.toDouble("37.7749"));
        assertEquals(-122.5, NumberUtil.toDouble(-122.5f));
        assertEquals(7.0, NumberUtil.toDouble(7));
        assertNull(NumberUtil.toDouble("37 deg"));
        assertNull(NumberUtil.toDouble(Double.NaN));
        assertNull(NumberUtil.toDouble(null));
    }

    @Test
    void testToInt_floorsFractions() {
        assertEquals(3, NumberUtil.toInt(3.9));
        assertEquals(-4, NumberUtil.toInt(-3.1));
        assertEquals(12, NumberUtil.toInt(" 12 "));
        assertNull(NumberUtil.toInt("12.5"));
        assertNull(NumberUtil.toInt("99999999999"));
        assertNull(NumberUtil.toInt(1e20));
    }

    @Test
    void testRoundToDecimalPlaces_halfUp() {
        assertEquals(-122.419403, NumberUtil.roundToDecimalPlaces(-122.41940277777778, 6));
        assertEquals(0.5, NumberUtil.roundToDecimalPlaces(0.45, 1));
        assertTrue(Double.isNaN(NumberUtil.roundToDecimalPlaces(Double.NaN, 2)));
    }

    @Test
    void testToPlainString_noExponent() {
        assertEquals("91", NumberUtil.toPlainString(91.0));
        assertEquals("0.0000001", NumberUtil.toPlainString(1e-7));
        assertEquals("-122.419403", NumberUtil.toPlainString(-122.419403));
        assertEquals("42", NumberUtil.toPlainString(42L));
    }
}
