/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringUtilTest {

    @Test
    void testIsBlank() {
        assertTrue(StringUtil.isBlank(null));
        assertTrue(StringUtil.isBlank(" \t"));
        assertFalse(StringUtil.isBlank("N"));
        assertFalse(StringUtil.isBlank(0));
        assertTrue(StringUtil.isNotBlank("N"));
    }

    @Test
    void testToNotBlank_trims() {
        assertEquals("W", StringUtil.toNotBlank("  W "));
        assertEquals("12", StringUtil.toNotBlank(12));
        assertNull(StringUtil.toNotBlank("   "));
        assertNull(StringUtil.toNotBlank(null));
    }

    @Test
    void testToS_nullIsEmpty() {
        assertEquals("", StringUtil.toS(null));
        assertEquals("1.5", StringUtil.toS(1.5));
    }

    @Test
    void testIsOnlyZeros() {
        assertTrue(StringUtil.isOnlyZeros("0"));
        assertTrue(StringUtil.isOnlyZeros(" 000 "));
        assertFalse(StringUtil.isOnlyZeros("0000:00:00"));
        assertFalse(StringUtil.isOnlyZeros(""));
        assertFalse(StringUtil.isOnlyZeros(null));
    }

    @Test
    void testPad() {
        assertEquals("07", StringUtil.pad2(7));
        assertEquals("12", StringUtil.pad2(12));
        assertEquals("0099", StringUtil.pad4(99));
        assertEquals("2016", StringUtil.pad4(2_016));
    }
}
