/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tags;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RawTagsTest {

    @Test
    void testGet_fallsBackToGroupedKey() {
        final RawTags tags = new RawTags(Map.of("EXIF:DateTimeOriginal", "2016:07:18 09:54:03"));

        assertEquals("2016:07:18 09:54:03", tags.get("DateTimeOriginal"));
        assertTrue(tags.has("DateTimeOriginal"));
        assertNull(tags.get("CreateDate"));
    }

    @Test
    void testGet_plainKeyWins() {
        final RawTags tags = new RawTags(Map.of("XMP:Make", "Other", "Make", "Apple"));

        assertEquals("Apple", tags.get("Make"));
    }

    @Test
    void testNew_dropsNullValues() {
        // given
        final Map<String, Object> values = new HashMap<>();
        values.put("Make", null);
        values.put("Model", "iPhone");

        // when
        final RawTags tags = new RawTags(values);

        // then
        assertEquals(List.of("Model"), List.copyOf(tags.keys()));
        assertEquals(1, tags.size());
    }

    @Test
    void testGetString_rendersNumbersPlain() {
        final RawTags tags = new RawTags(Map.of("GPSLatitude", 1.0E-7, "ISO", 100));

        assertEquals("0.0000001", tags.getString("GPSLatitude"));
        assertEquals("100", tags.getString("ISO"));
        assertEquals(100.0, tags.getDouble("ISO"));
    }

    @Test
    void testLocalName() {
        assertEquals("DateTimeOriginal", RawTags.localName("EXIF:DateTimeOriginal"));
        assertEquals("DateTimeOriginal", RawTags.localName("DateTimeOriginal"));
    }

    @Test
    void testIsVideo() {
        assertTrue(new RawTags(Map.of("MIMEType", "Video/MP4")).isVideo());
        assertFalse(new RawTags(Map.of("MIMEType", "image/heic")).isVideo());
        assertFalse(new RawTags(Map.of()).isVideo());
    }
}
