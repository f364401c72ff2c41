/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tags;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bmarwell.home.exif.normalizer.tz.TzOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExifToolJsonTest {

    @TempDir
    Path tempDir;

    @Test
    void testParse_array() throws IOException {
        // given
        final String json = """
                [
                  {"SourceFile": "a.jpg", "DateTimeOriginal": "2016:07:18 09:54:03", "ISO": 100},
                  {"SourceFile": "b.mp4", "MIMEType": "video/mp4"}
                ]
                """;

        // when
        final List<RawTags> result = ExifToolJson.parse(json);

        // then
        assertEquals(2, result.size());
        assertEquals("a.jpg", result.get(0).sourceFile());
        assertEquals("2016:07:18 09:54:03", result.get(0).getString("DateTimeOriginal"));
        assertEquals(100.0, result.get(0).getDouble("ISO"));
        assertTrue(result.get(1).isVideo());
    }

    @Test
    void testParse_singleObject() throws IOException {
        final List<RawTags> result = ExifToolJson.parse("{\"SourceFile\": \"a.jpg\", \"Make\": \"Apple\"}");

        assertEquals(1, result.size());
        assertEquals("Apple", result.get(0).getString("Make"));
    }

    @Test
    void testParse_rejectsOtherJson() {
        assertThrows(IOException.class, () -> ExifToolJson.parse("42"));
        assertThrows(IOException.class, () -> ExifToolJson.parse("[1, 2]"));
        assertThrows(IOException.class, () -> ExifToolJson.parse("{not json"));
    }

    @Test
    void testRead_file() throws IOException {
        // given
        final Path jsonFile = this.tempDir.resolve("tags.json");
        Files.writeString(jsonFile, "[{\"SourceFile\": \"c.jpg\"}]");

        // when
        final List<RawTags> result = ExifToolJson.read(jsonFile);

        // then
        assertEquals(1, result.size());
        assertEquals("c.jpg", result.get(0).sourceFile());
    }

    @Test
    void testToJson_rendersDatesAndZone() {
        // given
        final RawTags tags = new RawTags(Map.of(
                "DateTimeOriginal", "2016:07:18 09:54:03",
                "OffsetTimeOriginal", "+02:00",
                "GPSDateStamp", "2016:07:18",
                "Make", "Apple"));
        final NormalizedTags normalized = new TagNormalizer(TzOptions.defaults()).normalize(tags);

        // when
        final ObjectNode node = ExifToolJson.toJson(normalized);

        // then
        assertEquals("2016-07-18T09:54:03+02:00", node.get("DateTimeOriginal").asText());
        assertEquals("2016-07-18", node.get("GPSDateStamp").asText());
        assertEquals("+02:00", node.get("OffsetTimeOriginal").asText());
        assertEquals("Apple", node.get("Make").asText());
        assertEquals("UTC+2", node.get("tz").asText());
        assertEquals("OffsetTimeOriginal", node.get("tzSource").asText());
        assertFalse(node.has("warnings"));
    }

    @Test
    void testToJsonString_withWarnings() throws IOException {
        // given
        final RawTags tags = new RawTags(Map.of("GPSLatitude", 0, "GPSLongitude", 0, "ISO", 200));
        final NormalizedTags normalized = new TagNormalizer(TzOptions.defaults()).normalize(tags);

        // when
        final JsonNode node = new ObjectMapper().readTree(ExifToolJson.toJsonString(normalized));

        // then
        assertEquals(200, node.get("ISO").asInt());
        assertFalse(node.has("GPSLatitude"));
        assertFalse(node.has("tz"));
        assertTrue(node.get("warnings").isArray());
        assertEquals(
                "Ignoring zero coordinates from GPSLatitude/GPSLongitude",
                node.get("warnings").get(0).asText());
    }
}
