/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tags;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bmarwell.home.exif.normalizer.time.DateTimeWithZone;
import de.bmarwell.home.exif.normalizer.time.PartialDate;
import de.bmarwell.home.exif.normalizer.time.PartialTime;
import de.bmarwell.home.exif.normalizer.tz.TzSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Reads the output of `exiftool -json` and writes normalized tags as JSON.
public final class ExifToolJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, Object>> TAG_MAP = new TypeReference<>() {};

    private ExifToolJson() {
        // util
    }

    public static List<RawTags> read(Path jsonFile) throws IOException {
        return parse(Files.readString(jsonFile));
    }

    /**
     * Parses ExifTool JSON output.
     *
     * @param json an array of objects, one per file, as written by {@code exiftool -json}; a single object is
     *     accepted as well
     * @return one tag bag per file
     * @throws IOException if the input is not JSON or not an object or array of objects
     */
    public static List<RawTags> parse(String json) throws IOException {
        final JsonNode root = MAPPER.readTree(json);
        if (root == null || root.isMissingNode()) {
            return List.of();
        }

        if (root.isObject()) {
            return List.of(new RawTags(MAPPER.convertValue(root, TAG_MAP)));
        }

        if (!root.isArray()) {
            throw new IOException("Expected a JSON array of tag objects, got: " + root.getNodeType());
        }

        final List<RawTags> result = new ArrayList<>();
        for (final JsonNode element : root) {
            if (!element.isObject()) {
                throw new IOException("Expected a JSON object per file, got: " + element.getNodeType());
            }

            result.add(new RawTags(MAPPER.convertValue(element, TAG_MAP)));
        }

        return List.copyOf(result);
    }

    /**
     * Renders normalized tags. Date and time values are rendered in ISO format.
     *
     * @param tags the normalized tags
     * @return an object with all tag values plus {@code tz}, {@code tzSource} and {@code warnings}
     */
    public static ObjectNode toJson(NormalizedTags tags) {
        final ObjectNode node = MAPPER.createObjectNode();
        tags.values().forEach((key, value) -> node.set(key, toJsonValue(value)));

        final TzSource tzSource = tags.tzSource();
        if (tzSource != null) {
            node.put("tz", tzSource.zoneName());
            node.put("tzSource", tzSource.source());
        }

        if (!tags.warnings().isEmpty()) {
            final ArrayNode warnings = node.putArray("warnings");
            tags.warnings().forEach(warnings::add);
        }

        return node;
    }

    public static String toJsonString(NormalizedTags tags) throws IOException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(tags));
    }

    private static JsonNode toJsonValue(Object value) {
        if (value instanceof DateTimeWithZone dateTime) {
            return MAPPER.getNodeFactory().textNode(dateTime.toIsoString());
        }

        if (value instanceof PartialDate date) {
            return MAPPER.getNodeFactory().textNode(date.toIsoString());
        }

        if (value instanceof PartialTime time) {
            return MAPPER.getNodeFactory().textNode(time.toIsoString());
        }

        return MAPPER.valueToTree(value);
    }
}
