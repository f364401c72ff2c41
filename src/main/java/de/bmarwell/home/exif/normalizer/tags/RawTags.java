/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tags;

import de.bmarwell.home.exif.normalizer.util.NumberUtil;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The tags of one file, as read from ExifTool's JSON output or from metadata-extractor.
 *
 * <p>Keys may carry a group prefix like {@code EXIF:DateTimeOriginal} (ExifTool's {@code -G} option). Lookups by
 * the plain tag name fall back to the first grouped key with that name.</p>
 */
public final class RawTags {

    public static final String SOURCE_FILE = "SourceFile";
    public static final String MIME_TYPE = "MIMEType";

    private final Map<String, Object> values;

    public RawTags(Map<String, ?> values) {
        final Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        this.values = Collections.unmodifiableMap(copy);
    }

    /// @return the tag name without group prefix, e.g. `DateTimeOriginal` for `EXIF:DateTimeOriginal`
    public static String localName(String key) {
        final int colon = key.lastIndexOf(':');
        return colon < 0 ? key : key.substring(colon + 1);
    }

    public @Nullable Object get(String name) {
        final Object direct = this.values.get(name);
        if (direct != null) {
            return direct;
        }

        final String suffix = ":" + name;
        for (final Map.Entry<String, Object> entry : this.values.entrySet()) {
            if (entry.getKey().endsWith(suffix)) {
                return entry.getValue();
            }
        }

        return null;
    }

    /// @return the value as text; numbers are rendered without exponent
    public @Nullable String getString(String name) {
        final Object value = get(name);
        if (value == null) {
            return null;
        }

        if (value instanceof Number number) {
            return NumberUtil.toPlainString(number);
        }

        return value.toString();
    }

    public @Nullable Double getDouble(String name) {
        return NumberUtil.toDouble(get(name));
    }

    public boolean has(String name) {
        return get(name) != null;
    }

    public @Nullable String sourceFile() {
        return getString(SOURCE_FILE);
    }

    public boolean isVideo() {
        final String mimeType = getString(MIME_TYPE);
        return mimeType != null && mimeType.trim().toLowerCase(Locale.ROOT).startsWith("video/");
    }

    /// The keys as given, including group prefixes, in input order.
    public Set<String> keys() {
        return this.values.keySet();
    }

    public Map<String, Object> asMap() {
        return this.values;
    }

    public int size() {
        return this.values.size();
    }

    @Override
    public String toString() {
        return "RawTags{" + this.values + "}";
    }
}
