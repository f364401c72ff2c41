/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tz;

import java.util.List;

/// Tags holding the moment a photo or video was taken, most specific first.
public final class CapturedAtTagNames {

    public static final List<String> NAMES = List.of(
            "SubSecDateTimeOriginal",
            "DateTimeOriginal",
            "SubSecCreateDate",
            "CreationDate",
            "CreateDate",
            "SubSecMediaCreateDate",
            "MediaCreateDate",
            "DateTimeCreated");

    private CapturedAtTagNames() {
        // util
    }
}
