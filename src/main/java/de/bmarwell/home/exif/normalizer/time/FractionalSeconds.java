/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.time;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

public final class FractionalSeconds {

    private FractionalSeconds() {
        // util
    }

    /// @return `""` if there are no milliseconds, otherwise e.g. `.768` or `.079`
    public static String render(@Nullable Integer millisecond) {
        if (millisecond == null) {
            return "";
        }

        return String.format(Locale.ROOT, ".%03d", millisecond);
    }

    /// Milliseconds of the given nano-of-second, truncated.
    static int toMillisecond(int nanoOfSecond) {
        return nanoOfSecond / 1_000_000;
    }
}
