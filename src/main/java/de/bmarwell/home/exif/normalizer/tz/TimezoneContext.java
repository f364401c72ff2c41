/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tz;

import de.bmarwell.home.exif.normalizer.gps.GpsLocationTags;
import de.bmarwell.home.exif.normalizer.gps.GpsReconciler;
import de.bmarwell.home.exif.normalizer.gps.GpsResult;
import de.bmarwell.home.exif.normalizer.tags.RawTags;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/// State of reading one file: the GPS reconciliation and the timezone are computed at most once.
///
/// Not thread safe. Each file gets its own context.
public final class TimezoneContext {

    private final RawTags tags;
    private final TzOptions options;
    private final List<String> warnings = new ArrayList<>();

    private @Nullable GpsResult gps;
    private @Nullable TzSource timezone;
    private boolean timezoneResolved;

    public TimezoneContext(RawTags tags, TzOptions options) {
        this.tags = tags;
        this.options = options;
    }

    public RawTags tags() {
        return this.tags;
    }

    public TzOptions options() {
        return this.options;
    }

    public GpsResult gps() {
        if (this.gps == null) {
            this.gps = GpsReconciler.reconcile(GpsLocationTags.from(this.tags), this.options.ignoreZeroZeroLatLon());
        }

        return this.gps;
    }

    public @Nullable TzSource timezone() {
        if (!this.timezoneResolved) {
            this.timezone = TimezoneResolver.resolve(this);
            this.timezoneResolved = true;
        }

        return this.timezone;
    }

    void addWarning(String warning) {
        this.warnings.add(warning);
    }

    /// Warnings of the timezone strategies. GPS warnings are part of [#gps()].
    public List<String> warnings() {
        return List.copyOf(this.warnings);
    }
}
