/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tz;

import de.bmarwell.home.exif.normalizer.tags.RawTags;
import de.bmarwell.home.exif.normalizer.time.Zones;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the zone of a file by trying each {@link TimezoneStrategy} in order.
 *
 * <p>The first strategy returning a zone that survives {@link Zones#normalizeZone(ZoneId)} wins. If no strategy
 * finds one, the file has no known zone and zoneless values are left as they are.</p>
 */
public final class TimezoneResolver {

    private static final Logger LOG = LoggerFactory.getLogger(TimezoneResolver.class);

    private TimezoneResolver() {
        // util
    }

    /// The strategies in the order they are tried.
    public static List<TimezoneStrategy> chain(TzOptions options) {
        final List<TimezoneStrategy> chain = new ArrayList<>();
        if (options.preferTimezoneInferenceFromGps()) {
            chain.add(TimezoneStrategy.GPS);
        }

        chain.add(TimezoneStrategy.EXPLICIT_OFFSET_TAGS);
        if (!options.preferTimezoneInferenceFromGps()) {
            chain.add(TimezoneStrategy.GPS);
        }

        chain.add(TimezoneStrategy.DATESTAMPS);
        chain.add(TimezoneStrategy.VIDEO_DEFAULT);
        chain.add(TimezoneStrategy.UTC_OFFSET);
        chain.add(TimezoneStrategy.TIMESTAMP);

        return List.copyOf(chain);
    }

    public static @Nullable TzSource resolve(RawTags tags, TzOptions options) {
        return new TimezoneContext(tags, options).timezone();
    }

    static @Nullable TzSource resolve(TimezoneContext context) {
        for (final TimezoneStrategy strategy : chain(context.options())) {
            final TzSource candidate = strategy.resolve(context);
            if (candidate == null) {
                continue;
            }

            final ZoneId zone = Zones.normalizeZone(candidate.zone());
            if (zone == null) {
                LOG.debug("Strategy [{}] returned unusable zone [{}], trying next.", strategy, candidate.zone());
                continue;
            }

            LOG.debug("Zone [{}] from strategy [{}] ({}).", candidate.zoneName(), strategy, candidate.source());
            return TzSource.of(zone, candidate.source());
        }

        LOG.debug("No zone found for [{}].", context.tags().sourceFile());
        return null;
    }
}
