/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tags;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.GeoLocation;
import com.drew.lang.Rational;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.Tag;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.drew.metadata.file.FileTypeDirectory;
import com.drew.metadata.mov.QuickTimeDirectory;
import com.drew.metadata.mp4.Mp4Directory;
import de.bmarwell.home.exif.normalizer.util.StringUtil;
import java.io.IOException;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.codec.binary.Base64;
import org.jspecify.annotations.Nullable;

/**
 * Builds {@link RawTags} from metadata-extractor directories, for files without ExifTool output.
 *
 * <p>Tags the normalizer understands get their ExifTool names ({@code DateTimeOriginal}, {@code GPSLatitude},
 * ...). All other tags are added as {@code Directory:TagName} with spaces and punctuation removed. Binary values
 * are Base64 encoded with a {@code base64:} prefix, as ExifTool does.</p>
 */
public final class MetadataExtractorTags {

    private static final DateTimeFormatter EXIF_DATE_TIME =
            DateTimeFormatter.ofPattern("uuuu:MM:dd HH:mm:ss", Locale.ROOT);

    private MetadataExtractorTags() {
        // util
    }

    public static RawTags read(Path file) throws IOException, ImageProcessingException {
        final Metadata metadata = ImageMetadataReader.readMetadata(file.toFile());

        final Map<String, Object> values = new LinkedHashMap<>();
        values.put(RawTags.SOURCE_FILE, file.toString());
        values.putAll(toMap(metadata));

        return new RawTags(values);
    }

    public static RawTags fromMetadata(Metadata metadata) {
        return new RawTags(toMap(metadata));
    }

    private static Map<String, Object> toMap(Metadata metadata) {
        final Map<String, Object> values = new LinkedHashMap<>();
        final Set<String> mapped = new HashSet<>();

        final FileTypeDirectory fileType = metadata.getFirstDirectoryOfType(FileTypeDirectory.class);
        if (fileType != null) {
            put(values, mapped, "MIMEType", fileType, FileTypeDirectory.TAG_DETECTED_FILE_MIME_TYPE);
        }

        // 1. Exif SubIFD
        final ExifSubIFDDirectory subIfd = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        if (subIfd != null) {
            put(values, mapped, "DateTimeOriginal", subIfd, ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL);
            put(values, mapped, "CreateDate", subIfd, ExifSubIFDDirectory.TAG_DATETIME_DIGITIZED);
            put(values, mapped, "OffsetTimeOriginal", subIfd, ExifSubIFDDirectory.TAG_TIME_ZONE_ORIGINAL);
            put(values, mapped, "OffsetTimeDigitized", subIfd, ExifSubIFDDirectory.TAG_TIME_ZONE_DIGITIZED);
            put(values, mapped, "SubSecTimeOriginal", subIfd, ExifSubIFDDirectory.TAG_SUBSECOND_TIME_ORIGINAL);
            putSubSecDateTimeOriginal(values);
        }

        // 2. Exif IFD0
        final ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        if (ifd0 != null) {
            put(values, mapped, "ModifyDate", ifd0, ExifIFD0Directory.TAG_DATETIME);
            put(values, mapped, "OffsetTime", ifd0, ExifIFD0Directory.TAG_TIME_ZONE);
        }

        // 3. GPS, with the reference letters as written
        final GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        if (gps != null) {
            putGps(values, mapped, gps);
        }

        // 4. MP4 and QuickTime store UTC without a zone
        final Mp4Directory mp4 = metadata.getFirstDirectoryOfType(Mp4Directory.class);
        if (mp4 != null) {
            put(values, mapped, "CreateDate", mp4, Mp4Directory.TAG_CREATION_TIME);
        }

        final QuickTimeDirectory quickTime = metadata.getFirstDirectoryOfType(QuickTimeDirectory.class);
        if (quickTime != null) {
            put(values, mapped, "CreateDate", quickTime, QuickTimeDirectory.TAG_CREATION_TIME);
        }

        for (final Directory directory : metadata.getDirectories()) {
            for (final Tag tag : directory.getTags()) {
                if (mapped.contains(handledKey(directory, tag.getTagType()))) {
                    continue;
                }

                final Object value = valueOf(directory, tag.getTagType());
                if (value != null) {
                    values.putIfAbsent(compact(directory.getName()) + ":" + compact(tag.getTagName()), value);
                }
            }
        }

        return values;
    }

    private static void put(Map<String, Object> values, Set<String> mapped, String name, Directory directory, int tagType) {
        final Object value = valueOf(directory, tagType);
        if (value == null) {
            return;
        }

        if (values.putIfAbsent(name, value) == null) {
            mapped.add(handledKey(directory, tagType));
        }
    }

    private static void putSubSecDateTimeOriginal(Map<String, Object> values) {
        final Object dateTime = values.get("DateTimeOriginal");
        final String subSec = StringUtil.toNotBlank(values.get("SubSecTimeOriginal"));
        if (dateTime == null || subSec == null) {
            return;
        }

        final String offset = StringUtil.toS(values.get("OffsetTimeOriginal")).trim();
        values.put("SubSecDateTimeOriginal", dateTime + "." + subSec + offset);
    }

    private static void putGps(Map<String, Object> values, Set<String> mapped, GpsDirectory gps) {
        putAxis(values, mapped, "GPSLatitude", gps, GpsDirectory.TAG_LATITUDE);
        put(values, mapped, "GPSLatitudeRef", gps, GpsDirectory.TAG_LATITUDE_REF);
        putAxis(values, mapped, "GPSLongitude", gps, GpsDirectory.TAG_LONGITUDE);
        put(values, mapped, "GPSLongitudeRef", gps, GpsDirectory.TAG_LONGITUDE_REF);
        put(values, mapped, "GPSDateStamp", gps, GpsDirectory.TAG_DATE_STAMP);

        final String timeStamp = formatTimeStamp(gps.getRationalArray(GpsDirectory.TAG_TIME_STAMP));
        if (timeStamp != null) {
            mapped.add(handledKey(gps, GpsDirectory.TAG_TIME_STAMP));
            values.put("GPSTimeStamp", timeStamp);
        }

        final String dateStamp = StringUtil.toNotBlank(values.get("GPSDateStamp"));
        if (dateStamp != null && timeStamp != null) {
            values.put("GPSDateTime", dateStamp + " " + timeStamp + "Z");
        }
    }

    /// Degrees, minutes and seconds as unsigned decimal degrees. The sign is in the reference tag.
    private static void putAxis(Map<String, Object> values, Set<String> mapped, String name, GpsDirectory gps, int tagType) {
        final Rational[] dms = gps.getRationalArray(tagType);
        if (dms == null || dms.length != 3) {
            return;
        }

        final Double decimal = GeoLocation.degreesMinutesSecondsToDecimal(dms[0], dms[1], dms[2], false);
        if (decimal == null) {
            return;
        }

        mapped.add(handledKey(gps, tagType));
        values.put(name, decimal);
    }

    private static @Nullable String formatTimeStamp(Rational @Nullable [] hms) {
        if (hms == null || hms.length != 3) {
            return null;
        }

        final double seconds = hms[2].doubleValue();
        final int wholeSeconds = (int) Math.floor(seconds);
        final int millis = (int) Math.round((seconds - wholeSeconds) * 1000);

        final String time = String.format(
                Locale.ROOT, "%02d:%02d:%02d", hms[0].intValue(), hms[1].intValue(), wholeSeconds);

        return millis == 0 || millis >= 1000 ? time : time + String.format(Locale.ROOT, ".%03d", millis);
    }

    private static @Nullable Object valueOf(Directory directory, int tagType) {
        final Object value = directory.getObject(tagType);
        if (value == null) {
            return null;
        }

        if (value instanceof byte[] bytes) {
            return "base64:" + Base64.encodeBase64String(bytes);
        }

        if (value instanceof Date date) {
            return EXIF_DATE_TIME.format(date.toInstant().atOffset(ZoneOffset.UTC));
        }

        return StringUtil.toNotBlank(directory.getString(tagType));
    }

    private static String handledKey(Directory directory, int tagType) {
        return directory.getClass().getName() + "#" + tagType;
    }

    private static String compact(String name) {
        return name.replaceAll("[^A-Za-z0-9]", "");
    }
}
