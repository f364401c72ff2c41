/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer.tags;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.drew.imaging.ImageProcessingException;
import com.drew.lang.Rational;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.drew.metadata.mp4.Mp4Directory;
import de.bmarwell.home.exif.normalizer.TestImages;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Date;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetadataExtractorTagsTest {

    @TempDir
    Path tempDir;

    @Test
    void testRead_realFile() throws IOException, ImageProcessingException {
        // given
        final Path jpgFile = this.tempDir.resolve("test.jpg");
        Files.write(jpgFile, TestImages.minimalJpg());

        // when
        final RawTags tags = MetadataExtractorTags.read(jpgFile);

        // then
        assertEquals(jpgFile.toString(), tags.sourceFile());
        assertEquals("SourceFile", tags.keys().iterator().next());
        assertEquals("image/jpeg", tags.getString("MIMEType"));
        // This file has no creation date
        assertNull(tags.get("DateTimeOriginal"));
    }

    @Test
    void testFromMetadata_exifSubIfd() {
        // given
        final Metadata metadata = new Metadata();
        final ExifSubIFDDirectory directory = new ExifSubIFDDirectory();
        directory.setString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL, "2016:07:18 09:54:03");
        directory.setString(ExifSubIFDDirectory.TAG_TIME_ZONE_ORIGINAL, "+02:00");
        directory.setString(ExifSubIFDDirectory.TAG_SUBSECOND_TIME_ORIGINAL, "123");
        metadata.addDirectory(directory);

        // when
        final RawTags tags = MetadataExtractorTags.fromMetadata(metadata);

        // then
        assertEquals("2016:07:18 09:54:03", tags.getString("DateTimeOriginal"));
        assertEquals("+02:00", tags.getString("OffsetTimeOriginal"));
        assertEquals("123", tags.getString("SubSecTimeOriginal"));
        assertEquals("2016:07:18 09:54:03.123+02:00", tags.getString("SubSecDateTimeOriginal"));
        assertFalse(tags.asMap().containsKey("ExifSubIFD:DateTimeOriginal"));
        assertNull(tags.sourceFile());
    }

    @Test
    void testFromMetadata_exifIfd0() {
        final Metadata metadata = new Metadata();
        final ExifIFD0Directory directory = new ExifIFD0Directory();
        directory.setString(ExifIFD0Directory.TAG_DATETIME, "2022:05:05 10:30:00");
        directory.setString(ExifIFD0Directory.TAG_TIME_ZONE, "-07:00");
        metadata.addDirectory(directory);

        final RawTags tags = MetadataExtractorTags.fromMetadata(metadata);

        assertEquals("2022:05:05 10:30:00", tags.getString("ModifyDate"));
        assertEquals("-07:00", tags.getString("OffsetTime"));
    }

    @Test
    void testFromMetadata_mp4CreationTimeIsUtcWallClock() {
        // given
        final Metadata metadata = new Metadata();
        final Mp4Directory directory = new Mp4Directory();
        final LocalDateTime localDateTime = LocalDateTime.of(2_021, 3, 3, 15, 45, 0);
        directory.setDate(Mp4Directory.TAG_CREATION_TIME, Date.from(localDateTime.toInstant(ZoneOffset.UTC)));
        metadata.addDirectory(directory);

        // when
        final RawTags tags = MetadataExtractorTags.fromMetadata(metadata);

        // then
        assertEquals("2021:03:03 15:45:00", tags.getString("CreateDate"));
    }

    @Test
    void testFromMetadata_gps() {
        // given
        final Metadata metadata = new Metadata();
        final GpsDirectory directory = new GpsDirectory();
        directory.setRationalArray(GpsDirectory.TAG_LATITUDE, new Rational[] {
            new Rational(37, 1), new Rational(46, 1), new Rational(2964, 100)
        });
        directory.setString(GpsDirectory.TAG_LATITUDE_REF, "N");
        directory.setRationalArray(GpsDirectory.TAG_LONGITUDE, new Rational[] {
            new Rational(122, 1), new Rational(25, 1), new Rational(981, 100)
        });
        directory.setString(GpsDirectory.TAG_LONGITUDE_REF, "W");
        directory.setString(GpsDirectory.TAG_DATE_STAMP, "2020:08:08");
        directory.setRationalArray(GpsDirectory.TAG_TIME_STAMP, new Rational[] {
            new Rational(12, 1), new Rational(0, 1), new Rational(0, 1)
        });
        metadata.addDirectory(directory);

        // when
        final RawTags tags = MetadataExtractorTags.fromMetadata(metadata);

        // then
        assertEquals(37.7749, tags.getDouble("GPSLatitude"), 1e-6);
        assertEquals("N", tags.getString("GPSLatitudeRef"));
        assertEquals(122.419392, tags.getDouble("GPSLongitude"), 1e-6);
        assertEquals("W", tags.getString("GPSLongitudeRef"));
        assertEquals("2020:08:08", tags.getString("GPSDateStamp"));
        assertEquals("12:00:00", tags.getString("GPSTimeStamp"));
        assertEquals("2020:08:08 12:00:00Z", tags.getString("GPSDateTime"));
    }

    @Test
    void testFromMetadata_gpsTimeStampWithFraction() {
        final Metadata metadata = new Metadata();
        final GpsDirectory directory = new GpsDirectory();
        directory.setRationalArray(GpsDirectory.TAG_TIME_STAMP, new Rational[] {
            new Rational(7, 1), new Rational(41, 1), new Rational(1250, 1000)
        });
        metadata.addDirectory(directory);

        final RawTags tags = MetadataExtractorTags.fromMetadata(metadata);

        assertEquals("07:41:01.250", tags.getString("GPSTimeStamp"));
        assertNull(tags.get("GPSDateTime"));
    }

    @Test
    void testFromMetadata_binaryValuesAreBase64() {
        // given
        final Metadata metadata = new Metadata();
        final ExifSubIFDDirectory directory = new ExifSubIFDDirectory();
        directory.setByteArray(ExifSubIFDDirectory.TAG_MAKERNOTE, new byte[] {1, 2, 3});
        metadata.addDirectory(directory);

        // when
        final RawTags tags = MetadataExtractorTags.fromMetadata(metadata);

        // then
        assertTrue(tags.asMap().containsValue("base64:AQID"), tags::toString);
    }
}
