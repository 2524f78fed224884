package com.photodb.archiver.service;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.Rational;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.photodb.archiver.model.Coordinate;
import com.photodb.archiver.model.EmbeddedTags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Reads DateTimeOriginal and the GPS position from EXIF using metadata-extractor.
 */
@Component
@Slf4j
public class ExifTagReader implements EmbeddedTagReader {

    private static final DateTimeFormatter EXIF_DATE_TIME = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    @Override
    public Optional<EmbeddedTags> read(Path file) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(file.toFile());
        } catch (ImageProcessingException e) {
            log.debug("{} is not a readable image: {}", file, e.getMessage());
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to read EXIF from {}: {}", file, e.getMessage());
            return Optional.empty();
        }

        ExifSubIFDDirectory exif = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        if (exif == null && gps == null) {
            return Optional.empty();
        }
        return Optional.of(new EmbeddedTags(dateTimeOriginal(file, exif), coordinate(file, gps)));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private LocalDateTime dateTimeOriginal(Path file, ExifSubIFDDirectory exif) {
        if (exif == null) {
            return null;
        }
        String raw = exif.getString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(raw.trim(), EXIF_DATE_TIME);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring malformed DateTimeOriginal '{}' in {}", raw, file);
            return null;
        }
    }

    private Coordinate coordinate(Path file, GpsDirectory gps) {
        if (gps == null) {
            return null;
        }
        double[] latitude = dms(gps.getRationalArray(GpsDirectory.TAG_LATITUDE));
        double[] longitude = dms(gps.getRationalArray(GpsDirectory.TAG_LONGITUDE));
        if (latitude == null || longitude == null) {
            log.debug("Incomplete GPS tags in {}", file);
            return null;
        }
        return Coordinate.fromDms(latitude, gps.getString(GpsDirectory.TAG_LATITUDE_REF),
                longitude, gps.getString(GpsDirectory.TAG_LONGITUDE_REF));
    }

    private double[] dms(Rational[] values) {
        if (values == null || values.length != 3) {
            return null;
        }
        double[] dms = new double[3];
        for (int i = 0; i < 3; i++) {
            dms[i] = values[i].doubleValue();
            if (!Double.isFinite(dms[i])) {
                return null;
            }
        }
        return dms;
    }
}
