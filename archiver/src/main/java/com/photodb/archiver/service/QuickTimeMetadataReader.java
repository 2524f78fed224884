package com.photodb.archiver.service;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.mov.QuickTimeDirectory;
import com.drew.metadata.mp4.Mp4Directory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Optional;

/**
 * Container creation time for QuickTime (.mov) and MP4 files.
 *
 * Both formats store the time in UTC, counted from 1904. Writers that leave the
 * field unset produce 1904-01-01, so anything before 1970 is treated as absent.
 */
@Component
@Slf4j
public class QuickTimeMetadataReader implements ContainerMetadataReader {

    private static final int EARLIEST_PLAUSIBLE_YEAR = 1970;

    @Override
    public Optional<LocalDateTime> creationTime(Path file) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(file.toFile());
        } catch (ImageProcessingException e) {
            log.debug("{} has no recognised container: {}", file, e.getMessage());
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to read container metadata from {}: {}", file, e.getMessage());
            return Optional.empty();
        }

        Optional<LocalDateTime> quickTime = creationTime(
                metadata.getFirstDirectoryOfType(QuickTimeDirectory.class), QuickTimeDirectory.TAG_CREATION_TIME);
        if (quickTime.isPresent()) {
            return quickTime;
        }
        return creationTime(metadata.getFirstDirectoryOfType(Mp4Directory.class), Mp4Directory.TAG_CREATION_TIME);
    }

    private Optional<LocalDateTime> creationTime(Directory directory, int tag) {
        if (directory == null) {
            return Optional.empty();
        }
        Date created = directory.getDate(tag);
        if (created == null) {
            return Optional.empty();
        }
        LocalDateTime utc = LocalDateTime.ofInstant(created.toInstant(), ZoneOffset.UTC);
        return utc.getYear() < EARLIEST_PLAUSIBLE_YEAR ? Optional.empty() : Optional.of(utc);
    }
}
