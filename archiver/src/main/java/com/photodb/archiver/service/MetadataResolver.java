package com.photodb.archiver.service;

import com.photodb.archiver.model.Coordinate;
import com.photodb.archiver.model.EmbeddedTags;
import com.photodb.archiver.model.MediaRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Works out when and where a file was shot.
 *
 * Timestamp, first match wins:
 *   1. EXIF DateTimeOriginal
 *   2. container creation time (QuickTime / MP4)
 *   3. the earlier of the filesystem creation and modification times
 *
 * A file with none of these yields empty; a date is never made up.
 * The coordinate comes from EXIF GPS tags only.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetadataResolver {

    static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    static final DateTimeFormatter YEAR = DateTimeFormatter.ofPattern("yyyy");

    private final EmbeddedTagReader embeddedTagReader;
    private final ContainerMetadataReader containerMetadataReader;
    private final LocationResolver locationResolver;

    public Optional<MediaRecord> resolve(Path file) {
        Optional<EmbeddedTags> tags = embeddedTagReader.read(file);

        Optional<LocalDateTime> timestamp = tags.flatMap(EmbeddedTags::timestamp)
                .or(() -> containerMetadataReader.creationTime(file))
                .or(() -> fileTimestamp(file));
        if (timestamp.isEmpty()) {
            return Optional.empty();
        }

        Coordinate coordinate = tags.flatMap(EmbeddedTags::gps).orElse(null);
        String location = coordinate == null ? null : locationResolver.resolve(coordinate).orElse(null);

        return Optional.of(MediaRecord.builder()
                .timestamp(timestamp.get())
                .date(timestamp.get().format(DATE))
                .year(timestamp.get().format(YEAR))
                .coordinate(coordinate)
                .location(location)
                .build());
    }

    private Optional<LocalDateTime> fileTimestamp(Path file) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            FileTime earliest = attrs.creationTime().compareTo(attrs.lastModifiedTime()) < 0
                    ? attrs.creationTime()
                    : attrs.lastModifiedTime();
            return Optional.of(LocalDateTime.ofInstant(earliest.toInstant(), ZoneId.systemDefault()));
        } catch (IOException e) {
            log.error("Cannot read file times of {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
