package com.photodb.archiver.model;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Tags read from an image's embedded EXIF block. Either field may be absent.
 */
public record EmbeddedTags(LocalDateTime dateTimeOriginal, Coordinate coordinate) {

    public Optional<LocalDateTime> timestamp() {
        return Optional.ofNullable(dateTimeOriginal);
    }

    public Optional<Coordinate> gps() {
        return Optional.ofNullable(coordinate);
    }
}
