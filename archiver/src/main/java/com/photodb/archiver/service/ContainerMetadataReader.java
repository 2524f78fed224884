package com.photodb.archiver.service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;

public interface ContainerMetadataReader {

    /** @return the media container's creation time, empty when absent or unreadable */
    Optional<LocalDateTime> creationTime(Path file);
}
