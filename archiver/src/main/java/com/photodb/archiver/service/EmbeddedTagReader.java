package com.photodb.archiver.service;

import com.photodb.archiver.model.EmbeddedTags;

import java.nio.file.Path;
import java.util.Optional;

public interface EmbeddedTagReader {

    /** @return empty when the file is not an image or carries no EXIF block */
    Optional<EmbeddedTags> read(Path file);
}
