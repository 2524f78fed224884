package com.photodb.archiver.service;

import java.nio.file.Path;
import java.util.Optional;

public interface HeicTranscoder {

    /** @return the JPEG written next to the source, empty when conversion failed */
    Optional<Path> toJpeg(Path heic);
}
