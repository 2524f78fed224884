package com.photodb.archiver.service;

import com.photodb.archiver.config.ArchiverProperties;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Archive and duplicates roots, and the conversion between real paths and the
 * archive-relative strings kept in fingerprint records.
 */
@Component
public class ArchivePaths {

    private final Path archiveRoot;
    private final Path duplicateRoot;

    public ArchivePaths(ArchiverProperties properties) {
        this.archiveRoot = Paths.get(properties.getMainDir()).toAbsolutePath().normalize();
        this.duplicateRoot = Paths.get(properties.getDuplicateDir()).toAbsolutePath().normalize();
    }

    public Path archiveRoot() {
        return archiveRoot;
    }

    public Path duplicateRoot() {
        return duplicateRoot;
    }

    /** '/'-separated path relative to the archive root; absolute when the file lies outside it. */
    public String toRecordPath(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (!absolute.startsWith(archiveRoot)) {
            return absolute.toString();
        }
        return archiveRoot.relativize(absolute).toString().replace(File.separatorChar, '/');
    }

    public Path resolve(String recordPath) {
        return archiveRoot.resolve(recordPath).normalize();
    }
}
