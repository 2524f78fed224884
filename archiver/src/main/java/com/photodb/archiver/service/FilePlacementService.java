package com.photodb.archiver.service;

import com.photodb.archiver.model.MediaRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Where a file belongs in the archive, and the collision-safe move/copy that
 * puts it there.
 *
 * Layout: {archive-root}/{yyyy}/{yyyy-MM-dd}[ - {location}]/{original name}
 *
 * An existing destination is never overwritten: IMG_1.jpg becomes IMG_1_001.jpg,
 * then IMG_1_002.jpg. The free-name check is not atomic against other processes
 * creating files at the same moment, which is acceptable for a single batch run;
 * the final move/copy still refuses to replace anything.
 *
 * I/O failures are logged and returned as empty, never thrown.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FilePlacementService {

    private static final int MAX_SUFFIX = 999_999;

    private final ArchivePaths archivePaths;

    public Path destinationFor(Path file, MediaRecord media) {
        String folder = media.getDate();
        if (StringUtils.hasText(media.getLocation())) {
            folder += " - " + sanitise(media.getLocation());
        }
        return archivePaths.archiveRoot()
                .resolve(media.getYear())
                .resolve(folder)
                .resolve(file.getFileName().toString());
    }

    /** Same path relative to the scan root, re-rooted under the duplicates directory. */
    public Path duplicateDestinationFor(Path file, Path scanRoot) {
        Path absolute = file.toAbsolutePath().normalize();
        Path root = scanRoot.toAbsolutePath().normalize();
        Path relative = absolute.startsWith(root) ? root.relativize(absolute) : absolute.getFileName();
        return archivePaths.duplicateRoot().resolve(relative);
    }

    /**
     * Rename into place (copy + delete when crossing file stores).
     *
     * @param fingerprint the file's fingerprint, for the error log; may be null
     */
    public Optional<Path> move(Path source, Path destination, String fingerprint) {
        return transfer(source, destination, fingerprint, true);
    }

    /** Copy into place; the source stays where it is. */
    public Optional<Path> copy(Path source, Path destination, String fingerprint) {
        return transfer(source, destination, fingerprint, false);
    }

    /** Remove a file this run placed, e.g. a copy that lost its fingerprint claim. */
    public boolean discard(Path placed, String fingerprint) {
        try {
            return Files.deleteIfExists(placed);
        } catch (IOException e) {
            log.error("Failed to remove {} (fingerprint {}, operation: discard): {}",
                    placed, fingerprint, e.getMessage());
            return false;
        }
    }

    /**
     * The destination itself when free, otherwise the first free
     * name_NNN.ext with a zero-padded counter starting at 001.
     */
    public static Path nextFreePath(Path destination) {
        if (!Files.exists(destination)) {
            return destination;
        }
        String name = destination.getFileName().toString();
        int dotIndex = name.lastIndexOf('.');
        String base = dotIndex > 0 ? name.substring(0, dotIndex) : name;
        String extension = dotIndex > 0 ? name.substring(dotIndex) : "";

        for (int counter = 1; counter <= MAX_SUFFIX; counter++) {
            Path candidate = destination.resolveSibling(String.format("%s_%03d%s", base, counter, extension));
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("No free name left for " + destination);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Optional<Path> transfer(Path source, Path destination, String fingerprint, boolean move) {
        String operation = move ? "move" : "copy";
        try {
            Files.createDirectories(destination.toAbsolutePath().getParent());
            Path target = nextFreePath(destination);
            log.info("{} {} to {}", move ? "Moving" : "Copying", source, target);
            if (move) {
                Files.move(source, target);
            } else {
                Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
            }
            return Optional.of(target);
        } catch (IOException | IllegalStateException e) {
            log.error("Failed to place {} at {} (fingerprint {}, operation: {}): {}",
                    source, destination, fingerprint, operation, e.getMessage());
            return Optional.empty();
        }
    }

    private String sanitise(String location) {
        return location.replace('/', '-').replace('\\', '-').trim();
    }
}
