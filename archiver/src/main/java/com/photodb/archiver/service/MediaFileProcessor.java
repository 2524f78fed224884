package com.photodb.archiver.service;

import com.photodb.archiver.config.ArchiverProperties;
import com.photodb.archiver.model.FileOutcome;
import com.photodb.archiver.model.FileResult;
import com.photodb.archiver.model.FingerprintRecord;
import com.photodb.archiver.model.MediaRecord;
import com.photodb.archiver.model.SyncOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Everything that happens to one file inside a worker:
 * skip list → HEIC conversion (import only) → fingerprint → metadata → dedup → placement.
 *
 * Never throws. Every failure becomes a FAILED or SKIPPED result so one bad
 * file cannot abort its directory's batch.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MediaFileProcessor {

    private final ArchiverProperties properties;
    private final FingerprintService fingerprintService;
    private final MetadataResolver metadataResolver;
    private final DedupEngine dedupEngine;
    private final FilePlacementService placement;
    private final ArchivePaths archivePaths;
    private final HeicTranscoder heicTranscoder;

    public FileResult process(Path file, SyncOptions options) {
        try {
            return processFile(file, options);
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing {} (operation: process): {}", file, e.getMessage(), e);
            return FileResult.failed(file, null, "unexpected: " + e.getMessage());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private FileResult processFile(Path file, SyncOptions options) {
        log.debug("Processing file {}", file);
        String name = file.getFileName().toString();
        if (properties.getSkipFiles().contains(name)) {
            log.debug("Skipping {} because it is in skip-files", name);
            return FileResult.skipped(file, "skip-files");
        }
        if (options.importFiles() && options.convertHeic() && isHeic(name)) {
            return processHeic(file, options);
        }

        Optional<String> hashed = fingerprintService.fingerprint(file);
        if (hashed.isEmpty()) {
            log.error("Skipping {} (operation: fingerprint): file could not be hashed", file);
            return FileResult.failed(file, null, "fingerprint failed");
        }
        String fingerprint = hashed.get();

        Optional<MediaRecord> resolved = metadataResolver.resolve(file);
        if (resolved.isEmpty()) {
            log.warn("Unknown timestamp for {} (fingerprint {}, operation: resolve), skipping", file, fingerprint);
            return new FileResult(file, fingerprint, FileOutcome.SKIPPED, false, "no timestamp");
        }
        MediaRecord media = resolved.get();

        DedupEngine.Decision decision = options.importFiles()
                ? dedupEngine.evaluate(fingerprint, file, importCandidate(file, fingerprint, media))
                : dedupEngine.evaluate(fingerprint, file, () -> Optional.of(recordFor(fingerprint, file, media)));

        return switch (decision.outcome()) {
            case NEW, STALE_REPLACED -> options.importFiles()
                    ? FileResult.placed(file, fingerprint, decision.outcome(),
                            "copied to " + decision.canonical().getCanonicalPath())
                    : FileResult.of(file, fingerprint, decision.outcome());
            case ALREADY_ARCHIVED -> FileResult.of(file, fingerprint, FileOutcome.ALREADY_ARCHIVED);
            case DUPLICATE -> handleDuplicate(file, fingerprint, decision.canonical(), options);
            default -> {
                log.error("Could not archive {} (fingerprint {}, operation: {})", file, fingerprint,
                        options.importFiles() ? "copy/claim" : "claim");
                yield FileResult.failed(file, fingerprint, "claim failed");
            }
        };
    }

    /** Copies into the archive before claiming, so a record never points at a copy that does not exist yet. */
    private DedupEngine.Candidate importCandidate(Path file, String fingerprint, MediaRecord media) {
        return new DedupEngine.Candidate() {
            @Override
            public Optional<FingerprintRecord> prepare() {
                return placement.copy(file, placement.destinationFor(file, media), fingerprint)
                        .map(copy -> recordFor(fingerprint, copy, media));
            }

            @Override
            public void abandon(FingerprintRecord prepared) {
                placement.discard(archivePaths.resolve(prepared.getCanonicalPath()), fingerprint);
            }
        };
    }

    private FileResult handleDuplicate(Path file, String fingerprint, FingerprintRecord canonical,
                                       SyncOptions options) {
        log.warn("Duplicate found for {} ({}), canonical copy is {}", fingerprint, file, canonical.getCanonicalPath());
        if (!options.moveDuplicates()) {
            return new FileResult(file, fingerprint, FileOutcome.DUPLICATE, false,
                    "duplicate of " + canonical.getCanonicalPath());
        }
        Path destination = placement.duplicateDestinationFor(file, options.scanRoot());
        return placement.move(file, destination, fingerprint)
                .map(moved -> FileResult.placed(file, fingerprint, FileOutcome.DUPLICATE, "moved to " + moved))
                .orElseGet(() -> {
                    log.error("Could not relocate duplicate {} (fingerprint {}, operation: move)", file, fingerprint);
                    return FileResult.failed(file, fingerprint, "duplicate relocation failed");
                });
    }

    /**
     * Import-only: archive a JPEG rendition, then hand the HEIC original to the
     * duplicates area. The temporary JPEG is removed from staging if still there.
     */
    private FileResult processHeic(Path heic, SyncOptions options) {
        Optional<Path> converted = heicTranscoder.toJpeg(heic);
        if (converted.isEmpty()) {
            log.error("Skipping {} (operation: heic-convert): conversion failed", heic);
            return FileResult.failed(heic, null, "HEIC conversion failed");
        }
        Path jpeg = converted.get();
        FileResult jpegResult = processFile(jpeg, options);
        placement.discard(jpeg, jpegResult.fingerprint());

        if (jpegResult.outcome() == FileOutcome.FAILED || jpegResult.outcome() == FileOutcome.SKIPPED) {
            return new FileResult(heic, jpegResult.fingerprint(), jpegResult.outcome(), jpegResult.placed(),
                    "converted JPEG: " + jpegResult.detail());
        }
        Path duplicateTarget = placement.duplicateDestinationFor(heic, options.scanRoot());
        boolean originalMoved = placement.move(heic, duplicateTarget, jpegResult.fingerprint()).isPresent();
        return new FileResult(heic, jpegResult.fingerprint(), jpegResult.outcome(),
                jpegResult.placed() || originalMoved,
                "converted to " + jpeg.getFileName() + (originalMoved ? ", original moved to duplicates" : ""));
    }

    private FingerprintRecord recordFor(String fingerprint, Path canonical, MediaRecord media) {
        return FingerprintRecord.builder()
                .fingerprint(fingerprint)
                .canonicalPath(archivePaths.toRecordPath(canonical))
                .date(media.getDate())
                .location(media.getLocation())
                .latitude(media.getCoordinate() == null ? null : media.getCoordinate().latitude())
                .longitude(media.getCoordinate() == null ? null : media.getCoordinate().longitude())
                .build();
    }

    private boolean isHeic(String name) {
        return name.toUpperCase(Locale.ROOT).endsWith(".HEIC");
    }
}
