package com.photodb.archiver.service;

import com.photodb.archiver.model.FileOutcome;
import com.photodb.archiver.model.FingerprintRecord;
import com.photodb.archiver.store.FingerprintRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Decides what a file is, given its fingerprint:
 *
 *   no record                          → claim the slot, NEW
 *   record, file present, same path    → ALREADY_ARCHIVED, nothing written
 *   record, file present, other path   → DUPLICATE
 *   record, file gone                  → delete the record, then claim as above (STALE_REPLACED)
 *
 * Two workers that meet the same fingerprint at once both see "no record" and
 * race on the conditional insert. The winner owns the slot; the loser undoes
 * its preparation, re-reads and is normally classified DUPLICATE. The lookup and
 * the insert are separate store calls, so which worker wins is not defined.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DedupEngine {

    static final int MAX_CLAIM_ATTEMPTS = 3;

    private final FingerprintRepository fingerprints;
    private final ArchivePaths archivePaths;

    /**
     * Supplies the record to claim when the fingerprint turns out to be new.
     * In place this just describes the current file; when importing it first
     * copies the file into the archive.
     */
    @FunctionalInterface
    public interface Candidate {

        /** @return the record to claim, empty if the canonical copy could not be made */
        Optional<FingerprintRecord> prepare();

        /** The claim was lost: undo whatever {@link #prepare()} did. */
        default void abandon(FingerprintRecord prepared) {
        }
    }

    public record Decision(FileOutcome outcome, FingerprintRecord canonical) {
    }

    public Decision evaluate(String fingerprint, Path current, Candidate candidate) {
        Path currentPath = current.toAbsolutePath().normalize();
        boolean replacedStale = false;

        for (int attempt = 1; attempt <= MAX_CLAIM_ATTEMPTS; attempt++) {
            Optional<FingerprintRecord> existing = fingerprints.find(fingerprint);
            if (existing.isPresent()) {
                FingerprintRecord record = existing.get();
                Path canonical = archivePaths.resolve(record.getCanonicalPath());
                if (Files.isRegularFile(canonical)) {
                    FileOutcome outcome = canonical.equals(currentPath)
                            ? FileOutcome.ALREADY_ARCHIVED
                            : FileOutcome.DUPLICATE;
                    return new Decision(outcome, record);
                }
                log.debug("Deleting stale record {} → {} (file no longer exists)", fingerprint, canonical);
                if (!fingerprints.remove(record)) {
                    log.debug("Stale record {} was replaced by another worker; re-reading", fingerprint);
                    continue;
                }
                replacedStale = true;
            }

            Optional<FingerprintRecord> prepared = candidate.prepare();
            if (prepared.isEmpty()) {
                return new Decision(FileOutcome.FAILED, null);
            }
            if (fingerprints.claim(prepared.get())) {
                log.debug("Created record {} → {}", fingerprint, prepared.get().getCanonicalPath());
                return new Decision(replacedStale ? FileOutcome.STALE_REPLACED : FileOutcome.NEW, prepared.get());
            }

            log.debug("Lost claim for {} ({}), attempt {}; re-reading", fingerprint, currentPath, attempt);
            candidate.abandon(prepared.get());
        }

        log.error("Could not claim or read record for fingerprint {} ({}) after {} attempts",
                fingerprint, currentPath, MAX_CLAIM_ATTEMPTS);
        return new Decision(FileOutcome.FAILED, null);
    }
}
