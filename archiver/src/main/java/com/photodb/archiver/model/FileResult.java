package com.photodb.archiver.model;

import java.nio.file.Path;

/**
 * Result of processing one file.
 *
 * @param fingerprint null when hashing never ran or failed
 * @param placed      true when this run moved or copied the file
 */
public record FileResult(Path path, String fingerprint, FileOutcome outcome, boolean placed, String detail) {

    public static FileResult of(Path path, String fingerprint, FileOutcome outcome) {
        return new FileResult(path, fingerprint, outcome, false, null);
    }

    public static FileResult placed(Path path, String fingerprint, FileOutcome outcome, String detail) {
        return new FileResult(path, fingerprint, outcome, true, detail);
    }

    public static FileResult skipped(Path path, String detail) {
        return new FileResult(path, null, FileOutcome.SKIPPED, false, detail);
    }

    public static FileResult failed(Path path, String fingerprint, String detail) {
        return new FileResult(path, fingerprint, FileOutcome.FAILED, false, detail);
    }
}
