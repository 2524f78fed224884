package com.photodb.archiver.model;

import java.nio.file.Path;
import java.util.Set;

/**
 * Options for one synchronization run.
 *
 * @param scanRoot       tree to walk: the archive root (SYNC) or the staging directory (IMPORT)
 * @param importFiles    copy new files into the archive instead of recording them in place
 * @param moveDuplicates relocate duplicates into the duplicates directory
 * @param force          ignore directory watermarks
 * @param convertHeic    transcode HEIC to JPEG while importing
 * @param workers        size of the per-directory worker pool
 * @param excludedPaths  absolute paths never descended into or processed (duplicates dir, store files)
 */
public record SyncOptions(Path scanRoot,
                          boolean importFiles,
                          boolean moveDuplicates,
                          boolean force,
                          boolean convertHeic,
                          int workers,
                          Set<Path> excludedPaths) {
}
