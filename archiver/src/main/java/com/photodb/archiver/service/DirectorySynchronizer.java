package com.photodb.archiver.service;

import com.photodb.archiver.config.ArchiverProperties;
import com.photodb.archiver.model.DirectoryWatermark;
import com.photodb.archiver.model.FileOutcome;
import com.photodb.archiver.model.FileResult;
import com.photodb.archiver.model.SyncOptions;
import com.photodb.archiver.model.SyncReport;
import com.photodb.archiver.store.WatermarkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Walks a tree and feeds each directory's files to a bounded worker pool.
 *
 * Traversal stays on the calling thread: subdirectories are visited first
 * (depth-first, in name order), then the directory's own files are processed as
 * one parallel batch. The synchronizer waits for the whole batch before it
 * commits the directory's watermark, so an interrupted run leaves no watermark
 * and the directory is retried in full next time.
 *
 * A directory whose mtime is not newer than its watermark is skipped unless
 * the run is forced. Adding or removing a file bumps the parent directory's
 * mtime on common filesystems, which is what triggers a re-scan.
 *
 * The committed mtime is read after the batch, so moves made by the batch
 * itself do not cause another scan. A batch with FAILED files commits nothing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DirectorySynchronizer {

    private final ArchiverProperties properties;
    private final MediaFileProcessor processor;
    private final WatermarkRepository watermarks;

    public SyncReport synchronize(SyncOptions options) {
        SyncReport report = SyncReport.builder()
                .runId(UUID.randomUUID().toString())
                .mode(options.importFiles() ? "IMPORT" : "SYNC")
                .root(options.scanRoot().toString())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();

        Path root = options.scanRoot().toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            log.error("Scan root {} is not a directory", root);
            report.setStatus("FAILED");
            report.setCompletedAt(LocalDateTime.now());
            return report;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, options.workers()), workerThreads());
        try {
            processDirectory(root, options, pool, report);
            report.setStatus("SUCCESS");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Synchronization of {} interrupted; unfinished directories keep their old watermark", root);
            report.setStatus("INTERRUPTED");
        } finally {
            pool.shutdownNow();
            report.setCompletedAt(LocalDateTime.now());
        }
        return report;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void processDirectory(Path directory, SyncOptions options, ExecutorService pool, SyncReport report)
            throws InterruptedException {
        log.debug("Processing directory {}", directory);

        List<Path> files = new ArrayList<>();
        List<Path> subdirectories = new ArrayList<>();
        try (Stream<Path> entries = Files.list(directory)) {
            entries.sorted().forEach(entry -> {
                Path path = entry.toAbsolutePath().normalize();
                if (options.excludedPaths().contains(path)) {
                    log.debug("Excluded from scan: {}", path);
                } else if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
                    if (properties.getSkipFiles().contains(path.getFileName().toString())) {
                        log.debug("Skipping directory {} because it is in skip-files", path);
                    } else {
                        subdirectories.add(path);
                    }
                } else if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            });
        } catch (IOException e) {
            log.error("Cannot list directory {}: {}", directory, e.getMessage());
            return;
        }

        for (Path subdirectory : subdirectories) {
            processDirectory(subdirectory, options, pool, report);
        }

        Optional<Long> mtime = lastModified(directory);
        if (mtime.isEmpty()) {
            return;
        }
        Optional<DirectoryWatermark> watermark = watermarks.find(directory);
        if (!options.force() && watermark.isPresent()
                && mtime.get() <= watermark.get().getLastProcessedMtime()) {
            log.debug("Skipping unchanged directory {}", directory);
            report.setDirectoriesSkipped(report.getDirectoriesSkipped() + 1);
            return;
        }
        report.setDirectoriesScanned(report.getDirectoriesScanned() + 1);

        boolean failures = processBatch(files, options, pool, report);
        if (failures) {
            log.warn("Some files in {} failed; watermark not committed so they are retried next run", directory);
            return;
        }
        Optional<Long> committed = lastModified(directory);
        if (committed.isPresent() && watermarks.commit(directory, committed.get())) {
            log.debug("Completed processing directory {} ({} files)", directory, files.size());
        } else {
            log.warn("Watermark for {} not written; it will be rescanned next run", directory);
        }
    }

    /**
     * Runs one directory's files on the pool and blocks until all are done.
     * Results are taken in completion order.
     *
     * @return true if any file ended FAILED
     */
    private boolean processBatch(List<Path> files, SyncOptions options, ExecutorService pool, SyncReport report)
            throws InterruptedException {
        CompletionService<FileResult> completion = new ExecutorCompletionService<>(pool);
        for (Path file : files) {
            completion.submit(() -> processor.process(file, options));
        }

        boolean failures = false;
        for (int i = 0; i < files.size(); i++) {
            FileResult result;
            try {
                result = completion.take().get();
            } catch (ExecutionException e) {
                log.error("Worker task failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
                failures = true;
                continue;
            }
            report.record(result);
            if (result.outcome() == FileOutcome.FAILED) {
                failures = true;
            }
        }
        return failures;
    }

    private Optional<Long> lastModified(Path directory) {
        try {
            return Optional.of(Files.getLastModifiedTime(directory).toMillis());
        } catch (IOException e) {
            log.error("Cannot read modification time of {}: {}", directory, e.getMessage());
            return Optional.empty();
        }
    }

    private ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "archive-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
