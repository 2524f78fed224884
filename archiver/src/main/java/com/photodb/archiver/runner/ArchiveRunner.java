package com.photodb.archiver.runner;

import com.photodb.archiver.config.ArchiverProperties;
import com.photodb.archiver.model.FileOutcome;
import com.photodb.archiver.model.SyncOptions;
import com.photodb.archiver.model.SyncReport;
import com.photodb.archiver.output.RunReportWriter;
import com.photodb.archiver.service.ArchivePaths;
import com.photodb.archiver.service.DirectorySynchronizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;

/**
 * Runs one synchronization pass at startup, then lets the application exit.
 *
 * Mode and toggles come from photo-archiver.run.*, overridable on the command line:
 *   java -jar archiver.jar --photo-archiver.run.mode=IMPORT --photo-archiver.run.force=true
 *
 * Per-file failures are logged and counted but never change the exit code.
 * The stores are opened during context start-up, so a store that cannot be
 * opened stops the application before this runner is reached.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ArchiveRunner implements CommandLineRunner {

    private final ArchiverProperties properties;
    private final ArchivePaths archivePaths;
    private final DirectorySynchronizer synchronizer;
    private final RunReportWriter reportWriter;

    @Override
    public void run(String... args) {
        if (!properties.getRun().isEnabled()) {
            log.info("Archive run disabled (photo-archiver.run.enabled=false)");
            return;
        }

        SyncOptions options = buildOptions();
        log.info("Starting {} of {} (workers={}, moveDuplicates={}, force={})",
                properties.getRun().getMode(), options.scanRoot(), options.workers(),
                options.moveDuplicates(), options.force());

        SyncReport report = synchronizer.synchronize(options);

        log.info("Run {} {}: {} directories scanned, {} skipped, {} files placed; "
                        + "new={} archived={} duplicate={} stale={} skipped={} failed={}",
                report.getRunId(), report.getStatus(),
                report.getDirectoriesScanned(), report.getDirectoriesSkipped(), report.getFilesPlaced(),
                report.count(FileOutcome.NEW), report.count(FileOutcome.ALREADY_ARCHIVED),
                report.count(FileOutcome.DUPLICATE), report.count(FileOutcome.STALE_REPLACED),
                report.count(FileOutcome.SKIPPED), report.count(FileOutcome.FAILED));

        try {
            reportWriter.write(report);
        } catch (Exception e) {
            log.warn("Failed to write run report: {}", e.getMessage());
        }
    }

    SyncOptions buildOptions() {
        ArchiverProperties.Run run = properties.getRun();
        boolean importing = run.getMode() == ArchiverProperties.Run.RunMode.IMPORT;
        Path scanRoot = importing
                ? Paths.get(properties.getIncomingDir()).toAbsolutePath().normalize()
                : archivePaths.archiveRoot();

        return new SyncOptions(scanRoot, importing, run.isMoveDuplicates(), run.isForce(),
                run.isConvertHeic(), run.getWorkers(), excludedPaths());
    }

    /** The duplicates area and the store files must never be scanned as media. */
    private Set<Path> excludedPaths() {
        Set<Path> excluded = new HashSet<>();
        excluded.add(archivePaths.duplicateRoot());
        for (String db : new String[]{properties.getStore().getFingerprintDb(), properties.getStore().getGeocodeDb()}) {
            Path file = Paths.get(db).toAbsolutePath().normalize();
            excluded.add(file);
            excluded.add(file.resolveSibling(file.getFileName() + "-wal"));
            excluded.add(file.resolveSibling(file.getFileName() + "-shm"));
            excluded.add(file.resolveSibling(file.getFileName() + "-journal"));
        }
        return excluded;
    }
}
