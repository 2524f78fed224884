package com.photodb.archiver.output;

import com.opencsv.CSVWriter;
import com.photodb.archiver.config.ArchiverProperties;
import com.photodb.archiver.model.FileResult;
import com.photodb.archiver.model.SyncReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Writes one CSV per run listing every file that was not simply already archived.
 *
 * Output path pattern: {csvDir}/run_{yyyyMMdd-HHmmss}_{mode}.csv
 * e.g. /data/reports/run_20240601-020000_SYNC.csv
 *
 * Disabled when photo-archiver.report.csv-dir is blank.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunReportWriter {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private static final String[] HEADERS = {
            "run_id", "path", "fingerprint", "outcome", "placed", "detail"
    };

    private final ArchiverProperties properties;

    public Optional<Path> write(SyncReport report) {
        String csvDir = properties.getReport().getCsvDir();
        if (!StringUtils.hasText(csvDir)) {
            return Optional.empty();
        }

        Path outputDir = Paths.get(csvDir);
        ensureDirectory(outputDir);

        String filename = String.format("run_%s_%s.csv", report.getStartedAt().format(STAMP), report.getMode());
        Path outputPath = outputDir.resolve(filename);

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(HEADERS);
            for (FileResult result : report.getNotable()) {
                writer.writeNext(toRow(report.getRunId(), result));
            }

            log.info("Written {} report rows to CSV: {}", report.getNotable().size(), outputPath);
            return Optional.of(outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV report {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("CSV report write failed", e);
        }
    }

    private String[] toRow(String runId, FileResult r) {
        return new String[]{
                runId,
                str(r.path()),
                str(r.fingerprint()),
                str(r.outcome()),
                String.valueOf(r.placed()),
                str(r.detail())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create report directory: " + dir, e);
        }
    }
}
