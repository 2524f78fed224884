package com.photodb.archiver.output;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import com.photodb.archiver.config.ArchiverProperties;
import com.photodb.archiver.model.FileOutcome;
import com.photodb.archiver.model.FileResult;
import com.photodb.archiver.model.SyncReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesOneRowPerNotableFile() throws IOException, CsvException {
        ArchiverProperties properties = new ArchiverProperties();
        properties.getReport().setCsvDir(tempDir.resolve("reports").toString());
        SyncReport report = SyncReport.builder()
                .runId("run-1")
                .mode("SYNC")
                .startedAt(LocalDateTime.of(2024, 6, 1, 2, 0, 0))
                .build();
        report.record(FileResult.of(tempDir.resolve("a.jpg"), "00000000000000aa", FileOutcome.NEW));
        report.record(FileResult.of(tempDir.resolve("b.jpg"), "00000000000000bb", FileOutcome.ALREADY_ARCHIVED));
        report.record(FileResult.placed(tempDir.resolve("c.jpg"), "00000000000000aa", FileOutcome.DUPLICATE,
                "moved to /dups/c.jpg"));

        Path csv = new RunReportWriter(properties).write(report).orElseThrow();

        assertEquals("run_20240601-020000_SYNC.csv", csv.getFileName().toString());
        List<String[]> rows;
        try (Reader reader = Files.newBufferedReader(csv); CSVReader csvReader = new CSVReader(reader)) {
            rows = csvReader.readAll();
        }
        assertEquals(3, rows.size());
        assertArrayEquals(new String[]{"run_id", "path", "fingerprint", "outcome", "placed", "detail"}, rows.get(0));
        assertEquals("NEW", rows.get(1)[3]);
        assertEquals("", rows.get(1)[5]);
        assertEquals("DUPLICATE", rows.get(2)[3]);
        assertEquals("true", rows.get(2)[4]);
    }

    @Test
    void blankDirectoryDisablesReport() {
        SyncReport report = SyncReport.builder().runId("run-2").mode("SYNC").startedAt(LocalDateTime.now()).build();

        assertTrue(new RunReportWriter(new ArchiverProperties()).write(report).isEmpty());
    }
}
