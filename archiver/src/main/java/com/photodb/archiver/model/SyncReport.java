package com.photodb.archiver.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks one synchronization run for the end-of-run summary and CSV report.
 * Only mutated from the traversal thread.
 */
@Data
@Builder
public class SyncReport {

    private String runId;           // UUID
    private String mode;            // SYNC | IMPORT
    private String root;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | INTERRUPTED | FAILED

    private int directoriesScanned;
    private int directoriesSkipped;
    private int filesPlaced;        // moves + copies

    @Builder.Default
    private Map<FileOutcome, Integer> outcomes = new EnumMap<>(FileOutcome.class);

    /** Everything except ALREADY_ARCHIVED, for the CSV report */
    @Builder.Default
    private List<FileResult> notable = new ArrayList<>();

    public void record(FileResult result) {
        outcomes.merge(result.outcome(), 1, Integer::sum);
        if (result.placed()) {
            filesPlaced++;
        }
        if (result.outcome() != FileOutcome.ALREADY_ARCHIVED) {
            notable.add(result);
        }
    }

    public int count(FileOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }
}
