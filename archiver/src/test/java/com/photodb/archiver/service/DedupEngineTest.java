package com.photodb.archiver.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.photodb.archiver.config.ArchiverProperties;
import com.photodb.archiver.model.FileOutcome;
import com.photodb.archiver.model.FingerprintRecord;
import com.photodb.archiver.store.FingerprintRepository;
import com.photodb.archiver.store.KeyValueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DedupEngineTest {

    private static final String FP = "0123456789abcdef";

    @TempDir
    Path tempDir;

    private Path archive;
    private KeyValueStore store;
    private FingerprintRepository fingerprints;
    private ArchivePaths archivePaths;
    private DedupEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        archive = Files.createDirectories(tempDir.resolve("archive"));
        ArchiverProperties properties = new ArchiverProperties();
        properties.setMainDir(archive.toString());
        properties.setDuplicateDir(tempDir.resolve("dups").toString());

        store = KeyValueStore.open("fingerprint", tempDir.resolve("photos.db"), new ObjectMapper());
        fingerprints = new FingerprintRepository(store);
        archivePaths = new ArchivePaths(properties);
        engine = new DedupEngine(fingerprints, archivePaths);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void firstSightingClaimsTheFingerprint() throws IOException {
        Path photo = photo("2021/a.jpg");

        DedupEngine.Decision decision = engine.evaluate(FP, photo, inPlace(photo));

        assertEquals(FileOutcome.NEW, decision.outcome());
        assertEquals("2021/a.jpg", fingerprints.find(FP).orElseThrow().getCanonicalPath());
    }

    @Test
    void sameFileAgainIsAlreadyArchived() throws IOException {
        Path photo = photo("2021/a.jpg");
        engine.evaluate(FP, photo, inPlace(photo));

        AtomicInteger prepared = new AtomicInteger();
        DedupEngine.Decision decision = engine.evaluate(FP, photo, () -> {
            prepared.incrementAndGet();
            return inPlace(photo).prepare();
        });

        assertEquals(FileOutcome.ALREADY_ARCHIVED, decision.outcome());
        assertEquals(0, prepared.get());
    }

    @Test
    void sameContentElsewhereIsDuplicate() throws IOException {
        Path first = photo("2021/a.jpg");
        Path second = photo("2022/copy-of-a.jpg");
        engine.evaluate(FP, first, inPlace(first));

        DedupEngine.Decision decision = engine.evaluate(FP, second, inPlace(second));

        assertEquals(FileOutcome.DUPLICATE, decision.outcome());
        assertEquals("2021/a.jpg", decision.canonical().getCanonicalPath());
        assertEquals("2021/a.jpg", fingerprints.find(FP).orElseThrow().getCanonicalPath());
    }

    @Test
    void staleRecordIsReplaced() throws IOException {
        fingerprints.claim(FingerprintRecord.builder().fingerprint(FP).canonicalPath("gone/old.jpg").build());
        Path photo = photo("2021/a.jpg");

        DedupEngine.Decision decision = engine.evaluate(FP, photo, inPlace(photo));

        assertEquals(FileOutcome.STALE_REPLACED, decision.outcome());
        assertEquals("2021/a.jpg", fingerprints.find(FP).orElseThrow().getCanonicalPath());
    }

    @Test
    void lateStaleDeleteKeepsTheOtherWorkersClaim() throws IOException {
        FingerprintRecord stale = FingerprintRecord.builder().fingerprint(FP).canonicalPath("gone/old.jpg").build();
        fingerprints.claim(stale);
        Path first = photo("2021/a.jpg");
        Path second = photo("2021/b.jpg");
        AtomicReference<DedupEngine.Decision> firstDecision = new AtomicReference<>();

        // the second worker has read the stale record; the first runs to completion before its delete
        FingerprintRepository interleaved = new FingerprintRepository(store) {
            private boolean raced;

            @Override
            public boolean remove(FingerprintRecord record) {
                if (!raced) {
                    raced = true;
                    firstDecision.set(engine.evaluate(FP, first, inPlace(first)));
                }
                return super.remove(record);
            }
        };
        DedupEngine.Decision secondDecision = new DedupEngine(interleaved, archivePaths)
                .evaluate(FP, second, inPlace(second));

        assertEquals(FileOutcome.STALE_REPLACED, firstDecision.get().outcome());
        assertEquals(FileOutcome.DUPLICATE, secondDecision.outcome());
        assertEquals("2021/a.jpg", fingerprints.find(FP).orElseThrow().getCanonicalPath());
    }

    @Test
    void concurrentStaleSightingsLeaveExactlyOneRecord() throws Exception {
        fingerprints.claim(FingerprintRecord.builder().fingerprint(FP).canonicalPath("gone/old.jpg").build());
        int workers = 8;
        List<Path> copies = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            copies.add(photo("restored/img" + i + ".jpg"));
        }

        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        int claimed = 0;
        int duplicates = 0;
        String winner = null;
        try {
            List<Future<DedupEngine.Decision>> futures = new ArrayList<>();
            for (Path copy : copies) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return engine.evaluate(FP, copy, inPlace(copy));
                }));
            }
            start.countDown();

            for (Future<DedupEngine.Decision> future : futures) {
                DedupEngine.Decision decision = future.get();
                if (decision.outcome() == FileOutcome.STALE_REPLACED || decision.outcome() == FileOutcome.NEW) {
                    claimed++;
                    winner = decision.canonical().getCanonicalPath();
                } else if (decision.outcome() == FileOutcome.DUPLICATE) {
                    duplicates++;
                }
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, claimed);
        assertEquals(workers - 1, duplicates);
        assertEquals(winner, fingerprints.find(FP).orElseThrow().getCanonicalPath());
    }

    @Test
    void failedPreparationIsFailed() throws IOException {
        Path photo = photo("2021/a.jpg");

        DedupEngine.Decision decision = engine.evaluate(FP, photo, Optional::empty);

        assertEquals(FileOutcome.FAILED, decision.outcome());
        assertNull(decision.canonical());
        assertTrue(fingerprints.find(FP).isEmpty());
    }

    @Test
    void lostClaimIsAbandonedAndReclassified() throws IOException {
        Path winner = photo("2021/a.jpg");
        Path loser = photo("2021/b.jpg");
        List<FingerprintRecord> abandoned = new ArrayList<>();

        DedupEngine.Decision decision = engine.evaluate(FP, loser, new DedupEngine.Candidate() {
            @Override
            public Optional<FingerprintRecord> prepare() {
                // another worker claims first
                fingerprints.claim(record(winner));
                return Optional.of(record(loser));
            }

            @Override
            public void abandon(FingerprintRecord prepared) {
                abandoned.add(prepared);
            }
        });

        assertEquals(FileOutcome.DUPLICATE, decision.outcome());
        assertEquals("2021/a.jpg", decision.canonical().getCanonicalPath());
        assertEquals(1, abandoned.size());
        assertEquals("2021/b.jpg", abandoned.get(0).getCanonicalPath());
    }

    @Test
    void concurrentSightingsLeaveExactlyOneRecord() throws Exception {
        int workers = 8;
        List<Path> copies = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            copies.add(photo("burst/img" + i + ".jpg"));
        }

        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<DedupEngine.Decision>> futures = new ArrayList<>();
            for (Path copy : copies) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return engine.evaluate(FP, copy, inPlace(copy));
                }));
            }
            start.countDown();

            int created = 0;
            int duplicates = 0;
            for (Future<DedupEngine.Decision> future : futures) {
                FileOutcome outcome = future.get().outcome();
                if (outcome == FileOutcome.NEW) {
                    created++;
                } else if (outcome == FileOutcome.DUPLICATE) {
                    duplicates++;
                }
            }
            assertEquals(1, created);
            assertEquals(workers - 1, duplicates);
        } finally {
            pool.shutdownNow();
        }

        String canonical = fingerprints.find(FP).orElseThrow().getCanonicalPath();
        assertTrue(canonical.startsWith("burst/img"));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Path photo(String relative) throws IOException {
        Path file = archive.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.write(file, new byte[]{1, 2, 3});
    }

    private DedupEngine.Candidate inPlace(Path file) {
        return () -> Optional.of(record(file));
    }

    private FingerprintRecord record(Path file) {
        return FingerprintRecord.builder()
                .fingerprint(FP)
                .canonicalPath(archivePaths.toRecordPath(file))
                .date("2021-06-01")
                .build();
    }
}
