package com.photodb.archiver.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FingerprintServiceTest {

    private final FingerprintService service = new FingerprintService();

    @TempDir
    Path tempDir;

    @Test
    void identicalContentGivesIdenticalFingerprint() throws IOException {
        byte[] content = new byte[50_000];
        new Random(42).nextBytes(content);
        Path a = Files.write(tempDir.resolve("a.jpg"), content);
        Path b = Files.write(tempDir.resolve("b.jpg"), content);

        String fingerprint = service.fingerprint(a).orElseThrow();

        assertEquals(fingerprint, service.fingerprint(b).orElseThrow());
        assertEquals(16, fingerprint.length());
        assertTrue(fingerprint.matches("[0-9a-f]{16}"));
    }

    @Test
    void differentContentGivesDifferentFingerprint() throws IOException {
        Path a = Files.writeString(tempDir.resolve("a.jpg"), "one");
        Path b = Files.writeString(tempDir.resolve("b.jpg"), "two");

        assertNotEquals(service.fingerprint(a).orElseThrow(), service.fingerprint(b).orElseThrow());
    }

    @Test
    void emptyFileHasKnownFingerprint() throws IOException {
        Path empty = Files.createFile(tempDir.resolve("empty.jpg"));

        // xxHash64 of zero bytes with seed 0
        assertEquals("ef46db3751d8e999", service.fingerprint(empty).orElseThrow());
    }

    @Test
    void unreadableFileIsEmpty() {
        assertTrue(service.fingerprint(tempDir.resolve("missing.jpg")).isEmpty());
    }
}
