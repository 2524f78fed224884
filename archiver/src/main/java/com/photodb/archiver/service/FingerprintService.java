package com.photodb.archiver.service;

import lombok.extern.slf4j.Slf4j;
import net.jpountz.xxhash.StreamingXXHash64;
import net.jpountz.xxhash.XXHashFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * xxHash64 of a file's bytes, as 16 lowercase hex chars. Fast, not collision
 * resistant against an adversary, which is fine for spotting duplicate photos.
 */
@Service
@Slf4j
public class FingerprintService {

    private static final int CHUNK_SIZE = 8192;
    private static final long SEED = 0L;

    private final XXHashFactory hashFactory = XXHashFactory.fastestInstance();

    public Optional<String> fingerprint(Path file) {
        try (InputStream in = Files.newInputStream(file);
             StreamingXXHash64 hash = hashFactory.newStreamingHash64(SEED)) {
            byte[] buffer = new byte[CHUNK_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                hash.update(buffer, 0, read);
            }
            return Optional.of(String.format("%016x", hash.getValue()));
        } catch (IOException e) {
            log.error("Hashing failed for {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
