package com.photodb.archiver.store;

import com.photodb.archiver.model.DirectoryWatermark;
import lombok.RequiredArgsConstructor;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Per-directory watermarks, kept in the fingerprint table under their own key prefix.
 */
@RequiredArgsConstructor
public class WatermarkRepository {

    private static final String KEY_PREFIX = "watermark:";

    private final KeyValueStore store;

    public Optional<DirectoryWatermark> find(Path directory) {
        return store.get(key(directory), DirectoryWatermark.class);
    }

    public boolean commit(Path directory, long mtimeMillis) {
        String path = normalise(directory);
        return store.put(KEY_PREFIX + path, new DirectoryWatermark(path, mtimeMillis), true);
    }

    private static String key(Path directory) {
        return KEY_PREFIX + normalise(directory);
    }

    private static String normalise(Path directory) {
        return directory.toAbsolutePath().normalize().toString();
    }
}
