package com.photodb.archiver.store;

import com.photodb.archiver.model.FingerprintRecord;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Typed view of the fingerprint table: fingerprint → canonical record.
 */
@RequiredArgsConstructor
public class FingerprintRepository {

    private static final String KEY_PREFIX = "fingerprint:";

    private final KeyValueStore store;

    public Optional<FingerprintRecord> find(String fingerprint) {
        return store.get(key(fingerprint), FingerprintRecord.class);
    }

    /**
     * Conditional insert. Exactly one of several concurrent claims for the same
     * fingerprint succeeds; the others get false and must re-read.
     */
    public boolean claim(FingerprintRecord record) {
        return store.put(key(record.getFingerprint()), record, false);
    }

    /**
     * Drop a record found to be stale. Nothing is deleted when the slot has
     * meanwhile been claimed for another file.
     *
     * @return true if {@code stale} was still the stored record and is now gone
     */
    public boolean remove(FingerprintRecord stale) {
        return store.delete(key(stale.getFingerprint()), stale);
    }

    private static String key(String fingerprint) {
        return KEY_PREFIX + fingerprint;
    }
}
