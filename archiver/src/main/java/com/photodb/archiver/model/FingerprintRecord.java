package com.photodb.archiver.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persistent mapping from a content fingerprint to the one file recognised as
 * its archived copy.
 *
 * Invariant: at most one live canonical path per fingerprint. A record whose
 * canonical path no longer exists on disk is stale and gets replaced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FingerprintRecord {

    /** xxHash64 of the file contents, 16 lowercase hex chars */
    private String fingerprint;

    /** Path relative to the archive root, '/' separated (absolute when outside the root) */
    private String canonicalPath;

    // ── Metadata captured when the slot was claimed ──────────────────────────
    private String date;            // yyyy-MM-dd
    private String location;        // display string, null when unknown
    private Double latitude;
    private Double longitude;
}
