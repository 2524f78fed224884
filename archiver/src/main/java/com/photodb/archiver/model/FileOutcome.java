package com.photodb.archiver.model;

public enum FileOutcome {
    /** First sighting of the fingerprint, record created */
    NEW,
    /** Record points at this very file */
    ALREADY_ARCHIVED,
    /** Record points at another existing file */
    DUPLICATE,
    /** Record pointed at a missing file and now points here */
    STALE_REPLACED,
    /** Skip list, unresolvable timestamp, HEIC original handed off */
    SKIPPED,
    /** Hashing, claiming or placement failed */
    FAILED
}
