package com.photodb.archiver.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Metadata derived for one file during one pass. Never persisted as such;
 * the interesting parts are copied into the FingerprintRecord.
 */
@Data
@Builder
public class MediaRecord {

    private LocalDateTime timestamp;
    private String date;            // yyyy-MM-dd
    private String year;            // yyyy
    private Coordinate coordinate;  // null when the file carries no GPS tags
    private String location;        // null when unknown or the geocoder failed
}
