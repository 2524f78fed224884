package com.photodb.archiver.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "photo-archiver")
@Data
public class ArchiverProperties {

    /** Archive root: files are synchronized in place here and imports are copied below it. */
    private String mainDir = "/data/photos";

    /** Staging directory scanned in IMPORT mode. */
    private String incomingDir = "/data/incoming";

    /** Duplicates are relocated here, keeping their path relative to the scan root. */
    private String duplicateDir = "/data/duplicates";

    /** File names that are never processed, e.g. .DS_Store. */
    private Set<String> skipFiles = new HashSet<>();

    /**
     * Exact address string ("{house_number} {road}, {city}, {state}") to preferred
     * folder label, e.g. "12 Main St, Springfield, IL" → "Home".
     *
     * Keys must be bracketed in YAML, {@code "[12 Main St, Springfield, IL]": Home};
     * Spring Boot strips spaces and commas from unbracketed map keys, so the plain
     * form binds as "12MainStSpringfieldIL" and never matches.
     */
    private Map<String, String> locations = new HashMap<>();

    private Store store = new Store();
    private Geocoder geocoder = new Geocoder();
    private Run run = new Run();
    private Report report = new Report();

    @Data
    public static class Store {
        private String fingerprintDb = "photos.db";
        private String geocodeDb = "geocode.db";
    }

    @Data
    public static class Geocoder {
        private String baseUrl = "https://nominatim.openstreetmap.org";
        private String userAgent = "PhotoDB";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Run {
        private boolean enabled = true;
        private RunMode mode = RunMode.SYNC;
        private int workers = 4;
        private boolean moveDuplicates = true;
        private boolean force = false;
        private boolean convertHeic = true;

        public enum RunMode {
            SYNC, IMPORT
        }
    }

    @Data
    public static class Report {
        /** Directory for the per-run CSV report; blank disables it. */
        private String csvDir = "";
    }
}
