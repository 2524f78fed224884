package com.photodb.archiver.store;

import com.photodb.archiver.model.Coordinate;
import com.photodb.archiver.model.GeocodeAddress;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Reverse-geocode results keyed by coordinate rounded to 6 decimals.
 * Entries are immutable and never expire.
 */
@RequiredArgsConstructor
public class GeocodeCache {

    private static final String KEY_PREFIX = "geocode:";

    private final KeyValueStore store;

    public Optional<GeocodeAddress> find(Coordinate coordinate) {
        return store.get(KEY_PREFIX + coordinate.cacheKey(), GeocodeAddress.class);
    }

    /** First write wins; a concurrent lookup of the same bucket leaves the earlier entry. */
    public boolean store(Coordinate coordinate, GeocodeAddress address) {
        return store.put(KEY_PREFIX + coordinate.cacheKey(), address, false);
    }
}
