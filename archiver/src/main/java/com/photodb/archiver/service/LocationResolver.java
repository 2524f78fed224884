package com.photodb.archiver.service;

import com.photodb.archiver.model.Coordinate;
import com.photodb.archiver.model.GeocodeAddress;
import com.photodb.archiver.store.GeocodeCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Coordinate → display label, going through the geocode cache first.
 *
 * Only successful lookups are cached, so a failed or empty answer is asked
 * again on a later run. Geocoder failures never propagate: the file is simply
 * placed without a location.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LocationResolver {

    private final GeocodeCache geocodeCache;
    private final ReverseGeocoder reverseGeocoder;
    private final LocationFormatter locationFormatter;

    public Optional<String> resolve(Coordinate coordinate) {
        Coordinate bucket = coordinate.rounded();
        Optional<GeocodeAddress> address = geocodeCache.find(bucket);
        if (address.isEmpty()) {
            address = lookup(bucket);
            address.ifPresent(found -> geocodeCache.store(bucket, found));
        }
        return address.flatMap(locationFormatter::format);
    }

    private Optional<GeocodeAddress> lookup(Coordinate bucket) {
        try {
            Optional<GeocodeAddress> address = reverseGeocoder.reverse(bucket);
            log.debug("Geocoded {} → {}", bucket.cacheKey(), address.orElse(null));
            return address;
        } catch (RuntimeException e) {
            log.warn("Reverse geocode failed for {}, continuing without location: {}",
                    bucket.cacheKey(), e.getMessage());
            return Optional.empty();
        }
    }
}
