package com.photodb.archiver.service;

import com.photodb.archiver.model.Coordinate;
import com.photodb.archiver.model.GeocodeAddress;

import java.util.Optional;

/**
 * Maps a coordinate to address fields. Implementations are expected to be slow
 * and rate limited; callers go through {@link LocationResolver}.
 */
public interface ReverseGeocoder {

    /**
     * @return the address, or empty when the service knows nothing about the point
     * @throws RuntimeException on transport or service failure
     */
    Optional<GeocodeAddress> reverse(Coordinate coordinate);
}
