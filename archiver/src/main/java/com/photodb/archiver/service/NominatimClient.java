package com.photodb.archiver.service;

import com.photodb.archiver.model.Coordinate;
import com.photodb.archiver.model.GeocodeAddress;
import com.photodb.archiver.model.NominatimResponse;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Optional;

/**
 * Thin client over the OpenStreetMap Nominatim reverse endpoint.
 *
 * Nominatim's usage policy allows at most one request per second per client;
 * we stay well under it with the shared {@link GeocodeThrottle} (one call per
 * 5 seconds by default). Every attempt, retries included, waits for a permit,
 * so a worker blocks during the cool-down instead of failing.
 * 5xx and 429 responses trigger the Resilience4j retry with exponential backoff.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NominatimClient implements ReverseGeocoder {

    private final RestTemplate geocoderRestTemplate;
    private final GeocodeThrottle geocodeThrottle;

    @Override
    @Retry(name = "nominatim")
    public Optional<GeocodeAddress> reverse(Coordinate coordinate) {
        String url = UriComponentsBuilder.fromPath("/reverse")
                .queryParam("format", "jsonv2")
                .queryParam("addressdetails", 1)
                .queryParam("lat", coordinate.latitude())
                .queryParam("lon", coordinate.longitude())
                .toUriString();

        geocodeThrottle.acquire();
        log.debug("Calling Nominatim: {}", url);
        NominatimResponse response = geocoderRestTemplate.getForObject(url, NominatimResponse.class);

        if (response == null || response.getAddress() == null) {
            log.debug("Nominatim has no address for {}: {}", coordinate.cacheKey(),
                    response == null ? "empty body" : response.getError());
            return Optional.empty();
        }
        return Optional.of(toAddress(response.getAddress()));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private GeocodeAddress toAddress(NominatimResponse.Address raw) {
        return GeocodeAddress.builder()
                .houseNumber(emptyToNull(raw.getHouseNumber()))
                .road(emptyToNull(raw.getRoad()))
                .city(emptyToNull(raw.getCity()))
                .town(emptyToNull(raw.getTown()))
                .county(emptyToNull(raw.getCounty()))
                .state(emptyToNull(raw.getState()))
                .stateCode(emptyToNull(raw.getIso3166Lvl4()))
                .countryCode(emptyToNull(raw.getCountryCode()))
                .build();
    }

    private String emptyToNull(String val) {
        return StringUtils.hasText(val) ? val.trim() : null;
    }
}
