package com.photodb.archiver.service;

import com.photodb.archiver.config.ArchiverProperties;
import com.photodb.archiver.model.GeocodeAddress;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Turns cached address fields into the folder label used for placement.
 *
 * Priority:
 *   1. exact override from photo-archiver.locations, keyed by
 *      "{house_number} {road}, {city}, {state}"
 *   2. "{road}, {city}, {state}" when the road is known
 *   3. "{city}, {state}"
 *
 * city falls back to town, then county. state is the ISO 3166-2 code without
 * its country prefix ("US-CA" → "CA"), or the state name when no code is given.
 */
@Component
@RequiredArgsConstructor
public class LocationFormatter {

    private static final Pattern COUNTRY_PREFIX = Pattern.compile("^[A-Za-z]{2}-");

    private final ArchiverProperties properties;

    public Optional<String> format(GeocodeAddress address) {
        String road = text(address.getRoad());
        String city = firstText(address.getCity(), address.getTown(), address.getCounty());
        String state = state(address);

        String overrideKey = (text(address.getHouseNumber()) + " " + road).trim() + ", " + city + ", " + state;
        Map<String, String> overrides = properties.getLocations();
        if (overrides != null && overrides.containsKey(overrideKey)) {
            return Optional.of(overrides.get(overrideKey));
        }

        StringJoiner label = new StringJoiner(", ");
        if (!road.isEmpty()) {
            label.add(road);
        }
        if (!city.isEmpty()) {
            label.add(city);
        }
        if (!state.isEmpty()) {
            label.add(state);
        }
        String result = label.toString();
        return result.isEmpty() ? Optional.empty() : Optional.of(result);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static String state(GeocodeAddress address) {
        String code = text(address.getStateCode());
        if (!code.isEmpty()) {
            return COUNTRY_PREFIX.matcher(code).replaceFirst("");
        }
        return text(address.getState());
    }

    private static String firstText(String... candidates) {
        for (String candidate : candidates) {
            if (StringUtils.hasText(candidate)) {
                return candidate.trim();
            }
        }
        return "";
    }

    private static String text(String val) {
        return StringUtils.hasText(val) ? val.trim() : "";
    }
}
