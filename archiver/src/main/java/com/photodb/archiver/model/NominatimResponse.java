package com.photodb.archiver.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw DTO matching the Nominatim /reverse JSON structure.
 * Kept separate from GeocodeAddress to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NominatimResponse {

    @JsonProperty("display_name")
    private String displayName;

    /** Present instead of an address when the point cannot be geocoded */
    private String error;

    private Address address;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Address {

        @JsonProperty("house_number")
        private String houseNumber;

        private String road;
        private String city;
        private String town;
        private String county;
        private String state;

        @JsonProperty("ISO3166-2-lvl4")
        private String iso3166Lvl4;

        @JsonProperty("country_code")
        private String countryCode;
    }
}
