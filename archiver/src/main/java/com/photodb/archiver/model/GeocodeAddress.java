package com.photodb.archiver.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw address fields returned by the reverse geocoder, cached forever per
 * rounded coordinate. Blank fields are normalised to null before caching.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeocodeAddress {

    private String houseNumber;
    private String road;
    private String city;
    private String town;
    private String county;

    /** Full state name, e.g. "California" */
    private String state;

    /** ISO 3166-2 level 4 subdivision code, e.g. "US-CA" */
    private String stateCode;

    private String countryCode;
}
