package com.photodb.archiver.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Decimal GPS position. South latitudes and west longitudes are negative.
 */
public record Coordinate(double latitude, double longitude) {

    /**
     * Convert EXIF degrees/minutes/seconds triples plus hemisphere refs.
     * A ref of "S" negates the latitude and "W" negates the longitude.
     */
    public static Coordinate fromDms(double[] latitudeDms, String latitudeRef,
                                     double[] longitudeDms, String longitudeRef) {
        double lat = toDecimal(latitudeDms);
        double lng = toDecimal(longitudeDms);
        if ("S".equalsIgnoreCase(trim(latitudeRef))) {
            lat = -lat;
        }
        if ("W".equalsIgnoreCase(trim(longitudeRef))) {
            lng = -lng;
        }
        return new Coordinate(lat, lng);
    }

    /** Rounded to 6 decimals, the bucket shared by nearby shots. */
    public Coordinate rounded() {
        return new Coordinate(round6(latitude), round6(longitude));
    }

    /** Canonical geocode cache key, e.g. "10.500000,-20.250000". */
    public String cacheKey() {
        Coordinate r = rounded();
        return String.format(Locale.ROOT, "%.6f,%.6f", r.latitude(), r.longitude());
    }

    private static double toDecimal(double[] dms) {
        if (dms == null || dms.length != 3) {
            throw new IllegalArgumentException("Expected degrees/minutes/seconds triple");
        }
        return ((dms[0] * 60 + dms[1]) * 60 + dms[2]) / 3600.0;
    }

    private static double round6(double value) {
        return BigDecimal.valueOf(value).setScale(6, RoundingMode.HALF_UP).doubleValue();
    }

    private static String trim(String ref) {
        return ref == null ? "" : ref.trim();
    }
}
