package com.geonews.api.model;

import java.io.Serializable;

/**
 * A latitude/longitude pair in decimal degrees. Range checks happen at the REST boundary.
 */
public record GeoPoint(double latitude, double longitude) implements Serializable {

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    /**
     * Null unless both components are present
     */
    public static GeoPoint ofNullable(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) {
            return null;
        }
        return new GeoPoint(latitude, longitude);
    }
}
