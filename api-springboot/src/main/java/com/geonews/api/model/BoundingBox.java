package com.geonews.api.model;

/**
 * Axis-aligned coordinate box used as a cheap pre-filter before exact distance checks.
 */
public record BoundingBox(double minLatitude, double minLongitude, double maxLatitude, double maxLongitude) {

    public boolean contains(double latitude, double longitude) {
        return latitude >= minLatitude && latitude <= maxLatitude
                && longitude >= minLongitude && longitude <= maxLongitude;
    }
}
