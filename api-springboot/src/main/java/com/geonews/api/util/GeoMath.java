package com.geonews.api.util;

import com.geonews.api.model.BoundingBox;
import com.geonews.api.model.ClusterKey;
import com.geonews.api.model.GeoPoint;

/**
 * Spherical distance and grid bucketing. Inputs are assumed to be in range.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_KM = 6371.0;

    /** Length of one degree of arc on the sphere */
    public static final double KM_PER_DEGREE = EARTH_RADIUS_KM * Math.PI / 180.0;

    public static final double CLUSTER_SIZE_KM = 100.0;

    /** Angular width of one trending grid cell, about 0.8993 degrees */
    public static final double CLUSTER_STEP_DEGREES = CLUSTER_SIZE_KM / KM_PER_DEGREE;

    /** Latitude index of the cells touching a pole; each of these rows is a single cell */
    static final int POLAR_INDEX = (int) Math.round(90.0 / CLUSTER_STEP_DEGREES);

    private GeoMath() {
    }

    /**
     * Great-circle distance in kilometres using the haversine formula
     */
    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double deltaLat = Math.toRadians(lat2 - lat1);
        double deltaLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
                + Math.cos(lat1Rad) * Math.cos(lat2Rad)
                * Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }

    public static double distanceKm(GeoPoint a, GeoPoint b) {
        return distanceKm(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    /**
     * Grid cell of a coordinate. Each axis is rounded to the nearest multiple of
     * {@link #CLUSTER_STEP_DEGREES}; half-way points round up, so every point lands in exactly one cell.
     * Longitude 180 is read as -180, and the polar rows have longitude index 0.
     */
    public static ClusterKey clusterKey(double latitude, double longitude) {
        int latitudeIndex = (int) Math.round(latitude / CLUSTER_STEP_DEGREES);
        if (Math.abs(latitudeIndex) >= POLAR_INDEX) {
            return new ClusterKey(latitudeIndex, 0);
        }
        double lon = longitude >= 180.0 ? longitude - 360.0 : longitude;
        return new ClusterKey(latitudeIndex, (int) Math.round(lon / CLUSTER_STEP_DEGREES));
    }

    public static ClusterKey clusterKey(GeoPoint point) {
        return clusterKey(point.latitude(), point.longitude());
    }

    /**
     * Smallest lat/lon box containing the circle of the given radius. Near the poles or
     * across the antimeridian the longitude span widens to the full range.
     */
    public static BoundingBox boundingBox(GeoPoint centre, double radiusKm) {
        double deltaLat = radiusKm / KM_PER_DEGREE;
        double minLat = Math.max(-90.0, centre.latitude() - deltaLat);
        double maxLat = Math.min(90.0, centre.latitude() + deltaLat);

        double angularRadius = radiusKm / EARTH_RADIUS_KM;
        double ratio = Math.sin(angularRadius) / Math.cos(Math.toRadians(centre.latitude()));
        if (minLat <= -90.0 || maxLat >= 90.0 || ratio >= 1.0) {
            return new BoundingBox(minLat, -180.0, maxLat, 180.0);
        }

        double deltaLon = Math.toDegrees(Math.asin(ratio));
        double minLon = centre.longitude() - deltaLon;
        double maxLon = centre.longitude() + deltaLon;
        if (minLon < -180.0 || maxLon > 180.0) {
            return new BoundingBox(minLat, -180.0, maxLat, 180.0);
        }
        return new BoundingBox(minLat, minLon, maxLat, maxLon);
    }
}
