package com.geonews.api.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.geonews.api.util.GeoMath;

/**
 * Cell of the fixed trending grid, addressed by integer step indices.
 */
public record ClusterKey(int latitudeIndex, int longitudeIndex) {

    /**
     * Representative coordinate of the cell, used when scoring on behalf of everyone inside it
     */
    public GeoPoint centre() {
        return new GeoPoint(latitudeIndex * GeoMath.CLUSTER_STEP_DEGREES,
                longitudeIndex * GeoMath.CLUSTER_STEP_DEGREES);
    }

    @JsonValue
    @Override
    public String toString() {
        return latitudeIndex + "_" + longitudeIndex;
    }
}
