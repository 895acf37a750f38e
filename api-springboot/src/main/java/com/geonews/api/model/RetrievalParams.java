package com.geonews.api.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied retrieval bounds. Every field is optional except the limit.
 */
@Value
@Builder(toBuilder = true)
@With
public class RetrievalParams {

    String text;
    String category;
    String source;
    Double minScore;
    Double maxScore;
    GeoPoint location;
    Double radiusKm;
    int limit;

    /**
     * True when any structured predicate (category, source, score bounds) was supplied
     */
    public boolean hasStructuredPredicates() {
        return category != null || source != null || minScore != null || maxScore != null;
    }

    public boolean hasRadius() {
        return location != null && radiusKm != null;
    }

    /**
     * The supplied predicates, for echoing back in responses
     */
    public Map<String, Object> describe() {
        Map<String, Object> applied = new LinkedHashMap<>();
        if (text != null) {
            applied.put("text", text);
        }
        if (category != null) {
            applied.put("category", category);
        }
        if (source != null) {
            applied.put("source", source);
        }
        if (minScore != null) {
            applied.put("minScore", minScore);
        }
        if (maxScore != null) {
            applied.put("maxScore", maxScore);
        }
        if (location != null) {
            applied.put("latitude", location.latitude());
            applied.put("longitude", location.longitude());
        }
        if (radiusKm != null) {
            applied.put("radiusKm", radiusKm);
        }
        applied.put("limit", limit);
        return applied;
    }
}
