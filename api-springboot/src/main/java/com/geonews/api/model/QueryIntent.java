package com.geonews.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Resolved meaning of a free-text query.
 */
@Value
@Builder
public class QueryIntent {

    IntentType intent;
    double confidence;
    ResolutionPath path;

    /** Entity text to semantic role, in order of appearance */
    @Singular
    Map<String, EntityRole> entities;

    /** Per-intent confidence; the selector picks the strongest one it can satisfy */
    @Singular
    Map<IntentType, Double> signals;

    /** Canonical category matched from the query, if any */
    String category;

    /** Canonical source name matched from the query, if any */
    String source;

    @JsonIgnore
    public List<String> getEntityNames() {
        return List.copyOf(entities.keySet());
    }

    public List<String> entitiesWithRole(EntityRole role) {
        return entities.entrySet().stream()
                .filter(e -> e.getValue() == role)
                .map(Map.Entry::getKey)
                .toList();
    }

    public double signal(IntentType type) {
        return signals.getOrDefault(type, 0.0);
    }
}
