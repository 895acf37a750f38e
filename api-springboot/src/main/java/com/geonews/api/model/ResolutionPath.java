package com.geonews.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which path produced a {@link QueryIntent}.
 */
public enum ResolutionPath {
    /** Entities came from the NLP provider */
    NLP,
    /** NLP provider failed or was skipped; local keyword heuristic was used */
    FALLBACK;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
