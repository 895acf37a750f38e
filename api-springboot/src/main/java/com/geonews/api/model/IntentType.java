package com.geonews.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Retrieval goal inferred from a query.
 */
public enum IntentType {
    CATEGORY,
    SOURCE,
    SEARCH,
    SCORE,
    NEARBY,
    TRENDING,
    FLEXIBLE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
