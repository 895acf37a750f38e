package com.geonews.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The closed set of retrieval strategies. Dispatch on this type is done with
 * switch expressions so a new constant fails compilation until every site handles it.
 */
public enum RetrievalStrategy {
    CATEGORY,
    SOURCE,
    SEARCH,
    SCORE,
    NEARBY,
    TRENDING,
    FLEXIBLE;

    public static RetrievalStrategy forIntent(IntentType intent) {
        return switch (intent) {
            case CATEGORY -> CATEGORY;
            case SOURCE -> SOURCE;
            case SEARCH -> SEARCH;
            case SCORE -> SCORE;
            case NEARBY -> NEARBY;
            case TRENDING -> TRENDING;
            case FLEXIBLE -> FLEXIBLE;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
