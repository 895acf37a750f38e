package com.geonews.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.geonews.api.exception.InvalidInputException;

import java.util.Locale;

/**
 * Kinds of user interaction and the weight each contributes to engagement.
 */
public enum InteractionKind {
    VIEW(1),
    CLICK(2),
    SHARE(3),
    BOOKMARK(2),
    COMMENT(2);

    private final int weight;

    InteractionKind(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InteractionKind fromValue(String value) {
        if (value == null) {
            throw new InvalidInputException("Interaction type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Unknown interaction type: " + value);
        }
    }
}
