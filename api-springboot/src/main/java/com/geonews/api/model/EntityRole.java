package com.geonews.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntityRole {
    LOCATION,
    TOPIC,
    ORGANIZATION,
    PERSON;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps an entity type reported by the NLP provider onto a role
     */
    public static EntityRole fromProviderType(String type) {
        if (type == null) {
            return TOPIC;
        }
        return switch (type.toUpperCase(Locale.ROOT)) {
            case "LOCATION", "ADDRESS" -> LOCATION;
            case "ORGANIZATION" -> ORGANIZATION;
            case "PERSON" -> PERSON;
            default -> TOPIC;
        };
    }
}
