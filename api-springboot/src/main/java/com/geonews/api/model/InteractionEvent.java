package com.geonews.api.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One recorded user interaction with an article. Events are append-only.
 */
@Value
@Builder
public class InteractionEvent {

    String id;
    String articleId;
    String userId;
    InteractionKind kind;
    Instant timestamp;

    /** Where the user was, when known */
    GeoPoint userLocation;
}
