package com.geonews.api.store;

import com.geonews.api.model.InteractionEvent;

import java.util.List;

/**
 * Append-only log of user interactions, read per article.
 */
public interface InteractionStore {

    List<InteractionEvent> eventsFor(String articleId);

    void append(InteractionEvent event);

    long count();
}
