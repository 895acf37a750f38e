package com.geonews.api.store;

import com.geonews.api.model.InteractionEvent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class InMemoryInteractionStore implements InteractionStore {

    private final Map<String, List<InteractionEvent>> eventsByArticle = new ConcurrentHashMap<>();
    private final AtomicLong total = new AtomicLong();

    @Override
    public List<InteractionEvent> eventsFor(String articleId) {
        List<InteractionEvent> events = eventsByArticle.get(articleId);
        return events == null ? List.of() : List.copyOf(events);
    }

    @Override
    public void append(InteractionEvent event) {
        eventsByArticle.computeIfAbsent(event.getArticleId(), id -> new CopyOnWriteArrayList<>()).add(event);
        total.incrementAndGet();
    }

    @Override
    public long count() {
        return total.get();
    }
}
