package com.geonews.api.service;

import com.geonews.api.exception.InvalidInputException;
import com.geonews.api.model.GeoPoint;
import com.geonews.api.model.InteractionEvent;
import com.geonews.api.model.InteractionKind;
import com.geonews.api.model.InteractionRequest;
import com.geonews.api.store.ArticleStore;
import com.geonews.api.store.InteractionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.UUID;

/**
 * Records user interactions for trending
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InteractionService {

    private final ArticleStore articleStore;
    private final InteractionStore interactionStore;
    private final Clock clock;

    /**
     * Validates and appends one interaction. A missing timestamp means now.
     *
     * @throws InvalidInputException for an unknown article or type, or half a coordinate
     */
    public InteractionEvent record(InteractionRequest request) throws IOException {
        if (request.articleId() == null || request.articleId().isBlank()) {
            throw new InvalidInputException("articleId is required");
        }
        InteractionKind kind = InteractionKind.fromValue(request.type());
        if ((request.userLatitude() == null) != (request.userLongitude() == null)) {
            throw new InvalidInputException("userLatitude and userLongitude must be given together");
        }
        if (articleStore.findById(request.articleId()).isEmpty()) {
            throw new InvalidInputException("Unknown article: " + request.articleId());
        }

        InteractionEvent event = InteractionEvent.builder()
                .id(UUID.randomUUID().toString())
                .articleId(request.articleId())
                .userId(request.userId())
                .kind(kind)
                .timestamp(request.timestamp() != null ? request.timestamp() : clock.instant())
                .userLocation(GeoPoint.ofNullable(request.userLatitude(), request.userLongitude()))
                .build();
        interactionStore.append(event);
        log.debug("Recorded {} on article {} by {}", kind, event.getArticleId(), event.getUserId());
        return event;
    }

    public long count() {
        return interactionStore.count();
    }
}
