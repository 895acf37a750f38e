package com.geonews.api.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geonews.api.config.GeoNewsProperties;
import com.geonews.api.model.Article;
import com.geonews.api.model.ArticlePredicates;
import com.geonews.api.model.GeoPoint;
import com.geonews.api.model.InteractionEvent;
import com.geonews.api.model.InteractionKind;
import com.geonews.api.model.InteractionRequest;
import com.geonews.api.store.ArticleStore;
import com.geonews.api.store.InteractionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * Seeds synthetic interactions at startup so trending has something to rank. Runs only
 * while the interaction store is empty. Events go to Kafka when it is enabled, otherwise
 * straight into the store.
 */
@Component
@Order(2)
@ConditionalOnProperty(prefix = "geonews.simulator", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class InteractionSimulator implements ApplicationRunner {

    private static final InteractionKind[] KINDS = {
            InteractionKind.VIEW, InteractionKind.CLICK, InteractionKind.SHARE,
            InteractionKind.BOOKMARK, InteractionKind.COMMENT};
    private static final double[] KIND_WEIGHTS = {0.30, 0.40, 0.20, 0.08, 0.02};

    private static final int[] HOURS_AGO = {1, 2, 4, 8, 12, 24};
    private static final double[] HOURS_AGO_WEIGHTS = {0.30, 0.25, 0.20, 0.15, 0.08, 0.02};

    private static final double USER_SPREAD_DEGREES = 0.5;
    private static final int MAX_EXTRA_INTERACTIONS = 5;

    private final ArticleStore articleStore;
    private final InteractionStore interactionStore;
    private final ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final GeoNewsProperties properties;
    private final Random random;

    public InteractionSimulator(ArticleStore articleStore, InteractionStore interactionStore,
                                ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate,
                                ObjectMapper objectMapper, Clock clock, GeoNewsProperties properties) {
        this.articleStore = articleStore;
        this.interactionStore = interactionStore;
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
        long seed = properties.getSimulator().getSeed();
        this.random = seed != 0 ? new Random(seed) : new Random();
    }

    @Override
    public void run(ApplicationArguments args) {
        if (interactionStore.count() > 0) {
            log.info("Interaction store already populated, skipping simulation");
            return;
        }

        try {
            List<Article> articles = articleStore.query(ArticlePredicates.none()).stream()
                    .sorted(Comparator.comparing(Article::getId))
                    .limit(properties.getSimulator().getMaxArticles())
                    .toList();
            if (articles.isEmpty()) {
                log.warn("No articles found. Skipping interaction simulation.");
                return;
            }

            List<InteractionEvent> events = generate(articles, clock.instant());
            if (properties.getKafka().isEnabled()) {
                publish(events);
            } else {
                events.forEach(interactionStore::append);
            }
            log.info("Simulated {} interactions across {} articles", events.size(), articles.size());
        } catch (IOException e) {
            log.error("Error fetching articles for simulation: {}", e.getMessage(), e);
        }
    }

    /**
     * Per article: {@code max(1, relevance*10) + [0, 5]} events, kinds and ages drawn from fixed
     * distributions, users placed within half a degree of the article (anywhere when it has no coordinate).
     */
    List<InteractionEvent> generate(List<Article> articles, Instant now) {
        List<InteractionEvent> events = new ArrayList<>();
        for (Article article : articles) {
            int count = Math.max(1, (int) (article.getRelevanceScore() * 10)) + random.nextInt(MAX_EXTRA_INTERACTIONS + 1);
            for (int i = 0; i < count; i++) {
                int hoursAgo = HOURS_AGO[pick(HOURS_AGO_WEIGHTS)];
                events.add(InteractionEvent.builder()
                        .id(UUID.randomUUID().toString())
                        .articleId(article.getId())
                        .userId("user_" + (1 + random.nextInt(1000)))
                        .kind(KINDS[pick(KIND_WEIGHTS)])
                        .timestamp(now.minus(Duration.ofHours(hoursAgo)))
                        .userLocation(userLocation(article))
                        .build());
            }
        }
        return events;
    }

    private GeoPoint userLocation(Article article) {
        if (article.hasLocation()) {
            double latitude = article.getLatitude() + spread();
            double longitude = article.getLongitude() + spread();
            return GeoPoint.of(Math.max(-90.0, Math.min(90.0, latitude)), Math.max(-180.0, Math.min(180.0, longitude)));
        }
        return GeoPoint.of(random.nextDouble() * 180.0 - 90.0, random.nextDouble() * 360.0 - 180.0);
    }

    private double spread() {
        return (random.nextDouble() * 2.0 - 1.0) * USER_SPREAD_DEGREES;
    }

    private int pick(double[] weights) {
        double total = 0.0;
        for (double weight : weights) {
            total += weight;
        }
        double roll = random.nextDouble() * total;
        for (int i = 0; i < weights.length; i++) {
            roll -= weights[i];
            if (roll < 0) {
                return i;
            }
        }
        return weights.length - 1;
    }

    private void publish(List<InteractionEvent> events) {
        KafkaTemplate<String, String> template = kafkaTemplate.getIfAvailable();
        if (template == null) {
            log.warn("Kafka enabled but no KafkaTemplate available, writing interactions directly");
            events.forEach(interactionStore::append);
            return;
        }
        String topic = properties.getKafka().getInteractionsTopic();
        for (InteractionEvent event : events) {
            GeoPoint location = event.getUserLocation();
            InteractionRequest request = new InteractionRequest(event.getArticleId(), event.getUserId(),
                    event.getKind().value(), event.getTimestamp(),
                    location != null ? location.latitude() : null,
                    location != null ? location.longitude() : null);
            try {
                template.send(topic, event.getUserId(), objectMapper.writeValueAsString(request));
            } catch (JsonProcessingException e) {
                log.error("Error serializing simulated interaction: {}", e.getMessage());
            }
        }
        log.info("Finished sending {} events to Kafka topic '{}'", events.size(), topic);
    }
}
