package com.geonews.api.service;

import com.geonews.api.model.Article;
import com.geonews.api.model.GeoPoint;
import com.geonews.api.model.InteractionEvent;
import com.geonews.api.model.TrendingScore;
import com.geonews.api.util.GeoMath;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * Scores one article's popularity for a viewer position.
 *
 * <p>Every event is decayed on its own, {@code e^(-age_seconds / 86400)}, and the decayed
 * values are summed, so steady engagement outweighs a single late burst. The sums feed
 * three of the five factors:
 * <ul>
 *   <li>volume: {@code min(Σ decay / 10, 1)}</li>
 *   <li>engagement: {@code min(Σ weight·decay / 20, 1)} with weights from {@link com.geonews.api.model.InteractionKind}</li>
 *   <li>recency: {@code 1 - e^(-Σ decay)}</li>
 *   <li>geo: {@code 1 / (1 + km / 100)}, or 0.5 for articles without a coordinate</li>
 *   <li>relevance: the article's own relevance score</li>
 * </ul>
 * With no events the first three factors are zero and the score reduces to geo and relevance.
 */
@Component
public class TrendingScorer {

    static final double DECAY_SECONDS = 86_400.0;
    static final double VOLUME_SATURATION = 10.0;
    static final double ENGAGEMENT_SATURATION = 20.0;
    static final double GEO_HALF_DISTANCE_KM = 100.0;
    static final double UNLOCATED_GEO = 0.5;

    public TrendingScore score(Article article, Collection<InteractionEvent> events, GeoPoint viewer, Instant now) {
        double decayedCount = 0.0;
        double decayedWeight = 0.0;
        for (InteractionEvent event : events) {
            double decay = decay(event.getTimestamp(), now);
            decayedCount += decay;
            decayedWeight += event.getKind().weight() * decay;
        }

        return TrendingScore.builder()
                .volume(Math.min(decayedCount / VOLUME_SATURATION, 1.0))
                .engagement(Math.min(decayedWeight / ENGAGEMENT_SATURATION, 1.0))
                .recency(1.0 - Math.exp(-decayedCount))
                .geo(geoRelevance(viewer, article))
                .relevance(article.getRelevanceScore())
                .build();
    }

    /**
     * Equals 1.0 at the viewer's position and 0.5 at 100 km
     */
    public double geoRelevance(GeoPoint viewer, Article article) {
        if (viewer == null || !article.hasLocation()) {
            return UNLOCATED_GEO;
        }
        double distance = GeoMath.distanceKm(viewer, article.location());
        return 1.0 / (1.0 + distance / GEO_HALF_DISTANCE_KM);
    }

    static double decay(Instant timestamp, Instant now) {
        // future timestamps (clock skew) count as brand new
        double ageSeconds = Math.max(0.0, Duration.between(timestamp, now).toMillis() / 1000.0);
        return Math.exp(-ageSeconds / DECAY_SECONDS);
    }
}
