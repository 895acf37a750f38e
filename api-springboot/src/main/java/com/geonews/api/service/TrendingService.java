package com.geonews.api.service;

import com.geonews.api.config.GeoNewsProperties;
import com.geonews.api.model.Article;
import com.geonews.api.model.ArticlePredicates;
import com.geonews.api.model.ClusterKey;
import com.geonews.api.model.GeoPoint;
import com.geonews.api.model.InteractionEvent;
import com.geonews.api.model.TrendingResult;
import com.geonews.api.model.TrendingSnapshot;
import com.geonews.api.store.ArticleStore;
import com.geonews.api.store.InteractionStore;
import com.geonews.api.util.GeoMath;
import com.geonews.api.util.SummaryGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Service for location-aware trending articles
 */
@Service
@Slf4j
public class TrendingService {

    private static final Comparator<TrendingResult> BY_SCORE = Comparator
            .comparingDouble((TrendingResult r) -> r.getScore().getScore()).reversed()
            .thenComparing(TrendingResult::getArticle, RelevanceRanker.BY_RELEVANCE);

    private final ArticleStore articleStore;
    private final InteractionStore interactionStore;
    private final TrendingScorer scorer;
    private final TrendingResultCache cache;
    private final SummaryGenerator summaryGenerator;
    private final Clock clock;
    private final Duration interactionWindow;

    public TrendingService(ArticleStore articleStore, InteractionStore interactionStore, TrendingScorer scorer,
                           TrendingResultCache cache, SummaryGenerator summaryGenerator, Clock clock,
                           GeoNewsProperties properties) {
        this.articleStore = articleStore;
        this.interactionStore = interactionStore;
        this.scorer = scorer;
        this.cache = cache;
        this.summaryGenerator = summaryGenerator;
        this.clock = clock;
        this.interactionWindow = properties.getTrending().getInteractionWindow();
    }

    /**
     * Top trending articles for the grid cell containing {@code location}.
     *
     * @param forceRefresh recompute even if a fresh snapshot is cached
     */
    public TrendingSnapshot getTrending(GeoPoint location, int limit, boolean forceRefresh) {
        ClusterKey key = GeoMath.clusterKey(location);
        TrendingSnapshot snapshot = cache.get(key, forceRefresh, this::computeSnapshot);
        List<TrendingResult> top = snapshot.top(limit);
        top.forEach(result -> summaryGenerator.ensureSummary(result.getArticle()));
        return new TrendingSnapshot(key, top, snapshot.getComputedAt());
    }

    /**
     * Scores every stored article against the cluster centre. Only interactions inside
     * the window count.
     */
    TrendingSnapshot computeSnapshot(ClusterKey key) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(interactionWindow);
        GeoPoint centre = key.centre();

        List<Article> candidates;
        try {
            candidates = articleStore.query(ArticlePredicates.none());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load trending candidates for cluster " + key, e);
        }

        List<TrendingResult> results = candidates.stream()
                .map(article -> {
                    List<InteractionEvent> recent = interactionStore.eventsFor(article.getId()).stream()
                            .filter(event -> !event.getTimestamp().isBefore(cutoff))
                            .toList();
                    return new TrendingResult(article, scorer.score(article, recent, centre, now), key, now);
                })
                .sorted(BY_SCORE)
                .toList();

        log.info("Calculated trending scores for {} articles in location cluster {}", results.size(), key);
        return new TrendingSnapshot(key, results, now);
    }
}
