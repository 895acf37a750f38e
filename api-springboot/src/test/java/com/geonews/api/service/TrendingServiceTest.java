package com.geonews.api.service;

import com.geonews.api.MutableClock;
import com.geonews.api.config.GeoNewsProperties;
import com.geonews.api.model.GeoPoint;
import com.geonews.api.model.InteractionEvent;
import com.geonews.api.model.InteractionKind;
import com.geonews.api.model.TrendingResult;
import com.geonews.api.model.TrendingSnapshot;
import com.geonews.api.store.InMemoryArticleStore;
import com.geonews.api.store.InMemoryInteractionStore;
import com.geonews.api.util.GeoMath;
import com.geonews.api.util.SummaryGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static com.geonews.api.TestArticles.located;
import static org.assertj.core.api.Assertions.assertThat;

class TrendingServiceTest {

    private static final GeoPoint MUMBAI = GeoPoint.of(19.076, 72.877);

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-10T12:00:00Z"));
    private final InMemoryArticleStore articleStore = new InMemoryArticleStore();
    private final InMemoryInteractionStore interactionStore = new InMemoryInteractionStore();
    private TrendingService trendingService;

    @BeforeEach
    void setUp() {
        GeoNewsProperties properties = new GeoNewsProperties();
        TrendingResultCache cache = new TrendingResultCache(clock, Runnable::run, properties.getTrending().getTtl());
        trendingService = new TrendingService(articleStore, interactionStore, new TrendingScorer(), cache,
                new SummaryGenerator(), clock, properties);

        articleStore.save(located("quiet", 0.9, 19.10, 72.90));
        articleStore.save(located("busy", 0.5, 19.10, 72.90));
        articleStore.save(located("distant", 0.5, 28.61, 77.21));
    }

    @Test
    void getTrending_ranksInteractedArticlesFirst() {
        interact("busy", Duration.ofHours(1), 5);

        TrendingSnapshot snapshot = trendingService.getTrending(MUMBAI, 3, false);

        assertThat(snapshot.getResults()).extracting(r -> r.getArticle().getId())
                .containsExactly("busy", "quiet", "distant");
        assertThat(snapshot.getClusterKey()).isEqualTo(GeoMath.clusterKey(MUMBAI));
        assertThat(snapshot.getResults()).allSatisfy(r -> assertThat(r.getArticle().getSummary()).isNotBlank());
    }

    @Test
    void getTrending_ignoresInteractionsOutsideWindow() {
        interact("busy", Duration.ofHours(49), 20);

        TrendingResult busy = trendingService.getTrending(MUMBAI, 3, false).getResults().stream()
                .filter(r -> r.getArticle().getId().equals("busy"))
                .findFirst()
                .orElseThrow();

        assertThat(busy.getScore().getVolume()).isZero();
    }

    @Test
    void getTrending_appliesLimit() {
        assertThat(trendingService.getTrending(MUMBAI, 2, false).getResults()).hasSize(2);
    }

    @Test
    void getTrending_servesCachedSnapshotUntilForced() {
        TrendingSnapshot before = trendingService.getTrending(MUMBAI, 3, false);
        interact("busy", Duration.ofMinutes(1), 10);

        TrendingSnapshot cached = trendingService.getTrending(MUMBAI, 3, false);
        TrendingSnapshot forced = trendingService.getTrending(MUMBAI, 3, true);

        assertThat(cached.getResults()).extracting(r -> r.getArticle().getId())
                .containsExactlyElementsOf(before.getResults().stream().map(r -> r.getArticle().getId()).toList());
        assertThat(forced.getResults().get(0).getArticle().getId()).isEqualTo("busy");
    }

    private void interact(String articleId, Duration age, int times) {
        for (int i = 0; i < times; i++) {
            interactionStore.append(InteractionEvent.builder()
                    .id(UUID.randomUUID().toString())
                    .articleId(articleId)
                    .userId("user_" + i)
                    .kind(InteractionKind.SHARE)
                    .timestamp(clock.instant().minus(age))
                    .build());
        }
    }
}
