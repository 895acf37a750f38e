package com.geonews.api.service;

import com.geonews.api.config.GeoNewsProperties;
import com.geonews.api.model.Article;
import com.geonews.api.model.ArticlePredicates;
import com.geonews.api.model.GeoPoint;
import com.geonews.api.model.QueryIntent;
import com.geonews.api.model.QueryResponse;
import com.geonews.api.model.RetrievalParams;
import com.geonews.api.model.RetrievalStrategy;
import com.geonews.api.model.SearchResult;
import com.geonews.api.model.TrendingResult;
import com.geonews.api.store.ArticleStore;
import com.geonews.api.util.GeoMath;
import com.geonews.api.util.SummaryGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Runs retrieval strategies against the article store and composes the natural-language query flow.
 */
@Service
@Slf4j
public class NewsRetrievalService {

    private final ArticleStore articleStore;
    private final IntentResolver intentResolver;
    private final StrategySelector strategySelector;
    private final RelevanceRanker ranker;
    private final TrendingService trendingService;
    private final SummaryGenerator summaryGenerator;
    private final GeoNewsProperties.Retrieval defaults;

    public NewsRetrievalService(ArticleStore articleStore, IntentResolver intentResolver,
                                StrategySelector strategySelector, RelevanceRanker ranker,
                                TrendingService trendingService, SummaryGenerator summaryGenerator,
                                GeoNewsProperties properties) {
        this.articleStore = articleStore;
        this.intentResolver = intentResolver;
        this.strategySelector = strategySelector;
        this.ranker = ranker;
        this.trendingService = trendingService;
        this.summaryGenerator = summaryGenerator;
        this.defaults = properties.getRetrieval();
    }

    public QueryIntent resolveQuery(String text, GeoPoint userLocation) {
        return intentResolver.resolve(text, userLocation);
    }

    /**
     * Resolves the query, picks a strategy and retrieves with it.
     *
     * @param explicit caller-supplied location, radius, limit and structured predicates
     */
    public QueryResponse query(String text, RetrievalParams explicit) throws IOException {
        QueryIntent intent = resolveQuery(text, explicit.getLocation());
        RetrievalStrategy strategy = strategySelector.select(intent, explicit);
        RetrievalParams params = paramsFor(strategy, intent, text, explicit);

        List<Article> articles = retrieve(strategy, params);
        log.info("Query '{}' resolved to intent={} ({}), strategy={}, {} results",
                text, intent.getIntent(), intent.getPath(), strategy, articles.size());

        return QueryResponse.builder()
                .entities(intent.getEntityNames())
                .entityRoles(intent.getEntities())
                .intent(intent.getIntent())
                .confidence(intent.getConfidence())
                .resolution(intent.getPath())
                .strategy(strategy)
                .articles(articles)
                .totalResults(articles.size())
                .queryUsed(text)
                .build();
    }

    /**
     * Runs one strategy and returns its ranked, summarized results.
     */
    public List<Article> retrieve(RetrievalStrategy strategy, RetrievalParams params) throws IOException {
        if (strategy == RetrievalStrategy.TRENDING) {
            if (params.getLocation() == null) {
                throw new IllegalArgumentException("Trending retrieval needs a location");
            }
            return trendingService.getTrending(params.getLocation(), params.getLimit(), false).getResults().stream()
                    .map(TrendingResult::getArticle)
                    .toList();
        }

        List<Article> candidates = articleStore.query(predicatesFor(strategy, params));
        List<Article> ranked = ranker.rank(strategy, candidates, params);
        ranked.forEach(summaryGenerator::ensureSummary);
        log.debug("Strategy {} ranked {} of {} candidates", strategy, ranked.size(), candidates.size());
        return ranked;
    }

    /**
     * Same as {@link #retrieve} with timing and the applied filters attached
     */
    public SearchResult<Article> search(RetrievalStrategy strategy, RetrievalParams params) throws IOException {
        long start = System.currentTimeMillis();
        List<Article> articles = retrieve(strategy, params);
        return SearchResult.<Article>builder()
                .items(articles)
                .total(articles.size())
                .limit(params.getLimit())
                .strategy(strategy)
                .query(params.getText())
                .filtersApplied(params.describe())
                .took(System.currentTimeMillis() - start)
                .build();
    }

    public Optional<Article> getArticle(String id) throws IOException {
        return articleStore.findById(id).map(summaryGenerator::ensureSummary);
    }

    /**
     * Narrows the store query as far as the strategy allows. Nearby uses the radius's
     * bounding box; the ranker applies the exact distance.
     */
    ArticlePredicates predicatesFor(RetrievalStrategy strategy, RetrievalParams params) {
        return switch (strategy) {
            case SEARCH -> ArticlePredicates.builder().text(params.getText()).build();
            case CATEGORY -> ArticlePredicates.builder().category(params.getCategory()).build();
            case SOURCE -> ArticlePredicates.builder().source(params.getSource()).build();
            case SCORE -> ArticlePredicates.builder()
                    .minScore(params.getMinScore())
                    .maxScore(params.getMaxScore())
                    .build();
            case NEARBY -> ArticlePredicates.builder()
                    .requireLocation(true)
                    .boundingBox(params.hasRadius()
                            ? GeoMath.boundingBox(params.getLocation(), params.getRadiusKm())
                            : null)
                    .build();
            case FLEXIBLE -> ArticlePredicates.builder()
                    .text(params.getText())
                    .category(params.getCategory())
                    .source(params.getSource())
                    .minScore(params.getMinScore())
                    .maxScore(params.getMaxScore())
                    .boundingBox(params.hasRadius()
                            ? GeoMath.boundingBox(params.getLocation(), params.getRadiusKm())
                            : null)
                    .build();
            case TRENDING -> ArticlePredicates.none();
        };
    }

    /**
     * Fills in what the selected strategy needs from the resolved intent and the defaults.
     */
    RetrievalParams paramsFor(RetrievalStrategy strategy, QueryIntent intent, String text,
                              RetrievalParams explicit) {
        RetrievalParams params = explicit.getLimit() > 0 ? explicit : explicit.withLimit(defaults.getDefaultLimit());
        return switch (strategy) {
            case CATEGORY -> params.withCategory(intent.getCategory());
            case SOURCE -> params.withSource(intent.getSource());
            case SEARCH -> params.withText(text);
            case SCORE -> params.withMinScore(defaults.getScoreThreshold());
            case NEARBY -> params.getRadiusKm() != null ? params : params.withRadiusKm(defaults.getNearbyRadiusKm());
            case TRENDING, FLEXIBLE -> params;
        };
    }
}
