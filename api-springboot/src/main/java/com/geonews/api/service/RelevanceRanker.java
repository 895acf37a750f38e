package com.geonews.api.service;

import com.geonews.api.model.Article;
import com.geonews.api.model.ArticlePredicates;
import com.geonews.api.model.GeoPoint;
import com.geonews.api.model.RetrievalParams;
import com.geonews.api.model.RetrievalStrategy;
import com.geonews.api.util.GeoMath;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Orders candidate articles for a strategy and cuts the list at the caller's limit. Pure.
 */
@Component
public class RelevanceRanker {

    /** Relevance descending, then newest first; id keeps the order total */
    public static final Comparator<Article> BY_RELEVANCE = Comparator
            .comparingDouble(Article::getRelevanceScore).reversed()
            .thenComparing(Article::getPublishTime, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Article::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    public List<Article> rank(RetrievalStrategy strategy, Collection<Article> candidates, RetrievalParams params) {
        return switch (strategy) {
            case SEARCH, CATEGORY, SOURCE -> byRelevance(candidates.stream(), params.getLimit());
            case SCORE -> byRelevance(candidates.stream().filter(scoreRange(params)), params.getLimit());
            case NEARBY -> nearest(candidates, params);
            case FLEXIBLE -> byRelevance(candidates.stream().filter(allPredicates(params)), params.getLimit());
            case TRENDING -> throw new IllegalArgumentException("Trending results are ordered by the trending scorer");
        };
    }

    /**
     * Articles within the radius, closest first. Articles without coordinates are dropped.
     */
    private List<Article> nearest(Collection<Article> candidates, RetrievalParams params) {
        GeoPoint centre = params.getLocation();
        if (centre == null) {
            throw new IllegalArgumentException("Nearby ranking needs a location");
        }
        return candidates.stream()
                .filter(Article::hasLocation)
                .map(article -> new Distanced(article, GeoMath.distanceKm(centre, article.location())))
                .filter(d -> params.getRadiusKm() == null || d.distanceKm() <= params.getRadiusKm())
                .sorted(Comparator.comparingDouble(Distanced::distanceKm)
                        .thenComparing(Distanced::article, BY_RELEVANCE))
                .limit(params.getLimit())
                .map(Distanced::article)
                .toList();
    }

    private static List<Article> byRelevance(Stream<Article> articles, int limit) {
        return articles.sorted(BY_RELEVANCE).limit(limit).toList();
    }

    private static Predicate<Article> scoreRange(RetrievalParams params) {
        return article -> (params.getMinScore() == null || article.getRelevanceScore() >= params.getMinScore())
                && (params.getMaxScore() == null || article.getRelevanceScore() <= params.getMaxScore());
    }

    /**
     * Conjunction of every supplied predicate: text, category, source, score range, radius
     */
    private static Predicate<Article> allPredicates(RetrievalParams params) {
        ArticlePredicates fieldPredicates = ArticlePredicates.builder()
                .text(params.getText())
                .category(params.getCategory())
                .source(params.getSource())
                .minScore(params.getMinScore())
                .maxScore(params.getMaxScore())
                .build();
        Predicate<Article> predicate = fieldPredicates::matches;
        if (params.hasRadius()) {
            predicate = predicate.and(article -> article.hasLocation()
                    && GeoMath.distanceKm(params.getLocation(), article.location()) <= params.getRadiusKm());
        }
        return predicate;
    }

    private record Distanced(Article article, double distanceKm) {
    }
}
