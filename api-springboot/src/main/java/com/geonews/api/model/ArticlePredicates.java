package com.geonews.api.model;

import lombok.Builder;
import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Structured filter handed to an {@link com.geonews.api.store.ArticleStore}. All
 * supplied fields must hold (logical AND); absent fields do not constrain.
 */
@Value
@Builder
public class ArticlePredicates {

    private static final ArticlePredicates NONE = ArticlePredicates.builder().build();

    String category;
    String source;

    /** Whitespace-separated terms; any term contained in title or description matches */
    String text;

    Double minScore;
    Double maxScore;
    BoundingBox boundingBox;
    boolean requireLocation;

    public static ArticlePredicates none() {
        return NONE;
    }

    public List<String> textTerms() {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .filter(term -> !term.isEmpty())
                .toList();
    }

    public boolean matches(Article article) {
        if (category != null && !article.inCategory(category)) {
            return false;
        }
        if (source != null && !source.equalsIgnoreCase(article.getSource())) {
            return false;
        }
        if (minScore != null && article.getRelevanceScore() < minScore) {
            return false;
        }
        if (maxScore != null && article.getRelevanceScore() > maxScore) {
            return false;
        }
        if ((requireLocation || boundingBox != null) && !article.hasLocation()) {
            return false;
        }
        if (boundingBox != null && !boundingBox.contains(article.getLatitude(), article.getLongitude())) {
            return false;
        }
        return matchesText(article);
    }

    private boolean matchesText(Article article) {
        List<String> terms = textTerms();
        if (terms.isEmpty()) {
            return true;
        }
        String title = lower(article.getTitle());
        String description = lower(article.getDescription());
        return terms.stream().anyMatch(term -> title.contains(term) || description.contains(term));
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
