package com.geonews.api.service;

import com.geonews.api.exception.NlpUnavailableException;
import com.geonews.api.model.EntityRole;
import com.geonews.api.model.GeoPoint;
import com.geonews.api.model.IntentType;
import com.geonews.api.model.NlpAnalysis;
import com.geonews.api.model.QueryIntent;
import com.geonews.api.model.ResolutionPath;
import com.geonews.api.service.QueryVocabulary.Match;
import com.geonews.api.service.QueryVocabulary.Token;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns free text into a {@link QueryIntent}. Entities come from the NLP provider when it
 * answers and from the local vocabulary when it does not; the outcome is tagged with the
 * path taken. Never throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntentResolver {

    public static final double FALLBACK_CONFIDENCE = 0.5;

    static final double CATEGORY_SIGNAL = 0.9;
    static final double SOURCE_SIGNAL = 0.85;
    static final double NEARBY_SIGNAL = 0.8;
    static final double TRENDING_SIGNAL = 0.75;
    static final double SCORE_SIGNAL = 0.7;
    static final double LOCATION_ONLY_SIGNAL = 0.6;
    static final double UNANCHORED_NEARBY_SIGNAL = 0.4;
    static final double SEARCH_SIGNAL = 0.3;

    static final Set<String> NEARBY_KEYWORDS = Set.of("near", "nearby", "around", "close to", "near me", "local", "locally");
    static final Set<String> TRENDING_KEYWORDS = Set.of("trending", "popular", "viral", "hot");
    static final Set<String> SCORE_KEYWORDS = Set.of("top", "best", "highly rated", "highest rated", "most relevant",
            "high score", "important");

    private final LanguageAnalyzer languageAnalyzer;
    private final QueryVocabulary vocabulary;

    public QueryIntent resolve(String text, GeoPoint userLocation) {
        String query = text == null ? "" : text.trim();
        if (query.isEmpty()) {
            return fallback(query, userLocation);
        }

        try {
            NlpAnalysis analysis = languageAnalyzer.analyze(query);
            QueryIntent intent = fromAnalysis(query, analysis, userLocation);
            log.debug("Resolved '{}' via NLP: intent={}, entities={}", query, intent.getIntent(), intent.getEntities());
            return intent;
        } catch (NlpUnavailableException e) {
            log.warn("NLP unavailable, using keyword fallback: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("NLP analysis failed, using keyword fallback: {}", e.getMessage(), e);
        }
        return fallback(query, userLocation);
    }

    /**
     * Keyword heuristic used when the NLP provider is unavailable. Places come only from the
     * configured place vocabulary.
     */
    QueryIntent fallback(String query, GeoPoint userLocation) {
        List<Token> tokens = QueryVocabulary.tokenize(query);
        Optional<Match> category = vocabulary.findCategory(tokens);
        Optional<Match> source = vocabulary.findSource(tokens);

        List<Located> found = new ArrayList<>();
        category.ifPresent(m -> found.add(new Located(m.text(), EntityRole.TOPIC, m.offset())));
        source.ifPresent(m -> found.add(new Located(m.text(), EntityRole.ORGANIZATION, m.offset())));
        for (Match place : vocabulary.findLocations(tokens)) {
            found.add(new Located(place.text(), EntityRole.LOCATION, place.offset()));
        }

        Map<String, EntityRole> entities = ordered(found);
        QueryIntent intent = build(tokens, entities, category, source, userLocation, FALLBACK_CONFIDENCE,
                ResolutionPath.FALLBACK);
        log.debug("Resolved '{}' via fallback: intent={}, entities={}", query, intent.getIntent(), entities);
        return intent;
    }

    private QueryIntent fromAnalysis(String query, NlpAnalysis analysis, GeoPoint userLocation) {
        List<Token> tokens = QueryVocabulary.tokenize(query);
        Optional<Match> category = vocabulary.findCategory(tokens);
        Optional<Match> source = vocabulary.findSource(tokens);
        String lowerQuery = query.toLowerCase(Locale.ROOT);

        List<Located> found = new ArrayList<>();
        for (NlpAnalysis.Entity entity : analysis.entities()) {
            EntityRole role = vocabulary.isSource(entity.text())
                    ? EntityRole.ORGANIZATION
                    : EntityRole.fromProviderType(entity.type());
            found.add(new Located(entity.text(), role, offsetOf(lowerQuery, entity.text())));
        }
        // the provider tends to miss or merge plain vocabulary words
        category.filter(m -> notCovered(found, m.text()))
                .ifPresent(m -> found.add(new Located(m.text(), EntityRole.TOPIC, m.offset())));
        source.filter(m -> notCovered(found, m.text()))
                .ifPresent(m -> found.add(new Located(m.text(), EntityRole.ORGANIZATION, m.offset())));

        double confidence = Math.max(0.0, Math.min(1.0, analysis.confidence()));
        return build(tokens, ordered(found), category, source, userLocation, confidence, ResolutionPath.NLP);
    }

    private QueryIntent build(List<Token> tokens, Map<String, EntityRole> entities, Optional<Match> category,
                              Optional<Match> source, GeoPoint userLocation, double confidence,
                              ResolutionPath path) {
        Map<IntentType, Double> signals = signals(tokens, entities, category, source, userLocation);
        IntentType primary = signals.entrySet().stream()
                .max(Map.Entry.<IntentType, Double>comparingByValue()
                        .thenComparing(Map.Entry.<IntentType, Double>comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(IntentType.SEARCH);

        return QueryIntent.builder()
                .intent(primary)
                .confidence(confidence)
                .path(path)
                .entities(entities)
                .signals(signals)
                .category(category.map(Match::canonical).orElse(null))
                .source(source.map(Match::canonical).orElse(null))
                .build();
    }

    /**
     * Confidence per intent type. Search is always possible; the others need a keyword or entity.
     */
    private Map<IntentType, Double> signals(List<Token> tokens, Map<String, EntityRole> entities,
                                            Optional<Match> category, Optional<Match> source,
                                            GeoPoint userLocation) {
        Map<IntentType, Double> signals = new EnumMap<>(IntentType.class);
        signals.put(IntentType.SEARCH, SEARCH_SIGNAL);
        category.ifPresent(m -> signals.put(IntentType.CATEGORY, CATEGORY_SIGNAL));
        source.ifPresent(m -> signals.put(IntentType.SOURCE, SOURCE_SIGNAL));

        boolean namesPlace = entities.containsValue(EntityRole.LOCATION);
        if (QueryVocabulary.containsAny(tokens, NEARBY_KEYWORDS)) {
            signals.put(IntentType.NEARBY, userLocation != null || namesPlace ? NEARBY_SIGNAL : UNANCHORED_NEARBY_SIGNAL);
        } else if (namesPlace) {
            signals.put(IntentType.NEARBY, LOCATION_ONLY_SIGNAL);
        }
        if (QueryVocabulary.containsAny(tokens, TRENDING_KEYWORDS)) {
            signals.put(IntentType.TRENDING, TRENDING_SIGNAL);
        }
        if (QueryVocabulary.containsAny(tokens, SCORE_KEYWORDS)) {
            signals.put(IntentType.SCORE, SCORE_SIGNAL);
        }
        return signals;
    }

    private static boolean notCovered(List<Located> found, String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return found.stream().noneMatch(l -> l.text().toLowerCase(Locale.ROOT).contains(lower));
    }

    private static int offsetOf(String lowerQuery, String entity) {
        int at = lowerQuery.indexOf(entity.toLowerCase(Locale.ROOT));
        return at >= 0 ? at : Integer.MAX_VALUE;
    }

    /**
     * Entities in order of appearance; of two overlapping spans the longer one is kept
     */
    private static Map<String, EntityRole> ordered(List<Located> found) {
        Map<String, EntityRole> entities = new LinkedHashMap<>();
        int coveredUntil = -1;
        List<Located> sorted = found.stream()
                .sorted(Comparator.comparingInt(Located::offset)
                        .thenComparing(Comparator.comparingInt((Located l) -> l.text().length()).reversed()))
                .toList();
        for (Located located : sorted) {
            boolean positioned = located.offset() != Integer.MAX_VALUE;
            if (positioned && located.offset() < coveredUntil) {
                continue;
            }
            entities.putIfAbsent(located.text(), located.role());
            if (positioned) {
                coveredUntil = located.offset() + located.text().length();
            }
        }
        return entities;
    }

    private record Located(String text, EntityRole role, int offset) {
    }
}
