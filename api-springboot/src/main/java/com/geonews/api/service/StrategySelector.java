package com.geonews.api.service;

import com.geonews.api.model.IntentType;
import com.geonews.api.model.QueryIntent;
import com.geonews.api.model.RetrievalParams;
import com.geonews.api.model.RetrievalStrategy;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Map;

/**
 * Picks the retrieval strategy for a resolved query. Stateless.
 */
@Component
public class StrategySelector {

    /**
     * Explicit structured predicates always select {@link RetrievalStrategy#FLEXIBLE}. Otherwise the
     * strongest intent signal that the query can actually satisfy wins; ties go to the intent
     * declared first. {@link RetrievalStrategy#SEARCH} is the floor.
     *
     * @param intent   resolved query
     * @param explicit predicates and location supplied by the caller
     */
    public RetrievalStrategy select(QueryIntent intent, RetrievalParams explicit) {
        if (explicit.hasStructuredPredicates()) {
            return RetrievalStrategy.FLEXIBLE;
        }
        return intent.getSignals().entrySet().stream()
                .filter(e -> isSatisfiable(e.getKey(), intent, explicit))
                .max(Map.Entry.<IntentType, Double>comparingByValue()
                        .thenComparing(Map.Entry.<IntentType, Double>comparingByKey(Comparator.reverseOrder())))
                .map(e -> RetrievalStrategy.forIntent(e.getKey()))
                .orElse(RetrievalStrategy.SEARCH);
    }

    private boolean isSatisfiable(IntentType type, QueryIntent intent, RetrievalParams explicit) {
        return switch (type) {
            case CATEGORY -> intent.getCategory() != null;
            case SOURCE -> intent.getSource() != null;
            case NEARBY, TRENDING -> explicit.getLocation() != null;
            case SEARCH, SCORE -> true;
            case FLEXIBLE -> explicit.hasStructuredPredicates();
        };
    }
}
