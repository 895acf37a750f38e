package com.geonews.api.service;

import com.geonews.api.model.GeoPoint;
import com.geonews.api.model.IntentType;
import com.geonews.api.model.QueryIntent;
import com.geonews.api.model.ResolutionPath;
import com.geonews.api.model.RetrievalParams;
import com.geonews.api.model.RetrievalStrategy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StrategySelectorTest {

    private final StrategySelector selector = new StrategySelector();

    private static QueryIntent.QueryIntentBuilder intent() {
        return QueryIntent.builder()
                .intent(IntentType.SEARCH)
                .confidence(0.5)
                .path(ResolutionPath.FALLBACK)
                .signal(IntentType.SEARCH, 0.3);
    }

    private static RetrievalParams.RetrievalParamsBuilder params() {
        return RetrievalParams.builder().limit(5);
    }

    @Test
    void select_explicitPredicatesAlwaysSelectFlexible() {
        QueryIntent resolved = intent().signal(IntentType.CATEGORY, 0.9).category("technology").build();

        assertThat(selector.select(resolved, params().minScore(0.9).build())).isEqualTo(RetrievalStrategy.FLEXIBLE);
        assertThat(selector.select(resolved, params().source("Reuters").build())).isEqualTo(RetrievalStrategy.FLEXIBLE);
    }

    @Test
    void select_strongestSignalWins() {
        QueryIntent resolved = intent()
                .signal(IntentType.CATEGORY, 0.9).category("technology")
                .signal(IntentType.NEARBY, 0.6)
                .build();

        assertThat(selector.select(resolved, params().location(GeoPoint.of(19.0, 72.8)).build()))
                .isEqualTo(RetrievalStrategy.CATEGORY);
    }

    @Test
    void select_nearbyNeedsALocation() {
        QueryIntent resolved = intent().signal(IntentType.NEARBY, 0.8).signal(IntentType.TRENDING, 0.75).build();

        assertThat(selector.select(resolved, params().build())).isEqualTo(RetrievalStrategy.SEARCH);
        assertThat(selector.select(resolved, params().location(GeoPoint.of(19.0, 72.8)).build()))
                .isEqualTo(RetrievalStrategy.NEARBY);
    }

    @Test
    void select_categorySignalWithoutCategoryIsSkipped() {
        QueryIntent resolved = intent().signal(IntentType.CATEGORY, 0.9).signal(IntentType.SCORE, 0.7).build();

        assertThat(selector.select(resolved, params().build())).isEqualTo(RetrievalStrategy.SCORE);
    }

    @Test
    void select_tiesGoToTheIntentDeclaredFirst() {
        QueryIntent resolved = intent()
                .signal(IntentType.SCORE, 0.7)
                .signal(IntentType.CATEGORY, 0.7).category("sports")
                .build();

        assertThat(selector.select(resolved, params().build())).isEqualTo(RetrievalStrategy.CATEGORY);
    }

    @Test
    void select_defaultsToSearchWithoutSignals() {
        QueryIntent resolved = QueryIntent.builder().intent(IntentType.SEARCH).path(ResolutionPath.FALLBACK).build();

        assertThat(selector.select(resolved, params().build())).isEqualTo(RetrievalStrategy.SEARCH);
    }
}
