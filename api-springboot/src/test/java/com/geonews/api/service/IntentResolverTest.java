package com.geonews.api.service;

import com.geonews.api.exception.NlpUnavailableException;
import com.geonews.api.model.EntityRole;
import com.geonews.api.model.GeoPoint;
import com.geonews.api.model.IntentType;
import com.geonews.api.model.NlpAnalysis;
import com.geonews.api.model.QueryIntent;
import com.geonews.api.model.ResolutionPath;
import com.geonews.api.model.RetrievalParams;
import com.geonews.api.model.RetrievalStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntentResolverTest {

    private static final GeoPoint MUMBAI = GeoPoint.of(19.076, 72.877);

    @Mock
    private LanguageAnalyzer languageAnalyzer;

    private IntentResolver resolver;

    @BeforeEach
    void setUp() {
        QueryVocabulary vocabulary = new QueryVocabulary(
                List.of("technology", "business", "sports", "politics"),
                List.of("Reuters", "BBC News", "Times of India"),
                List.of("Mumbai", "Delhi", "New Delhi"),
                Map.of("BBC", "BBC News"));
        resolver = new IntentResolver(languageAnalyzer, vocabulary);
    }

    @Test
    void resolve_fallsBackToKeywordsWhenProviderUnavailable() throws Exception {
        when(languageAnalyzer.analyze(anyString())).thenThrow(new NlpUnavailableException("no credentials"));

        QueryIntent intent = resolver.resolve("Show me technology news from Mumbai", null);

        assertThat(intent.getPath()).isEqualTo(ResolutionPath.FALLBACK);
        assertThat(intent.getConfidence()).isEqualTo(IntentResolver.FALLBACK_CONFIDENCE);
        assertThat(intent.getIntent()).isEqualTo(IntentType.CATEGORY);
        assertThat(intent.getEntityNames()).containsExactly("technology", "Mumbai");
        assertThat(intent.getEntities()).containsEntry("Mumbai", EntityRole.LOCATION);
        assertThat(intent.getCategory()).isEqualTo("technology");
        assertThat(intent.signal(IntentType.NEARBY)).isEqualTo(IntentResolver.LOCATION_ONLY_SIGNAL);
    }

    @Test
    void resolve_fallsBackWhenProviderThrowsUnexpectedly() throws Exception {
        when(languageAnalyzer.analyze(anyString())).thenThrow(new IllegalStateException("bad payload"));

        QueryIntent intent = resolver.resolve("sports", null);

        assertThat(intent.getPath()).isEqualTo(ResolutionPath.FALLBACK);
        assertThat(intent.getIntent()).isEqualTo(IntentType.CATEGORY);
    }

    @Test
    void resolve_usesProviderEntitiesAndConfidence() throws Exception {
        when(languageAnalyzer.analyze(anyString())).thenReturn(
                new NlpAnalysis(List.of(new NlpAnalysis.Entity("Mumbai", "LOCATION")), 0.85));

        QueryIntent intent = resolver.resolve("trending news near Mumbai", MUMBAI);

        assertThat(intent.getPath()).isEqualTo(ResolutionPath.NLP);
        assertThat(intent.getConfidence()).isEqualTo(0.85);
        assertThat(intent.getIntent()).isEqualTo(IntentType.NEARBY);
        assertThat(intent.getEntities()).containsExactly(Map.entry("Mumbai", EntityRole.LOCATION));
        assertThat(intent.signal(IntentType.TRENDING)).isEqualTo(IntentResolver.TRENDING_SIGNAL);
    }

    @Test
    void resolve_addsVocabularyMatchesTheProviderMissed() throws Exception {
        when(languageAnalyzer.analyze(anyString())).thenReturn(
                new NlpAnalysis(List.of(new NlpAnalysis.Entity("Delhi", "LOCATION")), 0.85));

        QueryIntent intent = resolver.resolve("business stories in Delhi", null);

        assertThat(intent.getEntityNames()).containsExactly("business", "Delhi");
        assertThat(intent.getEntities()).containsEntry("business", EntityRole.TOPIC);
        assertThat(intent.getIntent()).isEqualTo(IntentType.CATEGORY);
    }

    @Test
    void resolve_emptyQuerySkipsProvider() {
        QueryIntent intent = resolver.resolve("   ", MUMBAI);

        assertThat(intent.getIntent()).isEqualTo(IntentType.SEARCH);
        assertThat(intent.getEntities()).isEmpty();
        verifyNoInteractions(languageAnalyzer);
    }

    @Test
    void fallback_recognisesSourceButNotAsPlace() {
        QueryIntent intent = resolver.fallback("latest from Reuters", null);

        assertThat(intent.getIntent()).isEqualTo(IntentType.SOURCE);
        assertThat(intent.getSource()).isEqualTo("Reuters");
        assertThat(intent.getEntities()).containsExactly(Map.entry("Reuters", EntityRole.ORGANIZATION));
    }

    @Test
    void fallback_resolvesSourceAliasAfterFrom() {
        QueryIntent intent = resolver.fallback("Latest headlines from BBC", MUMBAI);

        assertThat(intent.getIntent()).isEqualTo(IntentType.SOURCE);
        assertThat(intent.getSource()).isEqualTo("BBC News");
        assertThat(intent.getEntities()).containsExactly(Map.entry("BBC", EntityRole.ORGANIZATION));
        assertThat(new StrategySelector().select(intent, RetrievalParams.builder().location(MUMBAI).build()))
                .isEqualTo(RetrievalStrategy.SOURCE);
    }

    @Test
    void fallback_doesNotTreatPersonAfterFromAsPlace() {
        QueryIntent intent = resolver.fallback("Show me updates from Elon Musk", MUMBAI);

        assertThat(intent.getEntities()).doesNotContainValue(EntityRole.LOCATION);
        assertThat(intent.signal(IntentType.NEARBY)).isZero();
        assertThat(new StrategySelector().select(intent, RetrievalParams.builder().location(MUMBAI).build()))
                .isEqualTo(RetrievalStrategy.SEARCH);
    }

    @Test
    void fallback_doesNotTreatCompanyAfterAtAsPlace() {
        QueryIntent intent = resolver.fallback("Articles about Apple at Google", MUMBAI);

        assertThat(intent.getEntities()).doesNotContainValue(EntityRole.LOCATION);
        assertThat(intent.getIntent()).isEqualTo(IntentType.SEARCH);
    }

    @Test
    void fallback_takesPlacesFromVocabularyOnly() {
        QueryIntent intent = resolver.fallback("floods in Kerala and Mumbai", null);

        assertThat(intent.getEntities()).containsExactly(Map.entry("Mumbai", EntityRole.LOCATION));
        assertThat(intent.getIntent()).isEqualTo(IntentType.NEARBY);
    }

    @Test
    void fallback_prefersLongestPlaceName() {
        QueryIntent intent = resolver.fallback("news from New Delhi", null);

        assertThat(intent.getEntityNames()).containsExactly("New Delhi");
    }

    @Test
    void fallback_nearbyKeywordWithoutAnchorIsWeak() {
        QueryIntent intent = resolver.fallback("what is happening near me", null);

        assertThat(intent.signal(IntentType.NEARBY)).isEqualTo(IntentResolver.UNANCHORED_NEARBY_SIGNAL);
    }
}
