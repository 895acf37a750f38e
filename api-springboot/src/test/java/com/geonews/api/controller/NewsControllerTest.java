package com.geonews.api.controller;

import com.geonews.api.model.Article;
import com.geonews.api.model.GeoPoint;
import com.geonews.api.model.IntentType;
import com.geonews.api.model.QueryResponse;
import com.geonews.api.model.ResolutionPath;
import com.geonews.api.model.RetrievalParams;
import com.geonews.api.model.RetrievalStrategy;
import com.geonews.api.model.SearchResult;
import com.geonews.api.service.NewsRetrievalService;
import com.geonews.api.service.QueryVocabulary;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.geonews.api.TestArticles.article;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = NewsController.class)
class NewsControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private NewsRetrievalService retrievalService;

    @MockBean
    private QueryVocabulary vocabulary;

    @Test
    void query_returnsResolvedIntentAndArticles() throws Exception {
        Article article = article("news-001", 0.9);
        when(retrievalService.query(eq("Show me technology news from Mumbai"), any())).thenReturn(QueryResponse.builder()
                .entities(List.of("technology", "Mumbai"))
                .intent(IntentType.CATEGORY)
                .confidence(0.5)
                .resolution(ResolutionPath.FALLBACK)
                .strategy(RetrievalStrategy.CATEGORY)
                .articles(List.of(article))
                .totalResults(1)
                .queryUsed("Show me technology news from Mumbai")
                .build());

        mvc.perform(post("/api/v1/news/query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"Show me technology news from Mumbai\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intent").value("category"))
                .andExpect(jsonPath("$.resolution").value("fallback"))
                .andExpect(jsonPath("$.entities[1]").value("Mumbai"))
                .andExpect(jsonPath("$.articles[0].id").value("news-001"));

        ArgumentCaptor<RetrievalParams> params = ArgumentCaptor.forClass(RetrievalParams.class);
        verify(retrievalService).query(eq("Show me technology news from Mumbai"), params.capture());
        assertThat(params.getValue().getLimit()).isEqualTo(5);
        assertThat(params.getValue().getLocation()).isNull();
        assertThat(params.getValue().hasStructuredPredicates()).isFalse();
    }

    @Test
    void query_passesUserLocationAndPredicates() throws Exception {
        when(retrievalService.query(any(), any())).thenReturn(QueryResponse.builder().articles(List.of()).build());

        mvc.perform(post("/api/v1/news/query").contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"query": "news", "userLatitude": 19.076, "userLongitude": 72.877,
                                 "radius": 25, "limit": 3, "minScore": 0.9}
                                """))
                .andExpect(status().isOk());

        ArgumentCaptor<RetrievalParams> params = ArgumentCaptor.forClass(RetrievalParams.class);
        verify(retrievalService).query(eq("news"), params.capture());
        assertThat(params.getValue().getLocation()).isEqualTo(GeoPoint.of(19.076, 72.877));
        assertThat(params.getValue().getRadiusKm()).isEqualTo(25.0);
        assertThat(params.getValue().getLimit()).isEqualTo(3);
        assertThat(params.getValue().getMinScore()).isEqualTo(0.9);
    }

    @Test
    void query_rejectsBlankQuery() throws Exception {
        mvc.perform(post("/api/v1/news/query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_input"));

        verifyNoInteractions(retrievalService);
    }

    @Test
    void query_rejectsHalfACoordinate() throws Exception {
        mvc.perform(post("/api/v1/news/query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"news\", \"userLatitude\": 19.0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void nearby_usesGivenRadius() throws Exception {
        when(retrievalService.search(eq(RetrievalStrategy.NEARBY), any())).thenReturn(emptyResult());

        mvc.perform(get("/api/v1/news/nearby").param("lat", "19.076").param("lon", "72.877").param("radius", "50"))
                .andExpect(status().isOk());

        ArgumentCaptor<RetrievalParams> params = ArgumentCaptor.forClass(RetrievalParams.class);
        verify(retrievalService).search(eq(RetrievalStrategy.NEARBY), params.capture());
        assertThat(params.getValue().getRadiusKm()).isEqualTo(50.0);
        assertThat(params.getValue().getLocation()).isEqualTo(GeoPoint.of(19.076, 72.877));
    }

    @Test
    void nearby_rejectsOutOfRangeLatitude() throws Exception {
        mvc.perform(get("/api/v1/news/nearby").param("lat", "95").param("lon", "72.877"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(retrievalService);
    }

    @Test
    void category_clampsLimit() throws Exception {
        when(retrievalService.search(eq(RetrievalStrategy.CATEGORY), any())).thenReturn(emptyResult());

        mvc.perform(get("/api/v1/news/category").param("category", "technology").param("limit", "500"))
                .andExpect(status().isOk());

        ArgumentCaptor<RetrievalParams> params = ArgumentCaptor.forClass(RetrievalParams.class);
        verify(retrievalService).search(eq(RetrievalStrategy.CATEGORY), params.capture());
        assertThat(params.getValue().getLimit()).isEqualTo(50);
        assertThat(params.getValue().getCategory()).isEqualTo("technology");
    }

    @Test
    void filter_rejectsRadiusWithoutLocation() throws Exception {
        mvc.perform(get("/api/v1/news/filter").param("radius", "5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("radius needs lat and lon"));
    }

    @Test
    void filter_rejectsInvertedScoreRange() throws Exception {
        mvc.perform(get("/api/v1/news/filter").param("min_score", "0.9").param("max_score", "0.5"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void filter_combinesPredicates() throws Exception {
        when(retrievalService.search(eq(RetrievalStrategy.FLEXIBLE), any())).thenReturn(emptyResult());

        mvc.perform(get("/api/v1/news/filter")
                        .param("category", "sports").param("min_score", "0.9").param("max_score", "1.0"))
                .andExpect(status().isOk());

        ArgumentCaptor<RetrievalParams> params = ArgumentCaptor.forClass(RetrievalParams.class);
        verify(retrievalService).search(eq(RetrievalStrategy.FLEXIBLE), params.capture());
        assertThat(params.getValue().getCategory()).isEqualTo("sports");
        assertThat(params.getValue().getMaxScore()).isEqualTo(1.0);
    }

    @Test
    void article_missingIsNotFound() throws Exception {
        when(retrievalService.getArticle("missing")).thenReturn(Optional.empty());

        mvc.perform(get("/api/v1/news/articles/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void search_storeFailureIsServiceUnavailable() throws Exception {
        when(retrievalService.search(eq(RetrievalStrategy.SEARCH), any())).thenThrow(new IOException("connection refused"));

        mvc.perform(get("/api/v1/news/search").param("query", "metro"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("store_unavailable"));
    }

    @Test
    void filters_listsVocabulary() throws Exception {
        when(vocabulary.getCategories()).thenReturn(List.of("technology"));
        when(vocabulary.getSources()).thenReturn(List.of("Reuters"));

        mvc.perform(get("/api/v1/news/filters"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories[0]").value("technology"))
                .andExpect(jsonPath("$.sources[0]").value("Reuters"));
    }

    private static SearchResult<Article> emptyResult() {
        return SearchResult.<Article>builder().items(List.of()).filtersApplied(Map.of()).build();
    }
}
