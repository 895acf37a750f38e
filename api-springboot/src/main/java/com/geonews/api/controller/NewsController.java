package com.geonews.api.controller;

import com.geonews.api.exception.InvalidInputException;
import com.geonews.api.model.Article;
import com.geonews.api.model.GeoPoint;
import com.geonews.api.model.NewsQueryRequest;
import com.geonews.api.model.QueryResponse;
import com.geonews.api.model.RetrievalParams;
import com.geonews.api.model.RetrievalStrategy;
import com.geonews.api.model.SearchResult;
import com.geonews.api.service.NewsRetrievalService;
import com.geonews.api.service.QueryVocabulary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Map;

/**
 * News retrieval API controller
 */
@RestController
@RequestMapping("/api/v1/news")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "News", description = "Intent-driven and direct news retrieval APIs")
public class NewsController {

    private final NewsRetrievalService retrievalService;
    private final QueryVocabulary vocabulary;

    @Value("${geonews.retrieval.default-limit}")
    private int defaultLimit;

    @Value("${geonews.retrieval.max-limit}")
    private int maxLimit;

    @Value("${geonews.retrieval.nearby-radius-km}")
    private double defaultRadiusKm;

    /**
     * Natural-language query
     */
    @PostMapping("/query")
    @Operation(summary = "Query news", description = "Resolve entities and intent from free text and retrieve with the matching strategy")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody NewsQueryRequest request) throws IOException {
        RetrievalParams explicit = RetrievalParams.builder()
                .category(request.category())
                .source(request.source())
                .minScore(request.minScore())
                .maxScore(request.maxScore())
                .location(location(request.userLatitude(), request.userLongitude()))
                .radiusKm(request.radius())
                .limit(limit(request.limit()))
                .build();
        checkScoreRange(explicit.getMinScore(), explicit.getMaxScore());

        log.info("Query: '{}', location={}, limit={}", request.query(), explicit.getLocation(), explicit.getLimit());
        return ResponseEntity.ok(retrievalService.query(request.query(), explicit));
    }

    @GetMapping("/category")
    @Operation(summary = "By category", description = "Articles in a category, most relevant first")
    public ResponseEntity<SearchResult<Article>> byCategory(
            @Parameter(description = "Category name") @RequestParam @NotBlank String category,
            @Parameter(description = "Maximum results") @RequestParam(required = false) @Min(1) Integer limit)
            throws IOException {
        RetrievalParams params = RetrievalParams.builder().category(category).limit(limit(limit)).build();
        return ResponseEntity.ok(retrievalService.search(RetrievalStrategy.CATEGORY, params));
    }

    @GetMapping("/source")
    @Operation(summary = "By source", description = "Articles from a publisher, case-insensitive")
    public ResponseEntity<SearchResult<Article>> bySource(
            @Parameter(description = "Source name") @RequestParam @NotBlank String source,
            @Parameter(description = "Maximum results") @RequestParam(required = false) @Min(1) Integer limit)
            throws IOException {
        RetrievalParams params = RetrievalParams.builder().source(source).limit(limit(limit)).build();
        return ResponseEntity.ok(retrievalService.search(RetrievalStrategy.SOURCE, params));
    }

    @GetMapping("/search")
    @Operation(summary = "Text search", description = "Articles whose title or description contains any query term")
    public ResponseEntity<SearchResult<Article>> search(
            @Parameter(description = "Search query") @RequestParam @NotBlank String query,
            @Parameter(description = "Maximum results") @RequestParam(required = false) @Min(1) Integer limit)
            throws IOException {
        log.info("Text search: query='{}'", query);
        RetrievalParams params = RetrievalParams.builder().text(query).limit(limit(limit)).build();
        return ResponseEntity.ok(retrievalService.search(RetrievalStrategy.SEARCH, params));
    }

    @GetMapping("/score")
    @Operation(summary = "By relevance score", description = "Articles at or above a relevance threshold")
    public ResponseEntity<SearchResult<Article>> byScore(
            @Parameter(description = "Minimum relevance score")
            @RequestParam(name = "min_score", defaultValue = "${geonews.retrieval.score-threshold}")
            @DecimalMin("0.0") @DecimalMax("1.0") double minScore,
            @Parameter(description = "Maximum results") @RequestParam(required = false) @Min(1) Integer limit)
            throws IOException {
        RetrievalParams params = RetrievalParams.builder().minScore(minScore).limit(limit(limit)).build();
        return ResponseEntity.ok(retrievalService.search(RetrievalStrategy.SCORE, params));
    }

    @GetMapping("/nearby")
    @Operation(summary = "Nearby", description = "Articles within a radius of a coordinate, closest first")
    public ResponseEntity<SearchResult<Article>> nearby(
            @Parameter(description = "Latitude") @RequestParam @DecimalMin("-90.0") @DecimalMax("90.0") double lat,
            @Parameter(description = "Longitude") @RequestParam @DecimalMin("-180.0") @DecimalMax("180.0") double lon,
            @Parameter(description = "Radius in km") @RequestParam(required = false) @Positive Double radius,
            @Parameter(description = "Maximum results") @RequestParam(required = false) @Min(1) Integer limit)
            throws IOException {
        RetrievalParams params = RetrievalParams.builder()
                .location(GeoPoint.of(lat, lon))
                .radiusKm(radius != null ? radius : defaultRadiusKm)
                .limit(limit(limit))
                .build();
        return ResponseEntity.ok(retrievalService.search(RetrievalStrategy.NEARBY, params));
    }

    @GetMapping("/filter")
    @Operation(summary = "Combined filter", description = "Articles matching every supplied predicate, most relevant first")
    public ResponseEntity<SearchResult<Article>> filter(
            @Parameter(description = "Text terms") @RequestParam(required = false) String query,
            @Parameter(description = "Category") @RequestParam(required = false) String category,
            @Parameter(description = "Source") @RequestParam(required = false) String source,
            @Parameter(description = "Minimum relevance score")
            @RequestParam(name = "min_score", required = false) @DecimalMin("0.0") @DecimalMax("1.0") Double minScore,
            @Parameter(description = "Maximum relevance score")
            @RequestParam(name = "max_score", required = false) @DecimalMin("0.0") @DecimalMax("1.0") Double maxScore,
            @Parameter(description = "Latitude") @RequestParam(required = false) @DecimalMin("-90.0") @DecimalMax("90.0") Double lat,
            @Parameter(description = "Longitude") @RequestParam(required = false) @DecimalMin("-180.0") @DecimalMax("180.0") Double lon,
            @Parameter(description = "Radius in km") @RequestParam(required = false) @Positive Double radius,
            @Parameter(description = "Maximum results") @RequestParam(required = false) @Min(1) Integer limit)
            throws IOException {
        GeoPoint location = location(lat, lon);
        if (radius != null && location == null) {
            throw new InvalidInputException("radius needs lat and lon");
        }
        checkScoreRange(minScore, maxScore);

        RetrievalParams params = RetrievalParams.builder()
                .text(query)
                .category(category)
                .source(source)
                .minScore(minScore)
                .maxScore(maxScore)
                .location(location)
                .radiusKm(radius)
                .limit(limit(limit))
                .build();
        return ResponseEntity.ok(retrievalService.search(RetrievalStrategy.FLEXIBLE, params));
    }

    @GetMapping("/articles/{id}")
    @Operation(summary = "Get article", description = "Get article by ID")
    public ResponseEntity<Article> getArticle(
            @Parameter(description = "Article ID") @PathVariable String id) throws IOException {
        return retrievalService.getArticle(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Categories and sources the intent resolver recognises
     */
    @GetMapping("/filters")
    @Operation(summary = "Get filters", description = "Get available filter options")
    public ResponseEntity<Map<String, Object>> getFilters() {
        return ResponseEntity.ok(Map.of(
                "categories", vocabulary.getCategories(),
                "sources", vocabulary.getSources()));
    }

    private int limit(Integer requested) {
        return requested != null ? Math.min(requested, maxLimit) : defaultLimit;
    }

    private static GeoPoint location(Double latitude, Double longitude) {
        if ((latitude == null) != (longitude == null)) {
            throw new InvalidInputException("Latitude and longitude must be given together");
        }
        return GeoPoint.ofNullable(latitude, longitude);
    }

    private static void checkScoreRange(Double minScore, Double maxScore) {
        if (minScore != null && maxScore != null && minScore > maxScore) {
            throw new InvalidInputException("min_score must not exceed max_score");
        }
    }
}
