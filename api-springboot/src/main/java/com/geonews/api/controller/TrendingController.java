package com.geonews.api.controller;

import com.geonews.api.model.GeoPoint;
import com.geonews.api.model.TrendingResponse;
import com.geonews.api.model.TrendingResult;
import com.geonews.api.model.TrendingSnapshot;
import com.geonews.api.service.TrendingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Trending API controller
 */
@RestController
@RequestMapping("/api/v1/news/trending")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Trending", description = "Location-aware trending news APIs")
public class TrendingController {

    static final String CALCULATION_METHOD = "interaction volume, engagement, recency, geo and relevance";

    private final TrendingService trendingService;

    @Value("${geonews.retrieval.default-limit}")
    private int defaultLimit;

    @Value("${geonews.retrieval.max-limit}")
    private int maxLimit;

    /**
     * Get trending articles near a coordinate
     */
    @GetMapping
    @Operation(summary = "Get trending", description = "Trending articles for the ~100 km cell containing the coordinate")
    public ResponseEntity<TrendingResponse> getTrending(
            @Parameter(description = "Latitude") @RequestParam @DecimalMin("-90.0") @DecimalMax("90.0") double lat,
            @Parameter(description = "Longitude") @RequestParam @DecimalMin("-180.0") @DecimalMax("180.0") double lon,
            @Parameter(description = "Maximum results") @RequestParam(required = false) @Min(1) Integer limit,
            @Parameter(description = "Recompute even if cached")
            @RequestParam(name = "force_refresh", defaultValue = "false") boolean forceRefresh) {
        int resultLimit = limit != null ? Math.min(limit, maxLimit) : defaultLimit;
        log.info("Trending: lat={}, lon={}, limit={}, forceRefresh={}", lat, lon, resultLimit, forceRefresh);

        TrendingSnapshot snapshot = trendingService.getTrending(GeoPoint.of(lat, lon), resultLimit, forceRefresh);
        List<TrendingResult> results = snapshot.getResults();
        return ResponseEntity.ok(TrendingResponse.builder()
                .articles(results.stream().map(TrendingResult::getArticle).toList())
                .trendingScores(results.stream().map(r -> r.getScore().getDisplayScore()).toList())
                .factors(results.stream().map(TrendingResult::getScore).toList())
                .locationCluster(snapshot.getClusterKey().toString())
                .totalResults(results.size())
                .computedAt(snapshot.getComputedAt())
                .calculationMethod(CALCULATION_METHOD)
                .build());
    }
}
