package com.geonews.api.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Trending articles for a location cluster
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendingResponse {

    private List<Article> articles;
    private List<Double> trendingScores;
    private List<TrendingScore> factors;
    private String locationCluster;
    private int totalResults;
    private Instant computedAt;
    private String calculationMethod;
}
