package com.geonews.api.model;

import lombok.Value;

import java.time.Instant;

/**
 * Article with its trending score for one grid cell.
 */
@Value
public class TrendingResult {

    Article article;
    TrendingScore score;
    ClusterKey clusterKey;
    Instant computedAt;
}
