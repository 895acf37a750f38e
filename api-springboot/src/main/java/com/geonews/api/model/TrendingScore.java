package com.geonews.api.model;

import lombok.Builder;
import lombok.Value;

/**
 * Trending score kept as its five factors so each one's contribution stays visible.
 * Every factor lies in [0, 1].
 */
@Value
@Builder
public class TrendingScore {

    public static final double VOLUME_WEIGHT = 0.25;
    public static final double ENGAGEMENT_WEIGHT = 0.30;
    public static final double RECENCY_WEIGHT = 0.25;
    public static final double GEO_WEIGHT = 0.15;
    public static final double RELEVANCE_WEIGHT = 0.05;

    double volume;
    double engagement;
    double recency;
    double geo;
    double relevance;

    /** Weighted sum in [0, 1] */
    public double getScore() {
        return volume * VOLUME_WEIGHT
                + engagement * ENGAGEMENT_WEIGHT
                + recency * RECENCY_WEIGHT
                + geo * GEO_WEIGHT
                + relevance * RELEVANCE_WEIGHT;
    }

    /** Score scaled to 0-100 for presentation */
    public double getDisplayScore() {
        return getScore() * 100.0;
    }
}
