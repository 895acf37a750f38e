package com.geonews.api.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Every scored article for one cluster, highest score first, as computed at one instant.
 */
@Value
public class TrendingSnapshot {

    ClusterKey clusterKey;
    List<TrendingResult> results;
    Instant computedAt;

    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(computedAt, now).compareTo(ttl) < 0;
    }

    public List<TrendingResult> top(int limit) {
        return results.subList(0, Math.min(limit, results.size()));
    }
}
