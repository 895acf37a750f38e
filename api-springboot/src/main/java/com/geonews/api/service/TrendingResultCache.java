package com.geonews.api.service;

import com.geonews.api.config.GeoNewsProperties;
import com.geonews.api.exception.RetrievalFailedException;
import com.geonews.api.model.ClusterKey;
import com.geonews.api.model.TrendingSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Trending snapshots per grid cell with a fixed time-to-live.
 *
 * <p>Each cluster key owns a slot, and the slot's monitor guards only the hand-off of the
 * in-flight recomputation, never the computation itself. At most one recomputation per key
 * runs at a time: the caller that starts it waits for it, later callers join it, or get the
 * previous snapshot at once if there is one. Recomputations run on the trending executor, so
 * a caller that goes away does not stop the cache from being filled.
 */
@Component
@Slf4j
public class TrendingResultCache {

    private final ConcurrentMap<ClusterKey, Slot> slots = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Executor executor;
    private final Duration ttl;

    @Autowired
    public TrendingResultCache(Clock clock, @Qualifier("trendingExecutor") Executor executor,
                               GeoNewsProperties properties) {
        this(clock, executor, properties.getTrending().getTtl());
    }

    public TrendingResultCache(Clock clock, Executor executor, Duration ttl) {
        this.clock = clock;
        this.executor = executor;
        this.ttl = ttl;
    }

    /**
     * Returns the snapshot for a cluster, recomputing it with {@code loader} when missing,
     * older than the TTL, or when {@code forceRefresh} is set.
     *
     * @throws RetrievalFailedException if recomputation fails and no earlier snapshot exists
     */
    public TrendingSnapshot get(ClusterKey key, boolean forceRefresh, Function<ClusterKey, TrendingSnapshot> loader) {
        while (true) {
            Slot slot = slots.computeIfAbsent(key, k -> new Slot());
            TrendingSnapshot current = slot.snapshot;
            if (!forceRefresh && current != null && current.isFresh(clock.instant(), ttl)) {
                log.debug("Returning cached trending results for cluster {}", key);
                return current;
            }

            Refresh refresh = refresh(slot, key, loader);
            if (refresh == null) {
                // slot was swept between lookup and refresh
                continue;
            }
            if (!refresh.owner() && !forceRefresh && current != null) {
                log.debug("Serving previous trending results for cluster {} while another request refreshes", key);
                return current;
            }
            return await(slot, key, refresh.future());
        }
    }

    /**
     * Drops slots whose snapshot has outlived the TTL and that have nothing in flight
     */
    @Scheduled(fixedDelayString = "${geonews.trending.sweep-interval:PT1M}")
    public void sweep() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<ClusterKey, Slot> entry : slots.entrySet()) {
            Slot slot = entry.getValue();
            synchronized (slot) {
                boolean stale = slot.snapshot == null || !slot.snapshot.isFresh(now, ttl);
                if (slot.inFlight == null && stale) {
                    slot.retired = true;
                    slots.remove(entry.getKey(), slot);
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired trending clusters, {} remain", removed, slots.size());
        }
    }

    public int size() {
        return slots.size();
    }

    private Refresh refresh(Slot slot, ClusterKey key, Function<ClusterKey, TrendingSnapshot> loader) {
        CompletableFuture<TrendingSnapshot> future;
        synchronized (slot) {
            if (slot.retired) {
                return null;
            }
            if (slot.inFlight != null) {
                return new Refresh(slot.inFlight, false);
            }
            future = new CompletableFuture<>();
            slot.inFlight = future;
        }

        try {
            executor.execute(() -> recompute(slot, key, loader, future));
        } catch (RuntimeException e) {
            log.error("Could not schedule trending recompute for cluster {}: {}", key, e.getMessage(), e);
            finish(slot, future, null, e);
        }
        return new Refresh(future, true);
    }

    private void recompute(Slot slot, ClusterKey key, Function<ClusterKey, TrendingSnapshot> loader,
                           CompletableFuture<TrendingSnapshot> future) {
        try {
            TrendingSnapshot snapshot = loader.apply(key);
            finish(slot, future, snapshot, null);
        } catch (RuntimeException e) {
            log.error("Trending recompute for cluster {} failed: {}", key, e.getMessage(), e);
            finish(slot, future, null, e);
        } catch (Error e) {
            finish(slot, future, null, e);
            throw e;
        }
    }

    private void finish(Slot slot, CompletableFuture<TrendingSnapshot> future, TrendingSnapshot snapshot,
                        Throwable error) {
        synchronized (slot) {
            if (snapshot != null) {
                slot.snapshot = snapshot;
            }
            slot.inFlight = null;
        }
        if (error == null) {
            future.complete(snapshot);
        } else {
            future.completeExceptionally(error);
        }
    }

    private TrendingSnapshot await(Slot slot, ClusterKey key, CompletableFuture<TrendingSnapshot> future) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            TrendingSnapshot previous = slot.snapshot;
            if (previous != null) {
                log.warn("Serving trending results for cluster {} computed at {} after a failed refresh",
                        key, previous.getComputedAt());
                return previous;
            }
            throw new RetrievalFailedException("Trending results unavailable for cluster " + key, cause);
        }
    }

    private static final class Slot {
        volatile TrendingSnapshot snapshot;
        CompletableFuture<TrendingSnapshot> inFlight;
        boolean retired;
    }

    private record Refresh(CompletableFuture<TrendingSnapshot> future, boolean owner) {
    }
}
