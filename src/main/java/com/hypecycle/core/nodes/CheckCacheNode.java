package com.hypecycle.core.nodes;

import com.hypecycle.core.cache.CacheEntry;
import com.hypecycle.core.cache.CacheStore;
import com.hypecycle.core.metrics.HypeCycleMetrics;
import com.hypecycle.core.model.ClassificationStatus;
import com.hypecycle.core.state.ClassificationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up a live cached classification for the keyword.
 * <p>
 * A hit ends the run with {@link ClassificationStatus#CACHE_HIT}. A storage error is
 * logged and treated as a miss.
 */
@Component
public class CheckCacheNode {

    private static final Logger log = LoggerFactory.getLogger(CheckCacheNode.class);

    private final CacheStore cacheStore;
    private final HypeCycleMetrics metrics;
    private final Clock clock;

    public CheckCacheNode(CacheStore cacheStore, HypeCycleMetrics metrics, Clock clock) {
        this.cacheStore = cacheStore;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Map<String, Object> apply(ClassificationState state) {
        String keyword = state.keyword();
        Optional<CacheEntry> cached;
        try {
            cached = cacheStore.get(keyword, clock.instant());
        } catch (RuntimeException e) {
            log.warn("Cache lookup failed for '{}', continuing without cache: {}", keyword, e.getMessage());
            cached = Optional.empty();
        }

        metrics.recordCacheLookup(cached.isPresent());
        if (cached.isPresent()) {
            log.info("Cache hit for '{}' (created {}, expires {})",
                    keyword, cached.get().createdAt(), cached.get().expiresAt());
            return Map.of(
                    "cachedEntry", cached.get(),
                    "status", ClassificationStatus.CACHE_HIT.name());
        }
        log.debug("Cache miss for '{}'", keyword);
        return Map.of("status", ClassificationStatus.COLLECTING.name());
    }
}
