package com.hypecycle.core.nodes;

import com.hypecycle.core.cache.CacheEntry;
import com.hypecycle.core.cache.CacheStore;
import com.hypecycle.core.engine.HypeCycleProperties;
import com.hypecycle.core.model.ClassificationStatus;
import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.FailureKind;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;
import com.hypecycle.core.state.ClassificationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.Map;

/**
 * Writes the completed classification to the cache store as a new entry.
 * A write failure fails the run.
 */
@Component
public class PersistResultNode {

    private static final Logger log = LoggerFactory.getLogger(PersistResultNode.class);

    private final CacheStore cacheStore;
    private final Clock clock;
    private final Duration ttl;

    public PersistResultNode(CacheStore cacheStore, Clock clock, HypeCycleProperties properties) {
        this.cacheStore = cacheStore;
        this.clock = clock;
        this.ttl = Duration.ofHours(properties.getCacheTtlHours());
    }

    public Map<String, Object> apply(ClassificationState state) {
        // Stored timestamps keep millisecond precision, so a cached read matches the fresh result.
        Instant createdAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Map<SourceName, SourceMetrics> metrics = new EnumMap<>(SourceName.class);
        for (CollectorOutcome outcome : state.outcomes().values()) {
            if (outcome.present()) {
                metrics.put(outcome.source(), outcome.metrics());
            }
        }

        CacheEntry entry = new CacheEntry(
                state.keyword(),
                state.finalOpinion().orElseThrow(() -> new IllegalStateException("No final opinion to persist")),
                state.opinions(),
                metrics,
                state.expansion(),
                state.allErrors(),
                createdAt,
                createdAt.plus(ttl));

        try {
            cacheStore.put(entry);
        } catch (RuntimeException e) {
            String message = "Failed to persist analysis: " + e.getMessage();
            log.error(message, e);
            return Map.of(
                    "status", ClassificationStatus.FAILED.name(),
                    "failureKind", FailureKind.PERSISTENCE_FAILED.name(),
                    "failureMessage", message);
        }
        log.info("Stored analysis for '{}' until {}", entry.keyword(), entry.expiresAt());
        return Map.of(
                "persistedEntry", entry,
                "status", ClassificationStatus.DONE.name());
    }
}
