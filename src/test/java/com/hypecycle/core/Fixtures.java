package com.hypecycle.core;

import com.hypecycle.core.cache.CacheEntry;
import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.ExpansionState;
import com.hypecycle.core.model.Phase;
import com.hypecycle.core.model.PhaseOpinion;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data for classification tests.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private Fixtures() {}

    public static SourceMetrics metrics(SourceName source, String keyword, long recent, long total) {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("score", 0.5);
        extra.put("label", source.key() + "-signal");
        return new SourceMetrics(source, keyword, NOW, recent, total, extra, List.of());
    }

    public static SourceMetrics metrics(SourceName source, String keyword) {
        return metrics(source, keyword, 500, 2000);
    }

    public static CollectorOutcome ok(SourceName source, String keyword) {
        return CollectorOutcome.ok(metrics(source, keyword));
    }

    public static PhaseOpinion opinion(Phase phase, double confidence) {
        return new PhaseOpinion(phase, confidence, phase.wireName() + " signals");
    }

    /** A live entry with metrics and opinions for the given sources. */
    public static CacheEntry entry(String keyword, Instant createdAt, Duration ttl, SourceName... sources) {
        Map<SourceName, SourceMetrics> metrics = new EnumMap<>(SourceName.class);
        Map<SourceName, PhaseOpinion> opinions = new EnumMap<>(SourceName.class);
        for (SourceName source : sources) {
            metrics.put(source, metrics(source, keyword));
            opinions.put(source, opinion(Phase.PEAK, 0.8));
        }
        return new CacheEntry(keyword, opinion(Phase.PEAK, 0.78), opinions, metrics,
                ExpansionState.none(), List.of(), createdAt, createdAt.plus(ttl));
    }

    public static CacheEntry entry(String keyword, Instant createdAt) {
        return entry(keyword, createdAt, Duration.ofHours(24), SourceName.values());
    }
}
