package com.hypecycle.core.cache;

import com.hypecycle.core.model.ExpansionState;
import com.hypecycle.core.model.PhaseOpinion;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One persisted classification. Entries are written once and never updated; a new
 * analysis of the same keyword appends a new entry.
 * <p>
 * {@code sourceMetrics} holds only the sources that produced metrics.
 */
public record CacheEntry(
        String keyword,
        PhaseOpinion finalOpinion,
        Map<SourceName, PhaseOpinion> perSourceOpinions,
        Map<SourceName, SourceMetrics> sourceMetrics,
        ExpansionState expansion,
        List<String> errors,
        Instant createdAt,
        Instant expiresAt
) implements Serializable {

    public CacheEntry {
        if (keyword == null || finalOpinion == null || createdAt == null || expiresAt == null) {
            throw new IllegalArgumentException("keyword, finalOpinion, createdAt and expiresAt are required");
        }
        perSourceOpinions = copy(perSourceOpinions);
        sourceMetrics = copy(sourceMetrics);
        expansion = expansion == null ? ExpansionState.none() : expansion;
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /** Expired entries are never served; an entry is stale from its expiry instant on. */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    private static <V> Map<SourceName, V> copy(Map<SourceName, V> source) {
        EnumMap<SourceName, V> copy = new EnumMap<>(SourceName.class);
        if (source != null) {
            copy.putAll(source);
        }
        return Collections.unmodifiableMap(copy);
    }
}
