package com.hypecycle.core.engine;

import com.hypecycle.core.cache.CacheEntry;
import com.hypecycle.core.model.ClassificationResult;
import com.hypecycle.core.model.PhaseOpinion;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the externally visible {@link ClassificationResult} from a cache entry.
 * <p>
 * Fresh and cached results both pass through here, so the two paths differ only in
 * the {@code cache_hit} flag.
 */
public final class ResultAssembler {

    private ResultAssembler() {}

    public static ClassificationResult assemble(CacheEntry entry, boolean cacheHit) {
        Map<String, PhaseOpinion> opinions = new LinkedHashMap<>();
        Map<String, SourceMetrics> collectorData = new LinkedHashMap<>();
        for (SourceName source : SourceName.values()) {
            PhaseOpinion opinion = entry.perSourceOpinions().get(source);
            if (opinion != null) {
                opinions.put(source.key(), opinion);
            }
            collectorData.put(source.key(), entry.sourceMetrics().get(source));
        }

        int succeeded = entry.sourceMetrics().size();
        return new ClassificationResult(
                entry.keyword(),
                entry.finalOpinion().phase(),
                entry.finalOpinion().confidence(),
                entry.finalOpinion().reasoning(),
                entry.createdAt(),
                cacheHit,
                entry.expiresAt(),
                Collections.unmodifiableMap(opinions),
                Collections.unmodifiableMap(collectorData),
                succeeded,
                succeeded < SourceName.values().length,
                entry.errors(),
                entry.expansion().applied(),
                entry.expansion().terms());
    }
}
