package com.hypecycle.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The externally visible outcome of one classification, fresh or served from cache.
 * <p>
 * {@code collectorData} always carries all five source keys; sources that produced
 * no metrics map to {@code null}.
 */
public record ClassificationResult(
        @JsonProperty("keyword") String keyword,
        @JsonProperty("phase") Phase phase,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("reasoning") String reasoning,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("cache_hit") boolean cacheHit,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("per_source_analyses") Map<String, PhaseOpinion> perSourceAnalyses,
        @JsonProperty("collector_data") Map<String, SourceMetrics> collectorData,
        @JsonProperty("collectors_succeeded") int collectorsSucceeded,
        @JsonProperty("partial_data") boolean partialData,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("query_expansion_applied") boolean queryExpansionApplied,
        @JsonProperty("expanded_terms") List<String> expandedTerms
) implements Serializable {

    @JsonIgnore
    public PhaseOpinion finalOpinion() {
        return new PhaseOpinion(phase, confidence, reasoning);
    }

    @JsonIgnore
    public ExpansionState expansion() {
        return new ExpansionState(queryExpansionApplied, expandedTerms);
    }
}
