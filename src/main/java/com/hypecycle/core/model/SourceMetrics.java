package com.hypecycle.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Signals gathered by one collector for one keyword.
 * <p>
 * {@code recentVolume} and {@code totalVolume} are the two counts every source reports,
 * each over a source-specific window:
 * <ul>
 *   <li>social: stories in the last 30 days / over the last year</li>
 *   <li>papers: publications in the last 2 years / in the last 5 years</li>
 *   <li>patents: filings in the last 2 years / in the last 12 years</li>
 *   <li>news: articles in the last 30 days / over the last year</li>
 *   <li>finance: companies found / companies found</li>
 * </ul>
 * Everything else a collector derives lives in {@code extra}. {@code errors} holds
 * non-fatal problems hit while collecting (for example one rate-limited request out of three).
 */
public record SourceMetrics(
        @JsonProperty("source") SourceName source,
        @JsonProperty("keyword") String keyword,
        @JsonProperty("collected_at") Instant collectedAt,
        @JsonProperty("recent_volume") long recentVolume,
        @JsonProperty("total_volume") long totalVolume,
        @JsonProperty("extra") Map<String, Object> extra,
        @JsonProperty("errors") List<String> errors
) implements Serializable {

    public SourceMetrics {
        if (source == null) {
            throw new IllegalArgumentException("source is required");
        }
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    @JsonIgnore
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** Numeric extra field, or {@code fallback} when absent or non-numeric. */
    public double number(String field, double fallback) {
        Object value = extra.get(field);
        return value instanceof Number n ? n.doubleValue() : fallback;
    }

    /** Text extra field, or {@code fallback} when absent. */
    public String text(String field, String fallback) {
        Object value = extra.get(field);
        return value != null ? value.toString() : fallback;
    }
}
