package com.hypecycle.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The five signal sources, in canonical order.
 */
public enum SourceName {

    SOCIAL("social", "Social Media (Hacker News)", true),
    PAPERS("papers", "Academic Research (Semantic Scholar)", true),
    PATENTS("patents", "Patents (PatentsView)", true),
    NEWS("news", "News Coverage (GDELT)", true),
    FINANCE("finance", "Financial Markets (Yahoo Finance)", false);

    private final String key;
    private final String label;
    private final boolean expansionEligible;

    SourceName(String key, String label, boolean expansionEligible) {
        this.key = key;
        this.label = label;
        this.expansionEligible = expansionEligible;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /** Human-readable label used in prompts and console output. */
    public String label() {
        return label;
    }

    /**
     * Whether the collector for this source is re-invoked with expanded query terms.
     * Finance resolves tickers from the keyword itself and is never re-fetched.
     */
    public boolean expansionEligible() {
        return expansionEligible;
    }

    public static SourceName fromKey(String key) {
        for (SourceName source : values()) {
            if (source.key.equalsIgnoreCase(key)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown source: " + key);
    }
}
