package com.hypecycle.core.collector;

import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.SourceName;

import java.util.List;

/**
 * Gathers signals for a keyword from one external source.
 * <p>
 * Implementations report ordinary failures (rate limits, timeouts, empty results) through
 * the returned {@link CollectorOutcome}: present metrics with a populated error list when
 * at least one upstream request produced data, a failed outcome when none did. Exceptions
 * escaping {@link #fetch} are treated as failures by {@link CollectorFanOut}.
 */
public interface Collector {

    SourceName source();

    /**
     * @param keyword        normalized keyword
     * @param expansionTerms related search terms to OR into the query; empty for none
     */
    CollectorOutcome fetch(String keyword, List<String> expansionTerms);
}
