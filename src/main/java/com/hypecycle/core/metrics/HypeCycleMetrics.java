package com.hypecycle.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for classification runs.
 */
@Service
public class HypeCycleMetrics {

    private final MeterRegistry registry;

    public HypeCycleMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "fresh", "cache_hit", "insufficient_data" or "failed"
     */
    public void recordClassification(String outcome, long ms) {
        Counter.builder("hypecycle.classifications.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("hypecycle.classification.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("hypecycle.cache.lookups")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordCollector(String source, boolean succeeded, long ms) {
        Timer.builder("hypecycle.collector.duration")
                .tag("source", source)
                .tag("success", String.valueOf(succeeded))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records the number of collectors that produced metrics in one run.
     */
    public void recordCollectorsSucceeded(int count) {
        DistributionSummary.builder("hypecycle.collectors.succeeded")
                .description("Collectors that produced metrics per classification")
                .register(registry)
                .record(count);
    }

    public void recordExpansion(boolean applied) {
        Counter.builder("hypecycle.expansions.total")
                .tag("applied", String.valueOf(applied))
                .register(registry)
                .increment();
    }

    /**
     * @param operation "classify_one", "synthesize" or "expand_query"
     * @param outcome   "ok" or the lowercase error kind
     */
    public void recordLlmCall(String operation, String outcome, long ms) {
        Timer.builder("hypecycle.llm.calls")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
