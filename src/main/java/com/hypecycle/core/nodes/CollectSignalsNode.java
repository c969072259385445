package com.hypecycle.core.nodes;

import com.hypecycle.core.collector.Collector;
import com.hypecycle.core.collector.CollectorFanOut;
import com.hypecycle.core.metrics.HypeCycleMetrics;
import com.hypecycle.core.model.ClassificationStatus;
import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.SourceName;
import com.hypecycle.core.state.ClassificationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every collector once with the raw keyword.
 */
@Component
public class CollectSignalsNode {

    private static final Logger log = LoggerFactory.getLogger(CollectSignalsNode.class);

    private final List<Collector> collectors;
    private final CollectorFanOut fanOut;
    private final HypeCycleMetrics metrics;

    public CollectSignalsNode(List<Collector> collectors, CollectorFanOut fanOut, HypeCycleMetrics metrics) {
        this.collectors = collectors.stream()
                .sorted(Comparator.comparing(Collector::source))
                .toList();
        this.fanOut = fanOut;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ClassificationState state) {
        Map<SourceName, CollectorOutcome> outcomes =
                new EnumMap<>(fanOut.run(state.runId(), state.keyword(), collectors, List.of()));
        long succeeded = outcomes.values().stream().filter(CollectorOutcome::present).count();
        log.info("Collected signals for '{}': {}/{} collectors succeeded",
                state.keyword(), succeeded, SourceName.values().length);
        metrics.recordCollectorsSucceeded((int) succeeded);
        return Map.of(
                "outcomes", outcomes,
                "status", ClassificationStatus.NICHE_CHECK.name());
    }
}
