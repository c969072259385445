package com.hypecycle.core.nodes;

import com.hypecycle.core.collector.Collector;
import com.hypecycle.core.collector.CollectorFanOut;
import com.hypecycle.core.events.ClassificationEvent;
import com.hypecycle.core.events.EventBus;
import com.hypecycle.core.llm.ClassifierClient;
import com.hypecycle.core.llm.ClassifierOutcome;
import com.hypecycle.core.metrics.HypeCycleMetrics;
import com.hypecycle.core.model.ClassificationStatus;
import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.ExpansionState;
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
 * Broadens a niche keyword with LLM-suggested terms and re-runs the expansion-eligible
 * collectors with them.
 * <p>
 * Re-collected outcomes replace the earlier ones; the finance outcome is kept as collected.
 * When the LLM yields no usable terms the error is recorded and the run continues with
 * the original signals.
 */
@Component
public class ExpandQueryNode {

    private static final Logger log = LoggerFactory.getLogger(ExpandQueryNode.class);

    private final ClassifierClient classifierClient;
    private final List<Collector> eligibleCollectors;
    private final CollectorFanOut fanOut;
    private final EventBus eventBus;
    private final HypeCycleMetrics metrics;

    public ExpandQueryNode(ClassifierClient classifierClient, List<Collector> collectors,
                           CollectorFanOut fanOut, EventBus eventBus, HypeCycleMetrics metrics) {
        this.classifierClient = classifierClient;
        this.eligibleCollectors = collectors.stream()
                .filter(collector -> collector.source().expansionEligible())
                .sorted(Comparator.comparing(Collector::source))
                .toList();
        this.fanOut = fanOut;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ClassificationState state) {
        String keyword = state.keyword();
        ClassifierOutcome<List<String>> expansion = classifierClient.expandQuery(keyword);
        if (!expansion.isOk() || eligibleCollectors.isEmpty()) {
            String error = expansion.isOk()
                    ? "Query expansion skipped: no expansion-eligible collectors"
                    : "Query expansion failed: " + expansion.describeError();
            log.warn("{}; continuing with original data", error);
            metrics.recordExpansion(false);
            eventBus.publish(ClassificationEvent.of("expansion.skipped", state.runId(), keyword, null,
                    Map.of("reason", error)));
            return Map.of(
                    "expansion", ExpansionState.none(),
                    "errors", List.of(error),
                    "status", ClassificationStatus.VERIFYING.name());
        }

        List<String> terms = expansion.value();
        log.info("Expanding '{}' with terms {}", keyword, terms);
        Map<SourceName, CollectorOutcome> outcomes = new EnumMap<>(SourceName.class);
        outcomes.putAll(state.outcomes());
        outcomes.putAll(fanOut.run(state.runId(), keyword, eligibleCollectors, terms));

        metrics.recordExpansion(true);
        eventBus.publish(ClassificationEvent.of("expansion.applied", state.runId(), keyword, null,
                Map.of("terms", terms)));
        return Map.of(
                "outcomes", outcomes,
                "expansion", ExpansionState.applied(terms),
                "status", ClassificationStatus.VERIFYING.name());
    }
}
