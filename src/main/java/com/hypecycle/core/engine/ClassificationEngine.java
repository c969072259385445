package com.hypecycle.core.engine;

import com.hypecycle.core.cache.CacheEntry;
import com.hypecycle.core.events.ClassificationEvent;
import com.hypecycle.core.events.EventBus;
import com.hypecycle.core.graph.ClassificationGraph;
import com.hypecycle.core.logging.MdcContext;
import com.hypecycle.core.metrics.HypeCycleMetrics;
import com.hypecycle.core.model.ClassificationResult;
import com.hypecycle.core.model.ClassificationStatus;
import com.hypecycle.core.model.FailureKind;
import com.hypecycle.core.model.Keyword;
import com.hypecycle.core.state.ClassificationState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for classifying a keyword.
 * <p>
 * Normalizes the keyword, runs the {@link ClassificationGraph} and turns its terminal
 * state into a {@link ClassificationResult} or one of the two failure exceptions. Graph
 * state never leaves this class.
 */
@Service
public class ClassificationEngine {

    private static final Logger log = LoggerFactory.getLogger(ClassificationEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final ClassificationGraph graph;
    private final EventBus eventBus;
    private final HypeCycleMetrics metrics;
    private final int minimumSources;

    public ClassificationEngine(ClassificationGraph graph, EventBus eventBus, HypeCycleMetrics metrics,
                                HypeCycleProperties properties) {
        this.graph = graph;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.minimumSources = properties.getMinimumSources();
    }

    /**
     * Classifies the keyword, serving a live cached result when one exists.
     *
     * @throws com.hypecycle.core.model.InvalidKeywordException if the keyword is blank or too long
     * @throws InsufficientDataException     if too few collectors produced metrics
     * @throws ClassificationFailedException if classification, synthesis or persistence failed
     */
    public ClassificationResult classify(String rawKeyword) {
        String keyword = Keyword.normalize(rawKeyword);
        String runId = generateRunId();
        long start = System.currentTimeMillis();
        MdcContext.setRun(runId, keyword);
        try {
            log.info("Starting classification {} for '{}'", runId, keyword);
            eventBus.publish(ClassificationEvent.of("classification.started", runId, keyword, null, Map.of()));

            ClassificationState state = runGraph(runId, keyword);
            return finish(state, start);
        } catch (InsufficientDataException | ClassificationFailedException e) {
            metrics.recordClassification(e instanceof InsufficientDataException ? "insufficient_data" : "failed",
                    System.currentTimeMillis() - start);
            eventBus.publish(ClassificationEvent.of("classification.failed", runId, keyword, null,
                    Map.of("error", String.valueOf(e.getMessage()))));
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private ClassificationState runGraph(String runId, String keyword) {
        var initialState = new HashMap<String, Object>();
        initialState.put("runId", runId);
        initialState.put("keyword", keyword);
        initialState.put("status", ClassificationStatus.CACHE_CHECK.name());

        var config = RunnableConfig.builder()
                .threadId(runId)
                .build();
        try {
            return graph.getCompiledGraph()
                    .invoke(Map.copyOf(initialState), config)
                    .orElseThrow(() -> new IllegalStateException("Graph execution returned empty state for run " + runId));
        } catch (RuntimeException e) {
            log.error("Classification graph failed for '{}'", keyword, e);
            throw new ClassificationFailedException(FailureKind.CLASSIFICATION_FAILED,
                    "Unexpected error: " + e.getMessage(), e);
        }
    }

    private ClassificationResult finish(ClassificationState state, long start) {
        long elapsed = System.currentTimeMillis() - start;
        switch (state.status()) {
            case CACHE_HIT -> {
                ClassificationResult result = ResultAssembler.assemble(cachedEntry(state), true);
                metrics.recordClassification("cache_hit", elapsed);
                eventBus.publish(ClassificationEvent.of("cache.hit", state.runId(), state.keyword(), null,
                        Map.of("phase", result.phase().wireName())));
                return result;
            }
            case DONE -> {
                ClassificationResult result = ResultAssembler.assemble(
                        state.persistedEntry().orElseThrow(() -> new IllegalStateException("Run finished without a stored entry")),
                        false);
                log.info("Classified '{}' as {} ({} sources, {} errors) in {}ms", result.keyword(),
                        result.phase().wireName(), result.collectorsSucceeded(), result.errors().size(), elapsed);
                metrics.recordClassification("fresh", elapsed);
                eventBus.publish(ClassificationEvent.of("classification.completed", state.runId(), state.keyword(), null,
                        Map.of("phase", result.phase().wireName(),
                                "confidence", result.confidence(),
                                "collectors_succeeded", result.collectorsSucceeded())));
                return result;
            }
            case FAILED -> throw failure(state);
            default -> throw new ClassificationFailedException(FailureKind.CLASSIFICATION_FAILED,
                    "Classification stopped in unexpected state " + state.status(), state.allErrors());
        }
    }

    private RuntimeException failure(ClassificationState state) {
        FailureKind kind = state.failureKind().orElse(FailureKind.CLASSIFICATION_FAILED);
        if (kind == FailureKind.INSUFFICIENT_DATA) {
            return new InsufficientDataException(state.failureMessage(), state.collectorFailures(),
                    state.presentCount(), minimumSources);
        }
        return new ClassificationFailedException(kind, state.failureMessage(), state.allErrors());
    }

    private static CacheEntry cachedEntry(ClassificationState state) {
        return state.cachedEntry().orElseThrow(() -> new IllegalStateException("Cache hit without an entry"));
    }

    /**
     * Generates a unique run ID in the format HC-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("HC-%d-%04d", year, count);
    }
}
