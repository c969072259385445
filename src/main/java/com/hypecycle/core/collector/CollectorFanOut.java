package com.hypecycle.core.collector;

import com.hypecycle.core.engine.HypeCycleProperties;
import com.hypecycle.core.events.ClassificationEvent;
import com.hypecycle.core.events.EventBus;
import com.hypecycle.core.logging.MdcContext;
import com.hypecycle.core.metrics.HypeCycleMetrics;
import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.SourceName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a batch of collectors concurrently under one batch-wide timeout.
 * <p>
 * Each collector is isolated: an exception becomes a failed outcome for that source only.
 * When the timeout expires, collectors that already finished keep their outcome and the
 * rest are reported as timed out. Their threads are interrupted but late results are discarded.
 */
@Component
public class CollectorFanOut {

    private static final Logger log = LoggerFactory.getLogger(CollectorFanOut.class);

    private final ExecutorService executor;
    private final Duration batchTimeout;
    private final EventBus eventBus;
    private final HypeCycleMetrics metrics;

    @Autowired
    public CollectorFanOut(@Qualifier("collectorExecutor") ExecutorService executor,
                           HypeCycleProperties properties, EventBus eventBus, HypeCycleMetrics metrics) {
        this(executor, Duration.ofSeconds(properties.getCollectorTimeoutSeconds()), eventBus, metrics);
    }

    CollectorFanOut(ExecutorService executor, Duration batchTimeout) {
        this(executor, batchTimeout, new EventBus(), null);
    }

    public CollectorFanOut(ExecutorService executor, Duration batchTimeout, EventBus eventBus, HypeCycleMetrics metrics) {
        this.executor = executor;
        this.batchTimeout = batchTimeout;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Invokes every collector with the same keyword and expansion terms.
     *
     * @return one outcome per collector's source, in canonical source order
     */
    public Map<SourceName, CollectorOutcome> run(String runId, String keyword,
                                                 List<Collector> collectors, List<String> expansionTerms) {
        List<String> terms = expansionTerms == null ? List.of() : List.copyOf(expansionTerms);
        Map<SourceName, CompletableFuture<CollectorOutcome>> futures = new LinkedHashMap<>();
        Map<SourceName, CollectorOutcome> results = new EnumMap<>(SourceName.class);

        for (Collector collector : collectors) {
            try {
                futures.put(collector.source(), CompletableFuture.supplyAsync(
                        () -> invoke(collector, runId, keyword, terms), executor));
            } catch (RejectedExecutionException e) {
                results.put(collector.source(), CollectorOutcome.failed(collector.source(), "collector rejected: executor unavailable"));
            }
        }

        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                    .get(batchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Collector batch timed out after {}", describe(batchTimeout));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for collectors");
        } catch (ExecutionException e) {
            log.error("Unexpected error collecting collector results", e.getCause());
        }

        futures.forEach((source, future) -> {
            if (!future.isDone()) {
                future.cancel(true);
                results.put(source, CollectorOutcome.failed(source, "timed out after " + describe(batchTimeout)));
            } else if (future.isCompletedExceptionally()) {
                results.put(source, CollectorOutcome.failed(source, describeFailure(future)));
            } else {
                results.put(source, future.join());
            }
        });
        return results;
    }

    /** Reason for a future that completed exceptionally, e.g. an {@link Error} escaping the collector. */
    private static String describeFailure(CompletableFuture<CollectorOutcome> future) {
        try {
            future.join();
            return "collector failed";
        } catch (CancellationException e) {
            return "collector cancelled";
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return cause.getClass().getSimpleName() + ": " + cause.getMessage();
        }
    }

    private CollectorOutcome invoke(Collector collector, String runId, String keyword, List<String> terms) {
        String source = collector.source().key();
        MdcContext.setSource(runId, keyword, source);
        long start = System.currentTimeMillis();
        CollectorOutcome outcome;
        try {
            outcome = collector.fetch(keyword, terms);
            if (outcome == null) {
                outcome = CollectorOutcome.failed(collector.source(), "collector returned no result");
            }
        } catch (Exception e) {
            log.error("{} collector threw: {}", source, e.getMessage(), e);
            outcome = CollectorOutcome.failed(collector.source(), e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            MdcContext.clear();
        }

        long elapsed = System.currentTimeMillis() - start;
        if (outcome.present()) {
            log.info("{} collector finished in {}ms ({} non-fatal errors)", source, elapsed, outcome.metrics().errors().size());
        } else {
            log.warn("{} collector failed in {}ms: {}", source, elapsed, outcome.failureReason());
        }
        if (metrics != null) {
            metrics.recordCollector(source, outcome.present(), elapsed);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", outcome.present());
        payload.put("expanded", !terms.isEmpty());
        if (!outcome.present()) {
            payload.put("reason", outcome.failureReason());
        }
        eventBus.publish(ClassificationEvent.of("collector.completed", runId, keyword, source, payload));
        return outcome;
    }

    static String describe(Duration timeout) {
        return timeout.toMillis() % 1000 == 0 ? timeout.toSeconds() + "s" : timeout.toMillis() + "ms";
    }
}
