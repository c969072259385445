package com.hypecycle.core.nodes;

import com.hypecycle.core.Fixtures;
import com.hypecycle.core.StubCollector;
import com.hypecycle.core.collector.Collector;
import com.hypecycle.core.collector.CollectorFanOut;
import com.hypecycle.core.events.ClassificationEvent;
import com.hypecycle.core.events.EventBus;
import com.hypecycle.core.llm.ClassifierClient;
import com.hypecycle.core.llm.ClassifierErrorKind;
import com.hypecycle.core.llm.ClassifierOutcome;
import com.hypecycle.core.metrics.HypeCycleMetrics;
import com.hypecycle.core.model.ClassificationStatus;
import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.ExpansionState;
import com.hypecycle.core.model.SourceName;
import com.hypecycle.core.state.ClassificationState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ExpandQueryNodeTest {

    private static final List<String> TERMS = List.of("plant tissue culture", "micropropagation", "callus culture");

    private ExecutorService executor;
    private ClassifierClient classifier;
    private EventBus eventBus;
    private List<ClassificationEvent> events;
    private StubCollector social;
    private StubCollector papers;
    private StubCollector patents;
    private StubCollector news;
    private StubCollector finance;
    private ExpandQueryNode node;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(5);
        classifier = mock(ClassifierClient.class);
        eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribeAll(events::add);

        social = StubCollector.succeeding(SourceName.SOCIAL);
        papers = StubCollector.succeedingWhenExpanded(SourceName.PAPERS, "No papers found");
        patents = StubCollector.succeedingWhenExpanded(SourceName.PATENTS, "No patents found");
        news = StubCollector.failing(SourceName.NEWS, "HTTP 429");
        finance = StubCollector.failing(SourceName.FINANCE, "No tickers found");

        var metrics = new HypeCycleMetrics(new SimpleMeterRegistry());
        List<Collector> collectors = List.of(finance, news, patents, papers, social);
        node = new ExpandQueryNode(classifier, collectors,
                new CollectorFanOut(executor, Duration.ofSeconds(5), eventBus, metrics), eventBus, metrics);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ClassificationState nicheState() {
        Map<SourceName, CollectorOutcome> outcomes = new EnumMap<>(SourceName.class);
        outcomes.put(SourceName.SOCIAL, CollectorOutcome.ok(Fixtures.metrics(SourceName.SOCIAL, "plant cell culture", 3, 12)));
        outcomes.put(SourceName.PAPERS, CollectorOutcome.failed(SourceName.PAPERS, "No papers found"));
        outcomes.put(SourceName.PATENTS, CollectorOutcome.failed(SourceName.PATENTS, "No patents found"));
        outcomes.put(SourceName.NEWS, CollectorOutcome.failed(SourceName.NEWS, "HTTP 429"));
        outcomes.put(SourceName.FINANCE, CollectorOutcome.failed(SourceName.FINANCE, "No tickers found"));
        return new ClassificationState(Map.of(
                "runId", "HC-2025-0042", "keyword", "plant cell culture", "outcomes", outcomes));
    }

    @Test
    @DisplayName("Re-runs the four eligible collectors with the terms and replaces their outcomes")
    @SuppressWarnings("unchecked")
    void appliesExpansion() {
        when(classifier.expandQuery("plant cell culture")).thenReturn(ClassifierOutcome.ok(TERMS));

        var result = node.apply(nicheState());

        assertEquals(ClassificationStatus.VERIFYING.name(), result.get("status"));
        assertEquals(ExpansionState.applied(TERMS), result.get("expansion"));
        var outcomes = (Map<SourceName, CollectorOutcome>) result.get("outcomes");
        assertTrue(outcomes.get(SourceName.PAPERS).present());
        assertTrue(outcomes.get(SourceName.PATENTS).present());
        assertFalse(outcomes.get(SourceName.NEWS).present());
        assertEquals("No tickers found", outcomes.get(SourceName.FINANCE).failureReason());

        assertEquals(List.of(TERMS), papers.calls());
        assertEquals(List.of(TERMS), social.calls());
        assertEquals(0, finance.callCount());
        assertTrue(events.stream().anyMatch(e -> e.eventType().equals("expansion.applied")));
    }

    @Test
    @DisplayName("A failed expansion records the error and keeps the original outcomes")
    void failedExpansion() {
        when(classifier.expandQuery("plant cell culture"))
                .thenReturn(ClassifierOutcome.failed(ClassifierErrorKind.MALFORMED_RESPONSE, "only 2 valid terms"));

        var result = node.apply(nicheState());

        assertEquals(ClassificationStatus.VERIFYING.name(), result.get("status"));
        assertEquals(ExpansionState.none(), result.get("expansion"));
        assertEquals(List.of("Query expansion failed: MALFORMED_RESPONSE: only 2 valid terms"), result.get("errors"));
        assertFalse(result.containsKey("outcomes"));
        assertEquals(0, papers.callCount());
        assertTrue(events.stream().anyMatch(e -> e.eventType().equals("expansion.skipped")));
    }
}
