package com.hypecycle.core.engine;

import com.hypecycle.core.Fixtures;
import com.hypecycle.core.StubCollector;
import com.hypecycle.core.cache.CacheEntry;
import com.hypecycle.core.cache.CacheStore;
import com.hypecycle.core.cache.CacheStoreException;
import com.hypecycle.core.cache.InMemoryCacheStore;
import com.hypecycle.core.cache.JdbcCacheStore;
import com.hypecycle.core.collector.Collector;
import com.hypecycle.core.collector.CollectorFanOut;
import com.hypecycle.core.events.ClassificationEvent;
import com.hypecycle.core.events.EventBus;
import com.hypecycle.core.graph.ClassificationGraph;
import com.hypecycle.core.llm.ClassifierClient;
import com.hypecycle.core.llm.ClassifierErrorKind;
import com.hypecycle.core.llm.ClassifierOutcome;
import com.hypecycle.core.metrics.HypeCycleMetrics;
import com.hypecycle.core.model.ClassificationResult;
import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.FailureKind;
import com.hypecycle.core.model.InvalidKeywordException;
import com.hypecycle.core.model.NicheDetector;
import com.hypecycle.core.model.Phase;
import com.hypecycle.core.model.PhaseOpinion;
import com.hypecycle.core.model.SourceName;
import com.hypecycle.core.nodes.CheckCacheNode;
import com.hypecycle.core.nodes.ClassifySourcesNode;
import com.hypecycle.core.nodes.CollectSignalsNode;
import com.hypecycle.core.nodes.EvaluateNicheNode;
import com.hypecycle.core.nodes.ExpandQueryNode;
import com.hypecycle.core.nodes.PersistResultNode;
import com.hypecycle.core.nodes.SynthesizeNode;
import com.hypecycle.core.nodes.VerifyCoverageNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static com.hypecycle.core.Fixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests for {@link ClassificationEngine} running the real graph with scripted
 * collectors and a mocked {@link ClassifierClient}.
 */
class ClassificationEngineTest {

    private static final List<String> TERMS = List.of("plant tissue culture", "cellular agriculture", "bioreactor cultivation");
    private static final PhaseOpinion FINAL = new PhaseOpinion(Phase.PEAK, 0.78, "Strong buzz across social and news.");

    private ExecutorService collectorExecutor;
    private ExecutorService classifierExecutor;
    private ClassifierClient classifier;
    private CacheStore cacheStore;
    private EventBus eventBus;
    private HypeCycleMetrics metrics;
    private HypeCycleProperties properties;
    private Clock clock;

    @BeforeEach
    void setUp() {
        collectorExecutor = Executors.newFixedThreadPool(10);
        classifierExecutor = Executors.newFixedThreadPool(5);
        cacheStore = new InMemoryCacheStore();
        eventBus = new EventBus();
        metrics = new HypeCycleMetrics(new SimpleMeterRegistry());
        properties = new HypeCycleProperties();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);

        classifier = mock(ClassifierClient.class);
        when(classifier.classifyOne(any(), any(), anyString()))
                .thenReturn(ClassifierOutcome.ok(Fixtures.opinion(Phase.PEAK, 0.8)));
        when(classifier.synthesize(anyString(), anyMap())).thenReturn(ClassifierOutcome.ok(FINAL));
        when(classifier.expandQuery(anyString())).thenReturn(ClassifierOutcome.ok(TERMS));
    }

    @AfterEach
    void tearDown() {
        collectorExecutor.shutdownNow();
        classifierExecutor.shutdownNow();
    }

    private ClassificationEngine engine(List<? extends Collector> stubs) throws Exception {
        List<Collector> collectors = List.copyOf(stubs);
        var fanOut = new CollectorFanOut(collectorExecutor, Duration.ofSeconds(5), eventBus, metrics);
        var graph = new ClassificationGraph(
                new CheckCacheNode(cacheStore, metrics, clock),
                new CollectSignalsNode(collectors, fanOut, metrics),
                new EvaluateNicheNode(NicheDetector.withDefaults()),
                new ExpandQueryNode(classifier, collectors, fanOut, eventBus, metrics),
                new VerifyCoverageNode(properties),
                new ClassifySourcesNode(classifier, classifierExecutor, properties),
                new SynthesizeNode(classifier),
                new PersistResultNode(cacheStore, clock, properties));
        return new ClassificationEngine(graph, eventBus, metrics, properties);
    }

    /** Busy social signal, so the keyword is never niche. */
    private static StubCollector busySocial() {
        return new StubCollector(SourceName.SOCIAL, (keyword, terms) ->
                CollectorOutcome.ok(Fixtures.metrics(SourceName.SOCIAL, keyword, 245, 1190)));
    }

    private static StubCollector quietSocial() {
        return new StubCollector(SourceName.SOCIAL, (keyword, terms) ->
                CollectorOutcome.ok(Fixtures.metrics(SourceName.SOCIAL, keyword, 15, 42)));
    }

    private static List<StubCollector> allSucceeding() {
        return List.of(busySocial(),
                StubCollector.succeeding(SourceName.PAPERS),
                StubCollector.succeeding(SourceName.PATENTS),
                StubCollector.succeeding(SourceName.NEWS),
                StubCollector.succeeding(SourceName.FINANCE));
    }

    // ── Fresh classification ─────────────────────────────────────────

    @Test
    @DisplayName("quantum computing: five sources, no expansion, one synthesis")
    void quantumComputing() throws Exception {
        List<StubCollector> stubs = allSucceeding();

        ClassificationResult result = engine(stubs).classify("quantum computing");

        assertEquals("quantum computing", result.keyword());
        assertEquals(Phase.PEAK, result.phase());
        assertEquals(0.78, result.confidence());
        assertFalse(result.cacheHit());
        assertEquals(5, result.collectorsSucceeded());
        assertFalse(result.partialData());
        assertTrue(result.errors().isEmpty());
        assertFalse(result.queryExpansionApplied());
        assertTrue(result.expandedTerms().isEmpty());
        assertEquals(5, result.perSourceAnalyses().size());
        assertEquals(NOW, result.timestamp());
        assertEquals(NOW.plus(Duration.ofHours(24)), result.expiresAt());

        verify(classifier, times(5)).classifyOne(any(), any(), eq("quantum computing"));
        verify(classifier, times(1)).synthesize(eq("quantum computing"), anyMap());
        verify(classifier, never()).expandQuery(anyString());
        stubs.forEach(stub -> assertEquals(1, stub.callCount(), stub.source().key()));
    }

    @Test
    @DisplayName("collector_data carries all five keys, with null for failed sources")
    void collectorDataKeys() throws Exception {
        var result = engine(List.of(busySocial(),
                StubCollector.succeeding(SourceName.PAPERS),
                StubCollector.failing(SourceName.PATENTS, "Rate limited"),
                StubCollector.succeeding(SourceName.NEWS),
                StubCollector.failing(SourceName.FINANCE, "No tickers found"))).classify("edge ai");

        assertEquals(List.of("social", "papers", "patents", "news", "finance"), List.copyOf(result.collectorData().keySet()));
        assertNull(result.collectorData().get("patents"));
        assertNull(result.collectorData().get("finance"));
        assertEquals(3, result.collectorsSucceeded());
        assertTrue(result.partialData());
        assertEquals(List.of("patents collector failed: Rate limited", "finance collector failed: No tickers found"),
                result.errors());
        assertFalse(result.perSourceAnalyses().containsKey("patents"));
    }

    @Test
    @DisplayName("Surrounding whitespace is trimmed before lookup and classification")
    void keywordTrimmed() throws Exception {
        var engine = engine(allSucceeding());

        assertEquals("llm agents", engine.classify("  llm agents  ").keyword());
        assertTrue(engine.classify("llm agents").cacheHit());
    }

    @Test
    @DisplayName("Invalid keywords are rejected before any work is done")
    void invalidKeyword() throws Exception {
        List<StubCollector> stubs = allSucceeding();
        var engine = engine(stubs);

        assertThrows(InvalidKeywordException.class, () -> engine.classify("   "));
        assertThrows(InvalidKeywordException.class, () -> engine.classify("x".repeat(101)));
        stubs.forEach(stub -> assertEquals(0, stub.callCount()));
        verifyNoInteractions(classifier);
    }

    // ── Cache ────────────────────────────────────────────────────────

    @Test
    @DisplayName("A live cache entry short-circuits collectors and the classifier")
    void cacheShortCircuit() throws Exception {
        cacheStore.put(Fixtures.entry("blockchain", NOW.minus(Duration.ofHours(2))));
        List<StubCollector> stubs = allSucceeding();

        ClassificationResult result = engine(stubs).classify("blockchain");

        assertTrue(result.cacheHit());
        assertEquals(Phase.PEAK, result.phase());
        assertEquals(NOW.minus(Duration.ofHours(2)), result.timestamp());
        stubs.forEach(stub -> assertEquals(0, stub.callCount()));
        verifyNoInteractions(classifier);
    }

    @Test
    @DisplayName("An expired cache entry triggers a fresh classification")
    void expiredEntryIgnored() throws Exception {
        cacheStore.put(Fixtures.entry("blockchain", NOW.minus(Duration.ofHours(30))));

        ClassificationResult result = engine(allSucceeding()).classify("blockchain");

        assertFalse(result.cacheHit());
        assertEquals(NOW, result.timestamp());
        assertEquals(2, cacheStore.recent(10).size());
    }

    @Test
    @DisplayName("A fresh result and its cached replay are identical apart from cache_hit")
    void roundTripInMemory() throws Exception {
        var engine = engine(allSucceeding());

        ClassificationResult fresh = engine.classify("quantum computing");
        ClassificationResult cached = engine.classify("quantum computing");

        assertReplayMatches(fresh, cached);
        verify(classifier, times(1)).synthesize(anyString(), anyMap());
    }

    @Test
    @DisplayName("Round trip through the JDBC store reproduces opinions, phase and expansion metadata")
    void roundTripJdbc() throws Exception {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:engine-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        var jdbcStore = new JdbcCacheStore(dataSource);
        jdbcStore.createTables();
        cacheStore = jdbcStore;
        var engine = engine(List.of(quietSocial(),
                StubCollector.succeeding(SourceName.PAPERS),
                StubCollector.succeedingWhenExpanded(SourceName.PATENTS, "Rate limited"),
                StubCollector.succeeding(SourceName.NEWS),
                StubCollector.failing(SourceName.FINANCE, "No tickers found")));

        ClassificationResult fresh = engine.classify("plant cell culture");
        ClassificationResult cached = engine.classify("plant cell culture");

        assertTrue(fresh.queryExpansionApplied());
        assertReplayMatches(fresh, cached);
    }

    private static void assertReplayMatches(ClassificationResult fresh, ClassificationResult cached) {
        assertFalse(fresh.cacheHit());
        assertTrue(cached.cacheHit());
        assertEquals(fresh.phase(), cached.phase());
        assertEquals(fresh.confidence(), cached.confidence());
        assertEquals(fresh.reasoning(), cached.reasoning());
        assertEquals(fresh.perSourceAnalyses(), cached.perSourceAnalyses());
        assertEquals(fresh.collectorData(), cached.collectorData());
        assertEquals(fresh.queryExpansionApplied(), cached.queryExpansionApplied());
        assertEquals(fresh.expandedTerms(), cached.expandedTerms());
        assertEquals(fresh.errors(), cached.errors());
        assertEquals(fresh.timestamp(), cached.timestamp());
        assertEquals(fresh.expiresAt(), cached.expiresAt());
        assertEquals(fresh.collectorsSucceeded(), cached.collectorsSucceeded());
        assertEquals(fresh.partialData(), cached.partialData());
    }

    @Test
    @DisplayName("A failing cache read is treated as a miss")
    void cacheReadFailure() throws Exception {
        CacheStore broken = mock(CacheStore.class);
        when(broken.get(anyString(), any())).thenThrow(new CacheStoreException("connection reset", null));
        cacheStore = broken;

        ClassificationResult result = engine(allSucceeding()).classify("quantum computing");

        assertFalse(result.cacheHit());
        verify(broken).put(any(CacheEntry.class));
    }

    @Test
    @DisplayName("A failing cache write fails the run")
    void cacheWriteFailure() throws Exception {
        CacheStore broken = mock(CacheStore.class);
        when(broken.get(anyString(), any())).thenReturn(Optional.empty());
        doThrow(new CacheStoreException("disk full", null)).when(broken).put(any());
        cacheStore = broken;
        var engine = engine(allSucceeding());

        var e = assertThrows(ClassificationFailedException.class, () -> engine.classify("quantum computing"));
        assertEquals(FailureKind.PERSISTENCE_FAILED, e.getKind());
        assertTrue(e.getMessage().contains("disk full"));
    }

    // ── Coverage threshold ───────────────────────────────────────────

    static Stream<Integer> successMasks() {
        return IntStream.range(0, 32).boxed();
    }

    @ParameterizedTest(name = "success mask {0}")
    @MethodSource("successMasks")
    @DisplayName("The run proceeds iff at least three collectors succeed")
    void coverageThreshold(int mask) throws Exception {
        List<StubCollector> stubs = new ArrayList<>();
        int present = 0;
        for (SourceName source : SourceName.values()) {
            boolean succeeds = (mask & (1 << source.ordinal())) != 0;
            if (succeeds) {
                present++;
                stubs.add(source == SourceName.SOCIAL ? busySocial() : StubCollector.succeeding(source));
            } else {
                stubs.add(StubCollector.failing(source, "HTTP 500"));
            }
        }
        var engine = engine(stubs);

        if (present >= 3) {
            ClassificationResult result = engine.classify("k" + mask);
            assertEquals(present, result.collectorsSucceeded());
            assertEquals(present < 5, result.partialData());
            assertEquals(5 - present, result.errors().size());
            assertEquals(1, cacheStore.recent(10).size());
        } else {
            var e = assertThrows(InsufficientDataException.class, () -> engine.classify("k" + mask));
            assertEquals(present, e.getCollectorsSucceeded());
            assertEquals(3, e.getMinimumRequired());
            assertEquals(5 - present, e.getReasons().size());
            assertTrue(cacheStore.recent(10).isEmpty());
            verify(classifier, never()).classifyOne(any(), any(), anyString());
        }
        verify(classifier, never()).expandQuery(anyString());
    }

    @Test
    @DisplayName("Network outage: five reasons, no classifier calls, no cache write")
    void networkOutage() throws Exception {
        var engine = engine(List.of(
                StubCollector.failing(SourceName.SOCIAL, "All API requests failed: Network error: ConnectException"),
                StubCollector.failing(SourceName.PAPERS, "All API requests failed: Network error: ConnectException"),
                StubCollector.failing(SourceName.PATENTS, "All API requests failed: Network error: ConnectException"),
                StubCollector.failing(SourceName.NEWS, "All API requests failed: Network error: ConnectException"),
                StubCollector.failing(SourceName.FINANCE, "All API requests failed: Network error: ConnectException")));

        var e = assertThrows(InsufficientDataException.class, () -> engine.classify("anything"));

        assertEquals(5, e.getReasons().size());
        assertEquals(0, e.getCollectorsSucceeded());
        assertTrue(e.getReasons().get(0).startsWith("social collector failed: "));
        assertTrue(cacheStore.recent(10).isEmpty());
        verifyNoInteractions(classifier);
    }

    // ── Query expansion ──────────────────────────────────────────────

    @Test
    @DisplayName("plant cell culture: niche keyword is expanded and four collectors re-run")
    void plantCellCulture() throws Exception {
        StubCollector social = quietSocial();
        StubCollector papers = StubCollector.succeeding(SourceName.PAPERS);
        StubCollector patents = StubCollector.succeedingWhenExpanded(SourceName.PATENTS, "Rate limited");
        StubCollector news = StubCollector.succeeding(SourceName.NEWS);
        StubCollector finance = StubCollector.failing(SourceName.FINANCE, "No tickers found");

        ClassificationResult result = engine(List.of(social, papers, patents, news, finance)).classify("plant cell culture");

        assertTrue(result.queryExpansionApplied());
        assertEquals(TERMS, result.expandedTerms());
        assertEquals(4, result.collectorsSucceeded());
        assertTrue(result.partialData());
        assertEquals(List.of("finance collector failed: No tickers found"), result.errors());

        for (StubCollector stub : List.of(social, papers, patents, news)) {
            assertEquals(List.of(List.of(), TERMS), stub.calls(), stub.source().key());
        }
        assertEquals(1, finance.callCount());
        verify(classifier, times(1)).expandQuery("plant cell culture");
        verify(classifier, times(4)).classifyOne(any(), any(), anyString());
    }

    @Test
    @DisplayName("Finance is never re-run with expansion terms")
    void financeNotExpanded() throws Exception {
        StubCollector finance = StubCollector.succeeding(SourceName.FINANCE);

        engine(List.of(quietSocial(),
                StubCollector.succeeding(SourceName.PAPERS),
                StubCollector.succeeding(SourceName.PATENTS),
                StubCollector.succeeding(SourceName.NEWS),
                finance)).classify("niche thing");

        assertEquals(List.of(List.of()), finance.calls());
    }

    @Test
    @DisplayName("A failed expansion is recorded and the run continues with the original signals")
    void expansionFailure() throws Exception {
        when(classifier.expandQuery(anyString()))
                .thenReturn(ClassifierOutcome.failed(ClassifierErrorKind.MALFORMED_RESPONSE, "Only 1 valid terms"));
        StubCollector papers = StubCollector.succeeding(SourceName.PAPERS);

        ClassificationResult result = engine(List.of(quietSocial(), papers,
                StubCollector.succeeding(SourceName.PATENTS),
                StubCollector.succeeding(SourceName.NEWS),
                StubCollector.succeeding(SourceName.FINANCE))).classify("niche thing");

        assertFalse(result.queryExpansionApplied());
        assertTrue(result.expandedTerms().isEmpty());
        assertEquals(List.of("Query expansion failed: MALFORMED_RESPONSE: Only 1 valid terms"), result.errors());
        assertEquals(1, papers.callCount());
    }

    @Test
    @DisplayName("Missing social metrics never trigger expansion")
    void noSocialNoExpansion() throws Exception {
        engine(List.of(StubCollector.failing(SourceName.SOCIAL, "HTTP 503"),
                StubCollector.succeeding(SourceName.PAPERS),
                StubCollector.succeeding(SourceName.PATENTS),
                StubCollector.succeeding(SourceName.NEWS),
                StubCollector.succeeding(SourceName.FINANCE))).classify("k");

        verify(classifier, never()).expandQuery(anyString());
    }

    @Test
    @DisplayName("Coverage is checked after expansion and still fails when expansion does not help")
    void expansionDoesNotRescue() throws Exception {
        var engine = engine(List.of(quietSocial(),
                StubCollector.succeeding(SourceName.PAPERS),
                StubCollector.failing(SourceName.PATENTS, "HTTP 500"),
                StubCollector.failing(SourceName.NEWS, "HTTP 500"),
                StubCollector.failing(SourceName.FINANCE, "No tickers found")));

        var e = assertThrows(InsufficientDataException.class, () -> engine.classify("obscure"));

        assertEquals(2, e.getCollectorsSucceeded());
        assertEquals(3, e.getReasons().size());
        verify(classifier).expandQuery("obscure");
    }

    // ── Classification and synthesis ─────────────────────────────────

    @Test
    @DisplayName("Per-source failures below the gate are recorded and synthesis proceeds")
    void somePerSourceFailures() throws Exception {
        when(classifier.classifyOne(eq(SourceName.NEWS), any(), anyString()))
                .thenReturn(ClassifierOutcome.failed(ClassifierErrorKind.RATE_LIMITED, "429 - slow down"));
        when(classifier.classifyOne(eq(SourceName.FINANCE), any(), anyString()))
                .thenReturn(ClassifierOutcome.failed(ClassifierErrorKind.TIMED_OUT, "LLM call timed out after 60s"));

        ClassificationResult result = engine(allSucceeding()).classify("quantum computing");

        assertEquals(3, result.perSourceAnalyses().size());
        assertEquals(5, result.collectorsSucceeded());
        assertEquals(List.of(
                "Failed to analyze news: RATE_LIMITED: 429 - slow down",
                "Failed to analyze finance: TIMED_OUT: LLM call timed out after 60s"), result.errors());
    }

    @Test
    @DisplayName("Fewer than three per-source opinions fail the run without synthesis")
    void classificationGate() throws Exception {
        for (SourceName source : List.of(SourceName.PAPERS, SourceName.PATENTS, SourceName.NEWS)) {
            when(classifier.classifyOne(eq(source), any(), anyString()))
                    .thenReturn(ClassifierOutcome.failed(ClassifierErrorKind.MALFORMED_RESPONSE, "Invalid phase: \"hype\""));
        }
        var engine = engine(allSucceeding());

        var e = assertThrows(ClassificationFailedException.class, () -> engine.classify("quantum computing"));

        assertEquals(FailureKind.CLASSIFICATION_FAILED, e.getKind());
        assertEquals(3, e.getErrors().size());
        verify(classifier, never()).synthesize(anyString(), anyMap());
        assertTrue(cacheStore.recent(10).isEmpty());
    }

    @Test
    @DisplayName("A failed synthesis fails the run and writes nothing")
    void synthesisFailure() throws Exception {
        when(classifier.synthesize(anyString(), anyMap()))
                .thenReturn(ClassifierOutcome.failed(ClassifierErrorKind.UNAUTHENTICATED, "401 - Authentication Fails"));
        var engine = engine(allSucceeding());

        var e = assertThrows(ClassificationFailedException.class, () -> engine.classify("quantum computing"));

        assertEquals(FailureKind.SYNTHESIS_FAILED, e.getKind());
        assertEquals("Synthesis failed: UNAUTHENTICATED: 401 - Authentication Fails", e.getMessage());
        assertTrue(cacheStore.recent(10).isEmpty());
    }

    @Test
    @DisplayName("The synthesizer receives every successful per-source opinion")
    void synthesisInput() throws Exception {
        engine(allSucceeding()).classify("quantum computing");

        verify(classifier).synthesize(eq("quantum computing"), argThat(opinions -> opinions.size() == 5));
    }

    // ── Events ───────────────────────────────────────────────────────

    @Test
    @DisplayName("Publishes started, collector and completed events")
    void events() throws Exception {
        List<ClassificationEvent> events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);

        engine(allSucceeding()).classify("quantum computing");

        List<String> types = events.stream().map(ClassificationEvent::eventType).toList();
        assertEquals("classification.started", types.get(0));
        assertEquals("classification.completed", types.get(types.size() - 1));
        assertEquals(5, types.stream().filter("collector.completed"::equals).count());
        Map<String, Object> payload = events.get(events.size() - 1).payload();
        assertEquals("peak", payload.get("phase"));
    }

    @Test
    @DisplayName("Run ids follow HC-YYYY-NNNN")
    void runIdFormat() throws Exception {
        assertTrue(engine(allSucceeding()).generateRunId().matches("HC-\\d{4}-\\d{4,}"));
    }
}
