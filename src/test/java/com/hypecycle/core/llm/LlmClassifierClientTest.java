package com.hypecycle.core.llm;

import com.hypecycle.core.metrics.HypeCycleMetrics;
import com.hypecycle.core.model.Phase;
import com.hypecycle.core.model.PhaseOpinion;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.retry.NonTransientAiException;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmClassifierClientTest {

    private LlmService llmService;
    private SimpleMeterRegistry registry;
    private LlmClassifierClient client;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        registry = new SimpleMeterRegistry();
        client = new LlmClassifierClient(llmService, new HypeCycleMetrics(registry));
    }

    private static SourceMetrics socialMetrics() {
        return new SourceMetrics(SourceName.SOCIAL, "quantum computing", Instant.EPOCH, 245, 1190,
                Map.of("mentions_6m", 520L, "mentions_1y", 425L, "sentiment", 0.72,
                        "growth_trend", "increasing", "momentum", "accelerating", "recency", "high"),
                List.of());
    }

    // ── classifyOne ──────────────────────────────────────────────────

    @Test
    @DisplayName("classifyOne returns the parsed opinion and prompts with the source metrics")
    void classifyOneSuccess() {
        when(llmService.complete(anyString(), anyString()))
                .thenReturn("{\"phase\": \"peak\", \"confidence\": 0.82, \"reasoning\": \"Buzz is high.\"}");

        var outcome = client.classifyOne(SourceName.SOCIAL, socialMetrics(), "quantum computing");

        assertTrue(outcome.isOk());
        assertEquals(new PhaseOpinion(Phase.PEAK, 0.82, "Buzz is high."), outcome.value());

        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        verify(llmService).complete(eq(PhasePrompts.SYSTEM_PROMPT), userPrompt.capture());
        assertTrue(userPrompt.getValue().contains("\"quantum computing\""));
        assertTrue(userPrompt.getValue().contains("30d=245"));
        assertTrue(userPrompt.getValue().contains("Sentiment: 0.72"));
        assertEquals(1, registry.get("hypecycle.llm.calls").tag("operation", "classify_one").tag("outcome", "ok").timer().count());
    }

    @Test
    @DisplayName("classifyOne reports an invalid phase as MALFORMED_RESPONSE")
    void classifyOneInvalidPhase() {
        when(llmService.complete(anyString(), anyString()))
                .thenReturn("{\"phase\": \"hype\", \"confidence\": 0.5, \"reasoning\": \"r\"}");

        var outcome = client.classifyOne(SourceName.SOCIAL, socialMetrics(), "quantum computing");

        assertFalse(outcome.isOk());
        assertEquals(ClassifierErrorKind.MALFORMED_RESPONSE, outcome.errorKind());
        assertTrue(outcome.describeError().startsWith("MALFORMED_RESPONSE: Invalid phase"));
    }

    @Test
    @DisplayName("classifyOne maps provider rate limiting to RATE_LIMITED")
    void classifyOneRateLimited() {
        when(llmService.complete(anyString(), anyString()))
                .thenThrow(new NonTransientAiException("429 - Too many requests"));

        var outcome = client.classifyOne(SourceName.SOCIAL, socialMetrics(), "quantum computing");

        assertEquals(ClassifierErrorKind.RATE_LIMITED, outcome.errorKind());
        assertEquals(1, registry.get("hypecycle.llm.calls").tag("outcome", "rate_limited").timer().count());
    }

    @Test
    @DisplayName("classifyOne maps timeouts to TIMED_OUT")
    void classifyOneTimeout() {
        when(llmService.complete(anyString(), anyString())).thenThrow(new LlmTimeoutException("LLM call timed out after 60s"));

        var outcome = client.classifyOne(SourceName.SOCIAL, socialMetrics(), "quantum computing");

        assertEquals(ClassifierErrorKind.TIMED_OUT, outcome.errorKind());
        assertEquals("LLM call timed out after 60s", outcome.message());
    }

    // ── synthesize ───────────────────────────────────────────────────

    @Test
    @DisplayName("synthesize lists opinions in canonical order and returns the final verdict")
    void synthesizeSuccess() {
        when(llmService.complete(anyString(), anyString()))
                .thenReturn("```json\n{\"phase\": \"peak\", \"confidence\": 0.78, \"reasoning\": \"Most sources agree.\"}\n```");

        Map<SourceName, PhaseOpinion> opinions = new EnumMap<>(SourceName.class);
        opinions.put(SourceName.NEWS, new PhaseOpinion(Phase.PEAK, 0.75, "News high."));
        opinions.put(SourceName.SOCIAL, new PhaseOpinion(Phase.PEAK, 0.85, "Social high."));
        opinions.put(SourceName.PAPERS, new PhaseOpinion(Phase.SLOPE, 0.70, "Papers steady."));

        var outcome = client.synthesize("quantum computing", opinions);

        assertEquals(Phase.PEAK, outcome.value().phase());
        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        verify(llmService).complete(anyString(), userPrompt.capture());
        String prompt = userPrompt.getValue();
        assertTrue(prompt.contains("from 3 independent perspectives"));
        assertTrue(prompt.indexOf("Social Media (Hacker News)") < prompt.indexOf("Academic Research (Semantic Scholar)"));
        assertTrue(prompt.indexOf("Academic Research (Semantic Scholar)") < prompt.indexOf("News Coverage (GDELT)"));
        assertTrue(prompt.contains("Confidence: 0.85"));
    }

    @Test
    @DisplayName("synthesize reports unauthenticated providers")
    void synthesizeUnauthenticated() {
        when(llmService.complete(anyString(), anyString())).thenThrow(new NonTransientAiException("401 - Authentication Fails"));

        var outcome = client.synthesize("k", Map.of(SourceName.SOCIAL, new PhaseOpinion(Phase.PEAK, 0.5, "r")));

        assertEquals(ClassifierErrorKind.UNAUTHENTICATED, outcome.errorKind());
    }

    // ── expandQuery ──────────────────────────────────────────────────

    @Test
    @DisplayName("expandQuery returns validated terms")
    void expandQuerySuccess() {
        when(llmService.complete(anyString(), anyString()))
                .thenReturn("{\"terms\": [\"plant tissue culture\", \"technology\", \"cellular agriculture\", \"bioreactor cultivation\"]}");

        var outcome = client.expandQuery("plant cell culture");

        assertEquals(List.of("plant tissue culture", "cellular agriculture", "bioreactor cultivation"), outcome.value());
    }

    @Test
    @DisplayName("expandQuery fails when fewer than three usable terms remain")
    void expandQueryTooFewTerms() {
        when(llmService.complete(anyString(), anyString()))
                .thenReturn("{\"terms\": [\"plant tissue culture\", \"technology\", \"plant cell culture\"]}");

        var outcome = client.expandQuery("plant cell culture");

        assertFalse(outcome.isOk());
        assertEquals(ClassifierErrorKind.MALFORMED_RESPONSE, outcome.errorKind());
        assertEquals("Only 1 valid terms", outcome.message());
    }

    @Test
    @DisplayName("expandQuery rejects a reply that is not JSON")
    void expandQueryNotJson() {
        when(llmService.complete(anyString(), anyString())).thenReturn("plant tissue culture, cell farming");

        assertEquals(ClassifierErrorKind.MALFORMED_RESPONSE, client.expandQuery("plant cell culture").errorKind());
    }
}
