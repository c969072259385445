package com.hypecycle.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    // ── Phase ────────────────────────────────────────────────────────

    @Test
    @DisplayName("Phase resolves exactly the five wire names")
    void phaseWireNames() {
        assertEquals(Phase.INNOVATION_TRIGGER, Phase.fromWireName("innovation_trigger"));
        assertEquals(Phase.PEAK, Phase.fromWireName("peak"));
        assertEquals(Phase.TROUGH, Phase.fromWireName("trough"));
        assertEquals(Phase.SLOPE, Phase.fromWireName("slope"));
        assertEquals(Phase.PLATEAU, Phase.fromWireName("plateau"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"PEAK", "Peak", "hype", "", "peak "})
    @DisplayName("Phase rejects anything but an exact wire name")
    void phaseRejectsUnknownNames(String name) {
        assertFalse(Phase.isValid(name));
        assertThrows(IllegalArgumentException.class, () -> Phase.fromWireName(name));
    }

    @Test
    @DisplayName("Phase serializes as its wire name")
    void phaseJson() throws Exception {
        assertEquals("\"innovation_trigger\"", mapper.writeValueAsString(Phase.INNOVATION_TRIGGER));
        assertEquals(Phase.SLOPE, mapper.readValue("\"slope\"", Phase.class));
    }

    // ── PhaseOpinion ─────────────────────────────────────────────────

    @Test
    @DisplayName("PhaseOpinion accepts confidence at both bounds")
    void opinionBounds() {
        assertEquals(0.0, new PhaseOpinion(Phase.PEAK, 0.0, "none").confidence());
        assertEquals(1.0, new PhaseOpinion(Phase.PEAK, 1.0, "all").confidence());
    }

    @Test
    @DisplayName("PhaseOpinion rejects out-of-range confidence, missing phase and blank reasoning")
    void opinionValidation() {
        assertThrows(IllegalArgumentException.class, () -> new PhaseOpinion(Phase.PEAK, 1.01, "x"));
        assertThrows(IllegalArgumentException.class, () -> new PhaseOpinion(Phase.PEAK, -0.1, "x"));
        assertThrows(IllegalArgumentException.class, () -> new PhaseOpinion(Phase.PEAK, Double.NaN, "x"));
        assertThrows(IllegalArgumentException.class, () -> new PhaseOpinion(null, 0.5, "x"));
        assertThrows(IllegalArgumentException.class, () -> new PhaseOpinion(Phase.PEAK, 0.5, "  "));
    }

    // ── SourceName ───────────────────────────────────────────────────

    @Test
    @DisplayName("SourceName keeps canonical order and only finance is excluded from expansion")
    void sourceOrderAndEligibility() {
        assertEquals(List.of(SourceName.SOCIAL, SourceName.PAPERS, SourceName.PATENTS, SourceName.NEWS, SourceName.FINANCE),
                List.of(SourceName.values()));
        for (SourceName source : SourceName.values()) {
            assertEquals(source != SourceName.FINANCE, source.expansionEligible(), source.key());
        }
    }

    @Test
    @DisplayName("SourceName.fromKey is case-insensitive and rejects unknown keys")
    void sourceFromKey() {
        assertEquals(SourceName.PATENTS, SourceName.fromKey("patents"));
        assertEquals(SourceName.NEWS, SourceName.fromKey("NEWS"));
        assertThrows(IllegalArgumentException.class, () -> SourceName.fromKey("twitter"));
    }

    // ── CollectorOutcome ─────────────────────────────────────────────

    @Test
    @DisplayName("CollectorOutcome carries metrics or a failure, never both")
    void collectorOutcomeExclusive() {
        var metrics = new SourceMetrics(SourceName.NEWS, "k", Instant.EPOCH, 1, 2, Map.of(), List.of());
        assertTrue(CollectorOutcome.ok(metrics).present());
        assertEquals(SourceName.NEWS, CollectorOutcome.ok(metrics).source());

        var failed = CollectorOutcome.failed(SourceName.NEWS, "Rate limited");
        assertFalse(failed.present());
        assertEquals("news collector failed: Rate limited", failed.describeFailure());

        assertThrows(IllegalArgumentException.class,
                () -> new CollectorOutcome(SourceName.NEWS, metrics, "also failed"));
        assertThrows(IllegalArgumentException.class,
                () -> new CollectorOutcome(SourceName.NEWS, null, null));
    }

    @Test
    @DisplayName("CollectorOutcome.failed substitutes a reason when none is given")
    void collectorOutcomeBlankReason() {
        assertEquals("unknown error", CollectorOutcome.failed(SourceName.PAPERS, " ").failureReason());
    }

    // ── SourceMetrics ────────────────────────────────────────────────

    @Test
    @DisplayName("SourceMetrics exposes typed views of extra fields")
    void sourceMetricsExtras() {
        var metrics = new SourceMetrics(SourceName.SOCIAL, "k", Instant.EPOCH, 10, 40,
                Map.of("sentiment", 0.25, "recency", "high"), List.of("one page failed"));

        assertEquals(0.25, metrics.number("sentiment", 0));
        assertEquals(-1.0, metrics.number("recency", -1));
        assertEquals("high", metrics.text("recency", "?"));
        assertEquals("?", metrics.text("missing", "?"));
        assertTrue(metrics.hasErrors());
        assertThrows(UnsupportedOperationException.class, () -> metrics.extra().put("x", 1));
    }

    // ── ExpansionState ───────────────────────────────────────────────

    @Test
    @DisplayName("An applied expansion must carry terms")
    void expansionStateInvariant() {
        assertFalse(ExpansionState.none().applied());
        assertTrue(ExpansionState.none().terms().isEmpty());
        assertEquals(List.of("a", "b", "c"), ExpansionState.applied(List.of("a", "b", "c")).terms());
        assertThrows(IllegalArgumentException.class, () -> ExpansionState.applied(List.of()));
    }

    // ── Keyword ──────────────────────────────────────────────────────

    @Test
    @DisplayName("Keyword.normalize trims surrounding whitespace")
    void keywordTrim() {
        assertEquals("quantum computing", Keyword.normalize("  quantum computing \n"));
    }

    @Test
    @DisplayName("Keyword.normalize accepts exactly 100 characters and rejects 101")
    void keywordLength() {
        assertEquals(100, Keyword.normalize("a".repeat(100)).length());
        assertEquals(100, Keyword.normalize("  " + "a".repeat(100) + "  ").length());
        assertThrows(InvalidKeywordException.class, () -> Keyword.normalize("a".repeat(101)));
    }

    @Test
    @DisplayName("Keyword.normalize rejects null, empty and whitespace-only input")
    void keywordEmpty() {
        assertThrows(InvalidKeywordException.class, () -> Keyword.normalize(null));
        assertThrows(InvalidKeywordException.class, () -> Keyword.normalize(""));
        assertThrows(InvalidKeywordException.class, () -> Keyword.normalize("   \t"));
    }

    @Test
    @DisplayName("Terminal statuses are CACHE_HIT, DONE and FAILED")
    void terminalStatuses() {
        for (ClassificationStatus status : ClassificationStatus.values()) {
            boolean expected = status == ClassificationStatus.CACHE_HIT
                    || status == ClassificationStatus.DONE
                    || status == ClassificationStatus.FAILED;
            assertEquals(expected, status.isTerminal(), status.name());
        }
    }
}
