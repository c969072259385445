package com.hypecycle.core.state;

import com.hypecycle.core.cache.CacheEntry;
import com.hypecycle.core.model.ClassificationStatus;
import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.ExpansionState;
import com.hypecycle.core.model.FailureKind;
import com.hypecycle.core.model.PhaseOpinion;
import com.hypecycle.core.model.SourceName;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one classification run.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Collector outcomes and
 * per-source opinions are replaced wholesale by the node that produces them; pipeline
 * errors (expansion and classifier failures) accumulate in an appender channel.
 */
public class ClassificationState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Scalar channels ──────────────────────────────────────────
        Map.entry("runId",          Channels.base(() -> "")),
        Map.entry("keyword",        Channels.base(() -> "")),
        Map.entry("status",         Channels.base(() -> ClassificationStatus.IDLE.name())),
        Map.entry("cachedEntry",    Channels.base((Reducer<CacheEntry>) null)),
        Map.entry("niche",          Channels.base(() -> false)),
        Map.entry("expansion",      Channels.base((Reducer<ExpansionState>) null)),
        Map.entry("finalOpinion",   Channels.base((Reducer<PhaseOpinion>) null)),
        Map.entry("persistedEntry", Channels.base((Reducer<CacheEntry>) null)),
        Map.entry("failureKind",    Channels.base(() -> "")),
        Map.entry("failureMessage", Channels.base(() -> "")),

        // ── Per-source maps, replaced by the producing node ──────────
        Map.entry("outcomes",       Channels.base((Supplier<Map<SourceName, CollectorOutcome>>) () -> new EnumMap<>(SourceName.class))),
        Map.entry("opinions",       Channels.base((Supplier<Map<SourceName, PhaseOpinion>>) () -> new EnumMap<>(SourceName.class))),

        // ── Appender channels (list accumulation) ────────────────────
        Map.entry("errors",         Channels.appender(ArrayList::new))
    );

    public ClassificationState(Map<String, Object> initData) {
        super(initData);
    }

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public String keyword() {
        return this.<String>value("keyword").orElse("");
    }

    public ClassificationStatus status() {
        String raw = this.<String>value("status").orElse(ClassificationStatus.IDLE.name());
        return ClassificationStatus.valueOf(raw);
    }

    public Optional<CacheEntry> cachedEntry() {
        return value("cachedEntry");
    }

    public boolean niche() {
        return this.<Boolean>value("niche").orElse(false);
    }

    public ExpansionState expansion() {
        return this.<ExpansionState>value("expansion").orElse(ExpansionState.none());
    }

    public Optional<PhaseOpinion> finalOpinion() {
        return value("finalOpinion");
    }

    public Optional<CacheEntry> persistedEntry() {
        return value("persistedEntry");
    }

    public Optional<FailureKind> failureKind() {
        String raw = this.<String>value("failureKind").orElse("");
        return raw.isEmpty() ? Optional.empty() : Optional.of(FailureKind.valueOf(raw));
    }

    public String failureMessage() {
        return this.<String>value("failureMessage").orElse("");
    }

    /** Latest outcome per source; re-collected sources replace their earlier outcome. */
    public Map<SourceName, CollectorOutcome> outcomes() {
        Map<SourceName, CollectorOutcome> raw = this.<Map<SourceName, CollectorOutcome>>value("outcomes").orElse(Map.of());
        return Collections.unmodifiableMap(raw.isEmpty() ? new EnumMap<>(SourceName.class) : new EnumMap<>(raw));
    }

    public Map<SourceName, PhaseOpinion> opinions() {
        Map<SourceName, PhaseOpinion> raw = this.<Map<SourceName, PhaseOpinion>>value("opinions").orElse(Map.of());
        return Collections.unmodifiableMap(raw.isEmpty() ? new EnumMap<>(SourceName.class) : new EnumMap<>(raw));
    }

    /** Number of sources whose latest outcome carries metrics. */
    public int presentCount() {
        return (int) outcomes().values().stream().filter(CollectorOutcome::present).count();
    }

    /** Failure descriptions of failed collectors, in canonical source order. */
    public List<String> collectorFailures() {
        return outcomes().values().stream()
                .filter(outcome -> !outcome.present())
                .map(CollectorOutcome::describeFailure)
                .toList();
    }

    /** Errors raised by expansion and classification steps. */
    public List<String> pipelineErrors() {
        return this.<List<String>>value("errors").orElse(List.of());
    }

    /** Collector failures followed by pipeline errors. */
    public List<String> allErrors() {
        List<String> all = new ArrayList<>(collectorFailures());
        all.addAll(pipelineErrors());
        return List.copyOf(all);
    }
}
