package com.hypecycle.core.llm;

import com.hypecycle.core.model.PhaseOpinion;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;

import java.util.List;
import java.util.Map;

/**
 * The three LLM operations the classification pipeline depends on.
 * <p>
 * Implementations never throw for provider or parsing failures; they report them as a
 * failed {@link ClassifierOutcome}.
 */
public interface ClassifierClient {

    /** One phase verdict derived from a single source's metrics. */
    ClassifierOutcome<PhaseOpinion> classifyOne(SourceName source, SourceMetrics metrics, String keyword);

    /** The final verdict over all per-source opinions. */
    ClassifierOutcome<PhaseOpinion> synthesize(String keyword, Map<SourceName, PhaseOpinion> opinions);

    /** Between 3 and 5 validated search terms related to the keyword. */
    ClassifierOutcome<List<String>> expandQuery(String keyword);
}
