package com.hypecycle.core.llm;

import com.hypecycle.core.metrics.HypeCycleMetrics;
import com.hypecycle.core.model.ExpansionTermValidator;
import com.hypecycle.core.model.PhaseOpinion;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link ClassifierClient} backed by {@link LlmService}.
 * <p>
 * Replies are decoded by {@link StructuredReplyParser}; every exception raised by the
 * call or the parse is mapped to a {@link ClassifierErrorKind} and returned as a failed outcome.
 */
@Service
public class LlmClassifierClient implements ClassifierClient {

    private static final Logger log = LoggerFactory.getLogger(LlmClassifierClient.class);

    private final LlmService llmService;
    private final StructuredReplyParser parser;
    private final HypeCycleMetrics metrics;

    public LlmClassifierClient(LlmService llmService, HypeCycleMetrics metrics) {
        this(llmService, new StructuredReplyParser(), metrics);
    }

    LlmClassifierClient(LlmService llmService, StructuredReplyParser parser, HypeCycleMetrics metrics) {
        this.llmService = llmService;
        this.parser = parser;
        this.metrics = metrics;
    }

    @Override
    public ClassifierOutcome<PhaseOpinion> classifyOne(SourceName source, SourceMetrics sourceMetrics, String keyword) {
        return call("classify_one", PhasePrompts.sourcePrompt(keyword, sourceMetrics), parser::parseOpinion);
    }

    @Override
    public ClassifierOutcome<PhaseOpinion> synthesize(String keyword, Map<SourceName, PhaseOpinion> opinions) {
        return call("synthesize", PhasePrompts.synthesisPrompt(keyword, opinions), parser::parseOpinion);
    }

    @Override
    public ClassifierOutcome<List<String>> expandQuery(String keyword) {
        return call("expand_query", PhasePrompts.expansionPrompt(keyword), reply -> {
            List<String> terms = ExpansionTermValidator.validTerms(keyword, parser.parseTerms(reply));
            if (terms.size() < ExpansionTermValidator.MIN_TERMS) {
                throw new LlmParseException("Only " + terms.size() + " valid terms");
            }
            return terms;
        });
    }

    private <T> ClassifierOutcome<T> call(String operation, String userPrompt, Function<String, T> decode) {
        long start = System.currentTimeMillis();
        try {
            T value = decode.apply(llmService.complete(PhasePrompts.SYSTEM_PROMPT, userPrompt));
            metrics.recordLlmCall(operation, "ok", System.currentTimeMillis() - start);
            return ClassifierOutcome.ok(value);
        } catch (RuntimeException e) {
            ClassifierErrorKind kind = ClassifierErrors.classify(e);
            String message = ClassifierErrors.describe(e);
            log.warn("LLM {} failed ({}): {}", operation, kind, message);
            metrics.recordLlmCall(operation, kind.name().toLowerCase(Locale.ROOT), System.currentTimeMillis() - start);
            return ClassifierOutcome.failed(kind, message);
        }
    }
}
