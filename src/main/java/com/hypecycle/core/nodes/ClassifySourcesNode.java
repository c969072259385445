package com.hypecycle.core.nodes;

import com.hypecycle.core.engine.HypeCycleProperties;
import com.hypecycle.core.llm.ClassifierClient;
import com.hypecycle.core.llm.ClassifierErrorKind;
import com.hypecycle.core.llm.ClassifierErrors;
import com.hypecycle.core.llm.ClassifierOutcome;
import com.hypecycle.core.logging.MdcContext;
import com.hypecycle.core.model.ClassificationStatus;
import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.FailureKind;
import com.hypecycle.core.model.PhaseOpinion;
import com.hypecycle.core.model.SourceName;
import com.hypecycle.core.state.ClassificationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Asks the classifier for one opinion per present source, all sources in parallel.
 * <p>
 * A failed source is recorded as an error. The run fails when fewer opinions than the
 * configured minimum succeed.
 */
@Component
public class ClassifySourcesNode {

    private static final Logger log = LoggerFactory.getLogger(ClassifySourcesNode.class);

    private final ClassifierClient classifierClient;
    private final ExecutorService executor;
    private final int minimumSources;

    public ClassifySourcesNode(ClassifierClient classifierClient,
                               @Qualifier("classifierExecutor") ExecutorService executor,
                               HypeCycleProperties properties) {
        this.classifierClient = classifierClient;
        this.executor = executor;
        this.minimumSources = properties.getMinimumSources();
    }

    public Map<String, Object> apply(ClassificationState state) {
        String runId = state.runId();
        String keyword = state.keyword();

        Map<SourceName, CompletableFuture<ClassifierOutcome<PhaseOpinion>>> calls = new LinkedHashMap<>();
        for (CollectorOutcome outcome : state.outcomes().values()) {
            if (!outcome.present()) {
                continue;
            }
            SourceName source = outcome.source();
            calls.put(source, CompletableFuture
                    .supplyAsync(() -> classify(runId, keyword, outcome), executor)
                    .exceptionally(e -> ClassifierOutcome.failed(
                            ClassifierErrors.classify(e), ClassifierErrors.describe(e))));
        }

        Map<SourceName, PhaseOpinion> opinions = new EnumMap<>(SourceName.class);
        List<String> errors = new ArrayList<>();
        calls.forEach((source, call) -> {
            ClassifierOutcome<PhaseOpinion> result = call.join();
            if (result.isOk()) {
                opinions.put(source, result.value());
            } else {
                errors.add("Failed to analyze " + source.key() + ": " + result.describeError());
            }
        });
        log.info("Per-source classification for '{}': {}/{} succeeded", keyword, opinions.size(), calls.size());

        if (opinions.size() < minimumSources) {
            String message = "Only %d/%d sources classified successfully. Minimum %d required. Errors: %s"
                    .formatted(opinions.size(), calls.size(), minimumSources, errors);
            log.error(message);
            return Map.of(
                    "opinions", opinions,
                    "errors", errors,
                    "status", ClassificationStatus.FAILED.name(),
                    "failureKind", FailureKind.CLASSIFICATION_FAILED.name(),
                    "failureMessage", message);
        }
        return Map.of(
                "opinions", opinions,
                "errors", errors,
                "status", ClassificationStatus.SYNTHESIZING.name());
    }

    private ClassifierOutcome<PhaseOpinion> classify(String runId, String keyword, CollectorOutcome outcome) {
        MdcContext.setSource(runId, keyword, outcome.source().key());
        try {
            return classifierClient.classifyOne(outcome.source(), outcome.metrics(), keyword);
        } catch (RuntimeException e) {
            log.error("Classifier threw for {}: {}", outcome.source().key(), e.getMessage(), e);
            return ClassifierOutcome.failed(ClassifierErrorKind.UPSTREAM_ERROR, ClassifierErrors.describe(e));
        } finally {
            MdcContext.clear();
        }
    }
}
