package com.hypecycle.core.nodes;

import com.hypecycle.core.llm.ClassifierClient;
import com.hypecycle.core.llm.ClassifierOutcome;
import com.hypecycle.core.model.ClassificationStatus;
import com.hypecycle.core.model.FailureKind;
import com.hypecycle.core.model.PhaseOpinion;
import com.hypecycle.core.state.ClassificationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Combines the per-source opinions into the final verdict. There is no fallback:
 * a failed synthesis fails the run.
 */
@Component
public class SynthesizeNode {

    private static final Logger log = LoggerFactory.getLogger(SynthesizeNode.class);

    private final ClassifierClient classifierClient;

    public SynthesizeNode(ClassifierClient classifierClient) {
        this.classifierClient = classifierClient;
    }

    public Map<String, Object> apply(ClassificationState state) {
        ClassifierOutcome<PhaseOpinion> result = classifierClient.synthesize(state.keyword(), state.opinions());
        if (!result.isOk()) {
            String message = "Synthesis failed: " + result.describeError();
            log.error(message);
            return Map.of(
                    "errors", List.of(message),
                    "status", ClassificationStatus.FAILED.name(),
                    "failureKind", FailureKind.SYNTHESIS_FAILED.name(),
                    "failureMessage", message);
        }
        PhaseOpinion opinion = result.value();
        log.info("Synthesized '{}' as {} (confidence {})", state.keyword(), opinion.phase().wireName(), opinion.confidence());
        return Map.of(
                "finalOpinion", opinion,
                "status", ClassificationStatus.PERSISTING.name());
    }
}
