package com.hypecycle.core.nodes;

import com.hypecycle.core.engine.HypeCycleProperties;
import com.hypecycle.core.model.ClassificationStatus;
import com.hypecycle.core.model.FailureKind;
import com.hypecycle.core.model.SourceName;
import com.hypecycle.core.state.ClassificationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Final coverage gate: fewer present sources than the configured minimum fails the run.
 */
@Component
public class VerifyCoverageNode {

    private static final Logger log = LoggerFactory.getLogger(VerifyCoverageNode.class);

    private final int minimumSources;

    public VerifyCoverageNode(HypeCycleProperties properties) {
        this.minimumSources = properties.getMinimumSources();
    }

    public Map<String, Object> apply(ClassificationState state) {
        int succeeded = state.presentCount();
        if (succeeded < minimumSources) {
            String message = "Insufficient data: only %d/%d collectors succeeded. Minimum %d required. Errors: %s"
                    .formatted(succeeded, SourceName.values().length, minimumSources, state.collectorFailures());
            log.warn(message);
            return Map.of(
                    "status", ClassificationStatus.FAILED.name(),
                    "failureKind", FailureKind.INSUFFICIENT_DATA.name(),
                    "failureMessage", message);
        }
        return Map.of("status", ClassificationStatus.CLASSIFYING.name());
    }
}
