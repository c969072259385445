package com.hypecycle.core.nodes;

import com.hypecycle.core.model.ClassificationStatus;
import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.NicheDetector;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;
import com.hypecycle.core.state.ClassificationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Decides from the social metrics whether the keyword is niche and needs query expansion.
 */
@Component
public class EvaluateNicheNode {

    private static final Logger log = LoggerFactory.getLogger(EvaluateNicheNode.class);

    private final NicheDetector nicheDetector;

    public EvaluateNicheNode(NicheDetector nicheDetector) {
        this.nicheDetector = nicheDetector;
    }

    public Map<String, Object> apply(ClassificationState state) {
        CollectorOutcome social = state.outcomes().get(SourceName.SOCIAL);
        SourceMetrics socialMetrics = social != null ? social.metrics() : null;
        boolean niche = nicheDetector.isNiche(socialMetrics);
        if (niche) {
            log.info("'{}' looks niche (social recent={}, total={}); expanding query",
                    state.keyword(), socialMetrics.recentVolume(), socialMetrics.totalVolume());
        }
        return Map.of(
                "niche", niche,
                "status", (niche ? ClassificationStatus.EXPANDING : ClassificationStatus.VERIFYING).name());
    }
}
