package com.hypecycle.core.graph;

import com.hypecycle.core.model.ClassificationStatus;
import com.hypecycle.core.nodes.CheckCacheNode;
import com.hypecycle.core.nodes.ClassifySourcesNode;
import com.hypecycle.core.nodes.CollectSignalsNode;
import com.hypecycle.core.nodes.EvaluateNicheNode;
import com.hypecycle.core.nodes.ExpandQueryNode;
import com.hypecycle.core.nodes.PersistResultNode;
import com.hypecycle.core.nodes.SynthesizeNode;
import com.hypecycle.core.nodes.VerifyCoverageNode;
import com.hypecycle.core.state.ClassificationState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives one
 * classification run.
 * <p>
 * Graph topology:
 * <pre>
 *   START -> check_cache -> [routeAfterCache]
 *            -> END  (cache hit)
 *            -> collect_signals -> evaluate_niche -> [routeAfterNiche]
 *               -> expand_query -> verify_coverage
 *               -> verify_coverage -> [routeOnFailure]
 *                  -> END  (insufficient data)
 *                  -> classify_sources -> [routeOnFailure]
 *                     -> END
 *                     -> synthesize -> [routeOnFailure]
 *                        -> END
 *                        -> persist_result -> END
 * </pre>
 */
@Component
public class ClassificationGraph {

    private static final Logger log = LoggerFactory.getLogger(ClassificationGraph.class);

    private final CompiledGraph<ClassificationState> compiledGraph;

    public ClassificationGraph(
            CheckCacheNode checkCacheNode,
            CollectSignalsNode collectSignalsNode,
            EvaluateNicheNode evaluateNicheNode,
            ExpandQueryNode expandQueryNode,
            VerifyCoverageNode verifyCoverageNode,
            ClassifySourcesNode classifySourcesNode,
            SynthesizeNode synthesizeNode,
            PersistResultNode persistResultNode) throws Exception {

        var graph = new StateGraph<>(ClassificationState.SCHEMA, ClassificationState::new)
                .addNode("check_cache", node_async(checkCacheNode::apply))
                .addNode("collect_signals", node_async(collectSignalsNode::apply))
                .addNode("evaluate_niche", node_async(evaluateNicheNode::apply))
                .addNode("expand_query", node_async(expandQueryNode::apply))
                .addNode("verify_coverage", node_async(verifyCoverageNode::apply))
                .addNode("classify_sources", node_async(classifySourcesNode::apply))
                .addNode("synthesize", node_async(synthesizeNode::apply))
                .addNode("persist_result", node_async(persistResultNode::apply))
                .addEdge(START, "check_cache")
                .addConditionalEdges("check_cache",
                        edge_async(this::routeAfterCache),
                        Map.of("end", END,
                                "collect_signals", "collect_signals"))
                .addEdge("collect_signals", "evaluate_niche")
                .addConditionalEdges("evaluate_niche",
                        edge_async(this::routeAfterNiche),
                        Map.of("expand_query", "expand_query",
                                "verify_coverage", "verify_coverage"))
                .addEdge("expand_query", "verify_coverage")
                .addConditionalEdges("verify_coverage",
                        edge_async((ClassificationState state) -> routeOnFailure(state, "classify_sources")),
                        Map.of("end", END,
                                "classify_sources", "classify_sources"))
                .addConditionalEdges("classify_sources",
                        edge_async((ClassificationState state) -> routeOnFailure(state, "synthesize")),
                        Map.of("end", END,
                                "synthesize", "synthesize"))
                .addConditionalEdges("synthesize",
                        edge_async((ClassificationState state) -> routeOnFailure(state, "persist_result")),
                        Map.of("end", END,
                                "persist_result", "persist_result"))
                .addEdge("persist_result", END);

        var config = CompileConfig.builder()
                .recursionLimit(25)
                .build();
        this.compiledGraph = graph.compile(config);
        log.info("Classification graph compiled");
    }

    /**
     * A cache hit ends the run; anything else proceeds to collection.
     */
    String routeAfterCache(ClassificationState state) {
        if (state.status() == ClassificationStatus.CACHE_HIT) {
            return "end";
        }
        return "collect_signals";
    }

    /**
     * Niche keywords are expanded before the coverage gate.
     */
    String routeAfterNiche(ClassificationState state) {
        if (state.status() == ClassificationStatus.EXPANDING) {
            return "expand_query";
        }
        return "verify_coverage";
    }

    /**
     * Ends the run when the previous node failed it, otherwise continues to {@code next}.
     */
    String routeOnFailure(ClassificationState state, String next) {
        if (state.status() == ClassificationStatus.FAILED) {
            return "end";
        }
        return next;
    }

    public CompiledGraph<ClassificationState> getCompiledGraph() {
        return compiledGraph;
    }
}
