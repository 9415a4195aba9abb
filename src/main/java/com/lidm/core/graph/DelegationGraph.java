package com.lidm.core.graph;

import com.lidm.core.engine.DelegationSettings;
import com.lidm.core.model.Classification;
import com.lidm.core.model.QueryStatus;
import com.lidm.core.nodes.AggregateResultsNode;
import com.lidm.core.nodes.ClassifyQueryNode;
import com.lidm.core.nodes.DecomposeQueryNode;
import com.lidm.core.nodes.ExecuteSubtasksNode;
import com.lidm.core.nodes.RouteDirectNode;
import com.lidm.core.nodes.VerifyAnswerNode;
import com.lidm.core.state.DelegationState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
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
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives
 * one query from classification to a verified answer.
 * <p>
 * Graph topology:
 * <pre>
 *   START -> classify_query -> [routeAfterClassify]
 *            -> END                                   (classification failed)
 *            -> route_direct    -> execute_subtasks
 *            -> decompose_query -> execute_subtasks
 *   execute_subtasks -> aggregate_results -> [routeAfterAggregate]
 *            -> verify_answer -> END
 *            -> END
 * </pre>
 */
@Component
public class DelegationGraph {

    private static final Logger log = LoggerFactory.getLogger(DelegationGraph.class);

    private final CompiledGraph<DelegationState> compiledGraph;
    private final DelegationSettings settings;

    public DelegationGraph(
            ClassifyQueryNode classifyNode,
            DecomposeQueryNode decomposeNode,
            RouteDirectNode directNode,
            ExecuteSubtasksNode executeNode,
            AggregateResultsNode aggregateNode,
            VerifyAnswerNode verifyNode,
            DelegationSettings settings) throws GraphStateException {
        this.settings = settings;

        var graph = new StateGraph<>(DelegationState.SCHEMA, DelegationState::new)
                .addNode("classify_query", node_async(classifyNode::apply))
                .addNode("decompose_query", node_async(decomposeNode::apply))
                .addNode("route_direct", node_async(directNode::apply))
                .addNode("execute_subtasks", node_async(executeNode::apply))
                .addNode("aggregate_results", node_async(aggregateNode::apply))
                .addNode("verify_answer", node_async(verifyNode::apply))
                .addEdge(START, "classify_query")
                .addConditionalEdges("classify_query",
                        edge_async(this::routeAfterClassify),
                        Map.of("decompose_query", "decompose_query",
                                "route_direct", "route_direct",
                                "failed", END))
                .addEdge("decompose_query", "execute_subtasks")
                .addEdge("route_direct", "execute_subtasks")
                .addEdge("execute_subtasks", "aggregate_results")
                .addConditionalEdges("aggregate_results",
                        edge_async(this::routeAfterAggregate),
                        Map.of("verify_answer", "verify_answer",
                                "done", END))
                .addEdge("verify_answer", END);

        this.compiledGraph = graph.compile();
        log.info("Delegation graph compiled (decompose at complexity >= {}, max {} subtasks)",
                settings.complexityThreshold(), settings.maxSubtasks());
    }

    /**
     * Decomposes only queries that are both complex enough and need more than one
     * capability; everything else is answered by a single backend call.
     */
    String routeAfterClassify(DelegationState state) {
        if (state.status() == QueryStatus.FAILED) {
            return "failed";
        }
        Classification classification = state.classification().orElseGet(Classification::defaults);
        if (classification.complexity() >= settings.complexityThreshold()
                && classification.capabilities().size() > 1) {
            return "decompose_query";
        }
        return "route_direct";
    }

    String routeAfterAggregate(DelegationState state) {
        if (state.status() == QueryStatus.VERIFYING && state.verificationRequired()) {
            return "verify_answer";
        }
        return "done";
    }

    public CompiledGraph<DelegationState> getCompiledGraph() {
        return compiledGraph;
    }
}
