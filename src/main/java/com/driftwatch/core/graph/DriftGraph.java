package com.driftwatch.core.graph;

import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.model.RunStatus;
import com.driftwatch.core.nodes.CheckArrivalNode;
import com.driftwatch.core.nodes.CompareScoresNode;
import com.driftwatch.core.nodes.IngestDataNode;
import com.driftwatch.core.nodes.RetrainStepNode;
import com.driftwatch.core.nodes.ScoreDeployedModelNode;
import com.driftwatch.core.state.DriftState;
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
 * Builds and holds the compiled LangGraph4j {@link StateGraph} for one drift
 * decision run.
 * <pre>
 *   START -> check_arrival -> [routeAfterArrival]
 *            -> no_new_data -> END
 *            -> ingest -> score_deployed -> compare_scores -> [routeAfterCompare]
 *               -> no_drift -> END
 *               -> train -> rescore -> deploy -> report -> done -> END
 * </pre>
 * Every node that can fail is followed by a conditional edge that goes
 * straight to END once the status is FAILED.
 */
@Component
public class DriftGraph {

    private static final Logger log = LoggerFactory.getLogger(DriftGraph.class);

    static final String HALT = "halt";

    private final CompiledGraph<DriftState> compiledGraph;

    public DriftGraph(CheckArrivalNode checkArrivalNode,
                      IngestDataNode ingestNode,
                      ScoreDeployedModelNode scoreDeployedNode,
                      CompareScoresNode compareNode,
                      RetrainStepNode retrainNode) throws Exception {

        var graph = new StateGraph<>(DriftState.SCHEMA, DriftState::new)
                .addNode("check_arrival", node_async(checkArrivalNode::apply))
                .addNode("no_new_data", node_async(
                        state -> Map.of("status", RunStatus.NO_NEW_DATA.name())))
                .addNode("ingest", node_async(ingestNode::apply))
                .addNode("score_deployed", node_async(scoreDeployedNode::apply))
                .addNode("compare_scores", node_async(compareNode::apply))
                .addNode("no_drift", node_async(
                        state -> Map.of("status", RunStatus.NO_DRIFT.name())))
                .addNode("train", node_async(state -> retrainNode.apply(state, PipelineStage.TRAINING)))
                .addNode("rescore", node_async(state -> retrainNode.apply(state, PipelineStage.SCORING)))
                .addNode("deploy", node_async(state -> retrainNode.apply(state, PipelineStage.DEPLOYMENT)))
                .addNode("report", node_async(state -> retrainNode.apply(state, PipelineStage.REPORTING)))
                .addNode("done", node_async(
                        state -> Map.of("status", RunStatus.DONE.name())))
                .addEdge(START, "check_arrival")
                .addConditionalEdges("check_arrival",
                        edge_async(this::routeAfterArrival),
                        Map.of("no_new_data", "no_new_data",
                                "ingest", "ingest",
                                HALT, END))
                .addEdge("no_new_data", END)
                .addConditionalEdges("ingest",
                        edge_async(state -> proceedOrHalt(state, "score_deployed")),
                        Map.of("score_deployed", "score_deployed", HALT, END))
                .addConditionalEdges("score_deployed",
                        edge_async(state -> proceedOrHalt(state, "compare_scores")),
                        Map.of("compare_scores", "compare_scores", HALT, END))
                .addConditionalEdges("compare_scores",
                        edge_async(this::routeAfterCompare),
                        Map.of("no_drift", "no_drift",
                                "train", "train",
                                HALT, END))
                .addEdge("no_drift", END)
                .addConditionalEdges("train",
                        edge_async(state -> proceedOrHalt(state, "rescore")),
                        Map.of("rescore", "rescore", HALT, END))
                .addConditionalEdges("rescore",
                        edge_async(state -> proceedOrHalt(state, "deploy")),
                        Map.of("deploy", "deploy", HALT, END))
                .addConditionalEdges("deploy",
                        edge_async(state -> proceedOrHalt(state, "report")),
                        Map.of("report", "report", HALT, END))
                .addConditionalEdges("report",
                        edge_async(state -> proceedOrHalt(state, "done")),
                        Map.of("done", "done", HALT, END))
                .addEdge("done", END);

        this.compiledGraph = graph.compile();
        log.debug("Drift graph compiled");
    }

    String routeAfterArrival(DriftState state) {
        if (state.failed()) {
            return HALT;
        }
        return state.hasNewData() ? "ingest" : "no_new_data";
    }

    String routeAfterCompare(DriftState state) {
        if (state.failed()) {
            return HALT;
        }
        return state.proceedToRetrain() ? "train" : "no_drift";
    }

    String proceedOrHalt(DriftState state, String next) {
        return state.failed() ? HALT : next;
    }

    public CompiledGraph<DriftState> getCompiledGraph() {
        return compiledGraph;
    }
}
