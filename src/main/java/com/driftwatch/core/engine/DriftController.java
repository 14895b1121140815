package com.driftwatch.core.engine;

import com.driftwatch.core.events.EventBus;
import com.driftwatch.core.events.PipelineEvent;
import com.driftwatch.core.graph.DriftGraph;
import com.driftwatch.core.logging.MdcContext;
import com.driftwatch.core.metrics.DriftwatchMetrics;
import com.driftwatch.core.model.RunFailure;
import com.driftwatch.core.model.RunOutcome;
import com.driftwatch.core.model.RunStatus;
import com.driftwatch.core.state.DriftState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Entry point for one drift decision run.
 * <p>
 * Generates the run id, invokes the compiled {@link DriftGraph} and turns
 * the final state into a {@link RunOutcome}. A run that ends in FAILED
 * rethrows the exception recorded by the failing node. Callers serialize
 * runs; there is no re-entrancy protection.
 */
@Service
public class DriftController {

    private static final Logger log = LoggerFactory.getLogger(DriftController.class);

    private final DriftGraph driftGraph;
    private final EventBus eventBus;
    private final DriftwatchMetrics metrics;

    public DriftController(DriftGraph driftGraph, EventBus eventBus, DriftwatchMetrics metrics) {
        this.driftGraph = driftGraph;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs the controller once with a fresh run id.
     *
     * @return the clean terminal outcome (NO_NEW_DATA, NO_DRIFT or DONE)
     * @throws com.driftwatch.core.error.DriftwatchException the typed failure that aborted the run
     */
    public RunOutcome runOnce() {
        return runOnce(RunIds.next());
    }

    public RunOutcome runOnce(String runId) {
        MdcContext.setRun(runId);
        long start = System.currentTimeMillis();
        try {
            log.info("Starting drift run {}", runId);
            eventBus.publish(PipelineEvent.of("run.started", runId, null, Map.of()));

            var stateMap = new HashMap<String, Object>();
            stateMap.put("runId", runId);
            stateMap.put("status", RunStatus.CHECKING_ARRIVAL.name());
            Map<String, Object> initialState = Map.copyOf(stateMap);

            var config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            var result = driftGraph.getCompiledGraph()
                    .invoke(initialState, config);

            var state = result.orElseThrow(() ->
                    new IllegalStateException("Graph execution returned empty state for run " + runId));
            long durationMs = System.currentTimeMillis() - start;

            metrics.recordRunResult(state.status().name());

            if (state.failed()) {
                RunFailure failure = state.failure().orElseThrow(() ->
                        new IllegalStateException("Run " + runId + " failed without a recorded cause"));
                log.error("Drift run {} failed after {}ms: {}", runId, durationMs, failure.message());
                eventBus.publish(PipelineEvent.of("run.failed", runId, null,
                        Map.of("kind", failure.kind().name(), "message", failure.message())));
                throw failure.cause();
            }

            RunOutcome outcome = toOutcome(state, durationMs);
            log.info("Drift run {} finished with {} in {}ms (stages {})",
                    runId, outcome.status(), durationMs, outcome.stagesRun());
            eventBus.publish(PipelineEvent.of("run.completed", runId, null,
                    Map.of("status", outcome.status().name(), "durationMs", durationMs)));
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    private static RunOutcome toOutcome(DriftState state, long durationMs) {
        RunStatus status = state.status();
        if (!status.isSuccess()) {
            throw new IllegalStateException("Run " + state.runId() + " ended in non-terminal status " + status);
        }
        return new RunOutcome(
                state.runId(),
                status,
                state.newFiles(),
                state.previousScore(),
                state.currentScore(),
                state.stagesRun(),
                durationMs);
    }
}
