package com.driftwatch.core.stage;

import com.driftwatch.core.events.EventBus;
import com.driftwatch.core.events.PipelineEvent;
import com.driftwatch.core.logging.MdcContext;
import com.driftwatch.core.metrics.DriftwatchMetrics;
import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one named stage synchronously and reports the outcome.
 * <p>
 * Holds exactly one {@link StageHandler} per {@link PipelineStage}. An
 * exception escaping a handler is converted into a failed {@link StepResult}
 * so callers only ever see success or failure.
 */
public class StepInvoker {

    private static final Logger log = LoggerFactory.getLogger(StepInvoker.class);

    private final Map<PipelineStage, StageHandler> handlers;
    private final EventBus eventBus;
    private final DriftwatchMetrics metrics;

    public StepInvoker(List<StageHandler> handlers, EventBus eventBus, DriftwatchMetrics metrics) {
        var byStage = new EnumMap<PipelineStage, StageHandler>(PipelineStage.class);
        for (StageHandler handler : handlers) {
            if (byStage.putIfAbsent(handler.stage(), handler) != null) {
                throw new IllegalStateException("Duplicate handler for stage " + handler.stage().stageName());
            }
        }
        for (PipelineStage stage : PipelineStage.values()) {
            if (!byStage.containsKey(stage)) {
                throw new IllegalStateException("No handler for stage " + stage.stageName());
            }
        }
        this.handlers = Collections.unmodifiableMap(byStage);
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs a stage and blocks until it completes.
     *
     * @param runId  run the invocation belongs to, used for events and logging context
     * @param stage  stage to run
     * @param params stage parameter map
     * @return success, or failure with the stage's diagnostic
     */
    public StepResult runStep(String runId, PipelineStage stage, Map<String, String> params) {
        StageHandler handler = handlers.get(stage);
        MdcContext.setStage(runId, stage.stageName());
        eventBus.publish(PipelineEvent.of("stage.started", runId, stage.stageName(), Map.of()));
        log.info("Stage {} started", stage.stageName());

        long start = System.currentTimeMillis();
        StepResult result;
        try {
            result = handler.run(params);
        } catch (RuntimeException e) {
            log.error("Stage {} threw", stage.stageName(), e);
            result = StepResult.failed(stage, e.getClass().getSimpleName() + ": " + e.getMessage(), 0);
        }
        long elapsed = System.currentTimeMillis() - start;
        result = result.withElapsed(elapsed);

        try {
            metrics.recordStageExecution(stage.stageName(), elapsed, result.success());
            if (result.success()) {
                log.info("Stage {} completed in {}ms", stage.stageName(), elapsed);
                eventBus.publish(PipelineEvent.of("stage.completed", runId, stage.stageName(),
                        Map.of("elapsedMs", elapsed)));
            } else {
                log.warn("Stage {} failed after {}ms: {}", stage.stageName(), elapsed, result.diagnostic());
                eventBus.publish(PipelineEvent.of("stage.failed", runId, stage.stageName(),
                        Map.of("elapsedMs", elapsed, "diagnostic", result.diagnostic())));
            }
        } finally {
            MdcContext.clearStage();
        }
        return result;
    }

    public StageHandler handlerFor(PipelineStage stage) {
        return handlers.get(stage);
    }
}
