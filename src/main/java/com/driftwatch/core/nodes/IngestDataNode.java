package com.driftwatch.core.nodes;

import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.model.RunStatus;
import com.driftwatch.core.model.StepResult;
import com.driftwatch.core.stage.StageParameters;
import com.driftwatch.core.stage.StepInvoker;
import com.driftwatch.core.state.DriftState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Runs ingestion on the newly arrived data.
 */
@Component
public class IngestDataNode {

    private final StepInvoker invoker;
    private final StageParameters parameters;

    public IngestDataNode(StepInvoker invoker, StageParameters parameters) {
        this.invoker = invoker;
        this.parameters = parameters;
    }

    public Map<String, Object> apply(DriftState state) {
        StepResult result = invoker.runStep(state.runId(), PipelineStage.INGESTION,
                parameters.forStage(PipelineStage.INGESTION));
        return StageUpdates.after(result, RunStatus.SCORING);
    }
}
