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
 * Runs one stage of the retrain sequence with its standard parameters.
 * The graph registers this node once per stage.
 */
@Component
public class RetrainStepNode {

    private final StepInvoker invoker;
    private final StageParameters parameters;

    public RetrainStepNode(StepInvoker invoker, StageParameters parameters) {
        this.invoker = invoker;
        this.parameters = parameters;
    }

    public Map<String, Object> apply(DriftState state, PipelineStage stage) {
        StepResult result = invoker.runStep(state.runId(), stage, parameters.forStage(stage));
        return StageUpdates.after(result, RunStatus.RETRAINING);
    }
}
