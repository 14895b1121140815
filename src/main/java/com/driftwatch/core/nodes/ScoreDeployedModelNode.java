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
 * Scores the model currently in production against the test data. The
 * scoring stage appends the new score to the ledger.
 */
@Component
public class ScoreDeployedModelNode {

    private final StepInvoker invoker;
    private final StageParameters parameters;

    public ScoreDeployedModelNode(StepInvoker invoker, StageParameters parameters) {
        this.invoker = invoker;
        this.parameters = parameters;
    }

    public Map<String, Object> apply(DriftState state) {
        StepResult result = invoker.runStep(state.runId(), PipelineStage.SCORING,
                parameters.forDeployedScoring());
        return StageUpdates.after(result, RunStatus.COMPARING);
    }
}
