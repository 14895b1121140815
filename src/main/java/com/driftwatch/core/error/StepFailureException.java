package com.driftwatch.core.error;

import com.driftwatch.core.model.FailureKind;
import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.model.StepResult;

/**
 * Thrown when a stage reports failure. Carries the stage and its diagnostic.
 */
public class StepFailureException extends DriftwatchException {

    private final PipelineStage stage;
    private final String diagnostic;

    public StepFailureException(PipelineStage stage, String diagnostic) {
        super(FailureKind.STEP_FAILURE, "Stage '" + stage.stageName() + "' failed: " + diagnostic);
        this.stage = stage;
        this.diagnostic = diagnostic;
    }

    public static StepFailureException from(StepResult result) {
        return new StepFailureException(result.stage(), result.diagnostic());
    }

    public PipelineStage stage() {
        return stage;
    }

    public String diagnostic() {
        return diagnostic;
    }
}
