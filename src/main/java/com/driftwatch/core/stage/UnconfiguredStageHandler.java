package com.driftwatch.core.stage;

import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.model.StepResult;

import java.util.Map;

/**
 * Placeholder for a stage with no built-in implementation and no configured
 * command. Every invocation fails.
 */
public class UnconfiguredStageHandler implements StageHandler {

    private final PipelineStage stage;

    public UnconfiguredStageHandler(PipelineStage stage) {
        this.stage = stage;
    }

    @Override
    public PipelineStage stage() {
        return stage;
    }

    @Override
    public StepResult run(Map<String, String> params) {
        return StepResult.failed(stage,
                "no command configured (set driftwatch.stages." + stage.stageName() + ".command)", 0);
    }

    @Override
    public String describe() {
        return "not configured";
    }
}
