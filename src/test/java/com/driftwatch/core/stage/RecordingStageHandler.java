package com.driftwatch.core.stage;

import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.model.StepResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Test handler that records every invocation into a shared log before
 * delegating to a scripted behaviour.
 */
public class RecordingStageHandler implements StageHandler {

    /** One invocation: the stage and the parameters it received. */
    public record Call(PipelineStage stage, Map<String, String> params) {}

    private final PipelineStage stage;
    private final List<Call> calls;
    private final Function<Map<String, String>, StepResult> behaviour;

    public RecordingStageHandler(PipelineStage stage, List<Call> calls,
                                 Function<Map<String, String>, StepResult> behaviour) {
        this.stage = stage;
        this.calls = calls;
        this.behaviour = behaviour;
    }

    public static RecordingStageHandler succeeding(PipelineStage stage, List<Call> calls) {
        return new RecordingStageHandler(stage, calls, params -> StepResult.ok(stage, 0));
    }

    public static RecordingStageHandler wrapping(StageHandler delegate, List<Call> calls) {
        return new RecordingStageHandler(delegate.stage(), calls, delegate::run);
    }

    /** A succeeding handler for every stage. */
    public static List<StageHandler> allSucceeding(List<Call> calls) {
        List<StageHandler> handlers = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            handlers.add(succeeding(stage, calls));
        }
        return handlers;
    }

    public static List<PipelineStage> stages(List<Call> calls) {
        return calls.stream().map(Call::stage).toList();
    }

    @Override
    public PipelineStage stage() {
        return stage;
    }

    @Override
    public StepResult run(Map<String, String> params) {
        calls.add(new Call(stage, Map.copyOf(params)));
        return behaviour.apply(params);
    }

    @Override
    public String describe() {
        return "recording " + stage.stageName();
    }
}
