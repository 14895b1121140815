package com.driftwatch.core.model;

/**
 * Outcome of one synchronous stage invocation.
 *
 * @param stage      the stage that ran
 * @param success    whether the stage reported success
 * @param diagnostic opaque message from the stage (empty on success)
 * @param elapsedMs  wall-clock duration of the call
 */
public record StepResult(
    PipelineStage stage,
    boolean success,
    String diagnostic,
    long elapsedMs
) {
    public static StepResult ok(PipelineStage stage, long elapsedMs) {
        return new StepResult(stage, true, "", elapsedMs);
    }

    public static StepResult failed(PipelineStage stage, String diagnostic, long elapsedMs) {
        return new StepResult(stage, false, diagnostic != null ? diagnostic : "", elapsedMs);
    }

    /** Same result with the elapsed time replaced. */
    public StepResult withElapsed(long ms) {
        return new StepResult(stage, success, diagnostic, ms);
    }
}
