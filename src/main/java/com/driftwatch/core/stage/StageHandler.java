package com.driftwatch.core.stage;

import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.model.StepResult;

import java.util.Map;

/**
 * Runs one pipeline stage synchronously.
 * <p>
 * The stage owns its own correctness: reading inputs, writing outputs and
 * committing ledger changes. Failures are reported through the returned
 * {@link StepResult}; an unexpected exception is turned into a failed result
 * by {@link StepInvoker}.
 */
public interface StageHandler {

    PipelineStage stage();

    /**
     * @param params flat parameter map, keys from {@link StageParams}
     * @return success or failure with a diagnostic; elapsed time is filled in by the invoker
     */
    StepResult run(Map<String, String> params);

    /**
     * Short description for health output, e.g. the command line.
     */
    String describe();
}
