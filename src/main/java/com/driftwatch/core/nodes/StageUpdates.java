package com.driftwatch.core.nodes;

import com.driftwatch.core.error.StepFailureException;
import com.driftwatch.core.model.RunFailure;
import com.driftwatch.core.model.RunStatus;
import com.driftwatch.core.model.StepResult;

import java.util.List;
import java.util.Map;

/**
 * State update for a node that invoked one stage. The stage is recorded in
 * {@code stagesRun} whether it succeeded or not.
 */
final class StageUpdates {

    private StageUpdates() {}

    static Map<String, Object> after(StepResult result, RunStatus next) {
        List<String> ran = List.of(result.stage().stageName());
        if (result.success()) {
            return Map.of(
                    "status", next.name(),
                    "stagesRun", ran);
        }
        return Map.of(
                "status", RunStatus.FAILED.name(),
                "failure", RunFailure.of(StepFailureException.from(result)),
                "stagesRun", ran);
    }
}
