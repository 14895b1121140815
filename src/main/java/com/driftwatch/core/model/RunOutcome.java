package com.driftwatch.core.model;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Summary of a controller run that reached a clean terminal state.
 *
 * @param runId         run identifier, also used as MDC key
 * @param status        NO_NEW_DATA, NO_DRIFT or DONE
 * @param newFiles      files detected as unseen (empty for NO_NEW_DATA)
 * @param previousScore score of the second-most-recent record, when compared
 * @param currentScore  score of the most recent record, when compared
 * @param stagesRun     stages invoked, in invocation order
 * @param durationMs    wall-clock duration of the run
 */
public record RunOutcome(
    String runId,
    RunStatus status,
    List<String> newFiles,
    OptionalDouble previousScore,
    OptionalDouble currentScore,
    List<PipelineStage> stagesRun,
    long durationMs
) {
    public RunOutcome {
        newFiles = List.copyOf(newFiles);
        stagesRun = List.copyOf(stagesRun);
    }

    public boolean driftDetected() {
        return status == RunStatus.DONE;
    }
}
