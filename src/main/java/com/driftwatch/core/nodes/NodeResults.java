package com.driftwatch.core.nodes;

import com.driftwatch.core.error.DriftwatchException;
import com.driftwatch.core.model.RunFailure;
import com.driftwatch.core.model.RunStatus;

import java.util.Map;

/**
 * State updates shared by the controller nodes.
 */
final class NodeResults {

    private NodeResults() {}

    /** Moves the run to FAILED and records the exception for the controller to rethrow. */
    static Map<String, Object> failed(DriftwatchException e) {
        return Map.of(
                "status", RunStatus.FAILED.name(),
                "failure", RunFailure.of(e));
    }
}
