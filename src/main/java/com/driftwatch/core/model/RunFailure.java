package com.driftwatch.core.model;

import com.driftwatch.core.error.DriftwatchException;

import java.io.Serializable;

/**
 * Failure captured in the graph state when a node aborts the run.
 * Holds the original exception so the controller can rethrow it.
 */
public record RunFailure(FailureKind kind, String message, DriftwatchException cause) implements Serializable {

    public static RunFailure of(DriftwatchException e) {
        return new RunFailure(e.kind(), e.getMessage(), e);
    }
}
