package com.driftwatch.core.model;

/**
 * Failure taxonomy of a run, each with the process exit status it maps to.
 */
public enum FailureKind {
    STORE_UNAVAILABLE(3),
    SOURCE_UNAVAILABLE(4),
    STEP_FAILURE(5),
    PRECONDITION(6);

    private final int exitCode;

    FailureKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
