package com.driftwatch.core.model;

/**
 * Position of a controller run in the drift decision state machine.
 */
public enum RunStatus {
    START,
    CHECKING_ARRIVAL,
    NO_NEW_DATA,
    INGESTING,
    SCORING,
    COMPARING,
    NO_DRIFT,
    RETRAINING,
    DONE,
    FAILED;

    /** True for the three clean terminal states. */
    public boolean isSuccess() {
        return this == NO_NEW_DATA || this == NO_DRIFT || this == DONE;
    }
}
