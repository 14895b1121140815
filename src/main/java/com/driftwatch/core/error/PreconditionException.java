package com.driftwatch.core.error;

import com.driftwatch.core.model.FailureKind;

/**
 * Thrown when the score comparison is attempted with fewer than two score records.
 */
public class PreconditionException extends DriftwatchException {

    private final int historySize;

    public PreconditionException(int historySize) {
        super(FailureKind.PRECONDITION, "Drift comparison needs at least 2 score records, found "
                + historySize + ". Seed the score ledger with 'driftwatch pipeline --steps scoring'.");
        this.historySize = historySize;
    }

    public int historySize() {
        return historySize;
    }
}
