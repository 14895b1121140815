package com.driftwatch.dispatch.cli;

import com.driftwatch.core.error.DriftwatchException;
import com.driftwatch.core.error.StepFailureException;

/**
 * Prints a typed failure and returns its exit code.
 */
final class FailureReporter {

    private FailureReporter() {}

    static int report(DriftwatchException e) {
        ConsoleOutput.error(e.getMessage());
        if (e instanceof StepFailureException sf) {
            ConsoleOutput.warn("Completed stages are not rolled back. Re-run the remaining stages with "
                    + "'driftwatch pipeline --steps " + sf.stage().stageName() + ",...'");
        }
        return e.kind().exitCode();
    }
}
