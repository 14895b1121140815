package com.driftwatch.core.error;

import com.driftwatch.core.model.FailureKind;

/**
 * Base of the failures that abort a run. Never retried; the kind decides
 * the process exit status.
 */
public abstract class DriftwatchException extends RuntimeException {

    private final FailureKind kind;

    protected DriftwatchException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected DriftwatchException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
