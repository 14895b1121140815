package com.driftwatch.core.error;

import com.driftwatch.core.model.FailureKind;

/**
 * Thrown when a ledger table cannot be opened or read, or holds a corrupt row.
 */
public class StoreUnavailableException extends DriftwatchException {

    private final String resource;

    public StoreUnavailableException(String resource, String message, Throwable cause) {
        super(FailureKind.STORE_UNAVAILABLE, "Ledger unavailable (" + resource + "): " + message, cause);
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }
}
