package com.driftwatch.core.error;

import com.driftwatch.core.model.FailureKind;

import java.nio.file.Path;

/**
 * Thrown when the source data directory is missing or cannot be listed.
 */
public class SourceUnavailableException extends DriftwatchException {

    private final String directory;

    public SourceUnavailableException(Path directory, String message) {
        super(FailureKind.SOURCE_UNAVAILABLE, "Source directory unavailable (" + directory + "): " + message);
        this.directory = directory.toString();
    }

    public SourceUnavailableException(Path directory, String message, Throwable cause) {
        super(FailureKind.SOURCE_UNAVAILABLE, "Source directory unavailable (" + directory + "): " + message, cause);
        this.directory = directory.toString();
    }

    public Path directory() {
        return Path.of(directory);
    }
}
