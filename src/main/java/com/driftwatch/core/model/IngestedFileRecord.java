package com.driftwatch.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One row of the {@code ingested_files} ledger: a source file merged by the latest ingestion.
 *
 * @param timestamp when the ingestion batch ran
 * @param filename  basename of the file, without any directory component
 */
public record IngestedFileRecord(Instant timestamp, String filename) {

    public IngestedFileRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(filename, "filename");
        if (filename.contains("/") || filename.contains("\\")) {
            throw new IllegalArgumentException("filename must be a basename: " + filename);
        }
    }
}
