package com.driftwatch.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One row of the {@code model_score} ledger.
 *
 * @param timestamp when the scoring stage ran
 * @param score     F1 score in [0, 1]
 */
public record ScoreRecord(Instant timestamp, double score) {

    public ScoreRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be in [0, 1], got " + score);
        }
    }
}
