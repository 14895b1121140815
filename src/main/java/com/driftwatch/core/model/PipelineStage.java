package com.driftwatch.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * The five pipeline stages, declared in their fixed execution order.
 */
public enum PipelineStage {
    INGESTION,
    TRAINING,
    SCORING,
    DEPLOYMENT,
    REPORTING;

    /** Stages run after drift is declared. */
    public static final List<PipelineStage> RETRAIN_SEQUENCE =
            List.of(TRAINING, SCORING, DEPLOYMENT, REPORTING);

    /**
     * Lower-case name used on the command line, in configuration and in events.
     */
    public String stageName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a stage from its lower-case (or upper-case) name.
     *
     * @throws IllegalArgumentException if the name matches no stage
     */
    public static PipelineStage fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Stage name must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (PipelineStage stage : values()) {
            if (stage.name().equals(normalized)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + name.trim()
                + ". Valid stages: " + Arrays.stream(values()).map(PipelineStage::stageName).toList());
    }
}
