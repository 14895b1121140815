package com.driftwatch.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for controller and pipeline runs.
 */
@Service
public class DriftwatchMetrics {

    private final MeterRegistry registry;

    public DriftwatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(String status) {
        Counter.builder("driftwatch.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordStageExecution(String stage, long ms, boolean success) {
        Timer.builder("driftwatch.stage.duration")
                .tag("stage", stage)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records the outcome of a score comparison.
     *
     * @param drift true when the current score fell below the previous one
     */
    public void recordDriftDecision(boolean drift) {
        Counter.builder("driftwatch.drift.decisions")
                .tag("result", drift ? "drift" : "no_drift")
                .register(registry)
                .increment();
    }

    public void recordScore(double score) {
        DistributionSummary.builder("driftwatch.score")
                .description("Most recent score read at comparison time")
                .register(registry)
                .record(score);
    }

    public void recordNewFiles(int count) {
        DistributionSummary.builder("driftwatch.arrival.new_files")
                .description("New data files detected per run")
                .register(registry)
                .record(count);
    }
}
