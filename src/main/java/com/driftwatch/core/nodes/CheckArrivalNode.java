package com.driftwatch.core.nodes;

import com.driftwatch.core.arrival.ArrivalDetector;
import com.driftwatch.core.config.PipelineConfig;
import com.driftwatch.core.error.DriftwatchException;
import com.driftwatch.core.ledger.LedgerStore;
import com.driftwatch.core.metrics.DriftwatchMetrics;
import com.driftwatch.core.model.RunStatus;
import com.driftwatch.core.state.DriftState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares the source directory against the ingested-file ledger.
 * <p>
 * The ledger is read before ingestion runs, so it reflects the previous batch.
 */
@Component
public class CheckArrivalNode {

    private static final Logger log = LoggerFactory.getLogger(CheckArrivalNode.class);

    private final LedgerStore ledger;
    private final ArrivalDetector detector;
    private final PipelineConfig config;
    private final DriftwatchMetrics metrics;

    public CheckArrivalNode(LedgerStore ledger, ArrivalDetector detector,
                            PipelineConfig config, DriftwatchMetrics metrics) {
        this.ledger = ledger;
        this.detector = detector;
        this.config = config;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(DriftState state) {
        Set<String> newFiles;
        try {
            Set<String> known = ledger.readIngestedFiles();
            newFiles = detector.detectNewFiles(config.sourceDir(), known);
        } catch (DriftwatchException e) {
            log.error("Arrival check failed: {}", e.getMessage());
            return NodeResults.failed(e);
        }
        metrics.recordNewFiles(newFiles.size());

        if (newFiles.isEmpty()) {
            log.info("No new data in {}", config.sourceDir());
            return Map.of(
                    "status", RunStatus.CHECKING_ARRIVAL.name(),
                    "hasNewData", false);
        }
        return Map.of(
                "status", RunStatus.INGESTING.name(),
                "hasNewData", true,
                "newFiles", List.copyOf(newFiles));
    }
}
