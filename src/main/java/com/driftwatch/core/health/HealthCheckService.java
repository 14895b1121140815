package com.driftwatch.core.health;

import com.driftwatch.core.arrival.ArrivalDetector;
import com.driftwatch.core.config.PipelineConfig;
import com.driftwatch.core.error.DriftwatchException;
import com.driftwatch.core.ledger.LedgerStore;
import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.stage.StageHandler;
import com.driftwatch.core.stage.StepInvoker;
import com.driftwatch.core.stage.UnconfiguredStageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final LedgerStore ledger;
    private final ArrivalDetector detector;
    private final PipelineConfig config;
    private final StepInvoker invoker;

    public HealthCheckService(LedgerStore ledger, ArrivalDetector detector,
                              PipelineConfig config, StepInvoker invoker) {
        this.ledger = ledger;
        this.detector = detector;
        this.config = config;
        this.invoker = invoker;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkLedger());
        results.add(checkSource());
        results.add(checkStages());
        return results;
    }

    HealthStatus checkLedger() {
        try {
            ledger.checkAvailable();
            return new HealthStatus("ledger", HealthStatus.Status.UP,
                    "Ledger tables readable", Map.of("location", ledger.location()));
        } catch (DriftwatchException e) {
            log.warn("Ledger health check failed: {}", e.getMessage());
            return new HealthStatus("ledger", HealthStatus.Status.DOWN,
                    e.getMessage(), Map.of("location", ledger.location()));
        }
    }

    HealthStatus checkSource() {
        String dir = config.sourceDir().toString();
        try {
            Set<String> files = detector.listDataFiles(config.sourceDir());
            return new HealthStatus("source", HealthStatus.Status.UP,
                    files.size() + " data files present", Map.of("directory", dir));
        } catch (DriftwatchException e) {
            log.warn("Source health check failed: {}", e.getMessage());
            return new HealthStatus("source", HealthStatus.Status.DOWN,
                    e.getMessage(), Map.of("directory", dir));
        }
    }

    HealthStatus checkStages() {
        Map<String, String> handlers = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            StageHandler handler = invoker.handlerFor(stage);
            handlers.put(stage.stageName(), handler.describe());
            if (handler instanceof UnconfiguredStageHandler) {
                missing.add(stage.stageName());
            }
        }
        if (missing.isEmpty()) {
            return new HealthStatus("stages", HealthStatus.Status.UP,
                    "All stages have a handler", handlers);
        }
        return new HealthStatus("stages", HealthStatus.Status.DEGRADED,
                "No command configured for " + missing, handlers);
    }
}
