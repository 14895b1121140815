package com.driftwatch.core.stage;

import com.driftwatch.core.arrival.ArrivalDetector;
import com.driftwatch.core.config.PipelineConfig;
import com.driftwatch.core.events.EventBus;
import com.driftwatch.core.ledger.LedgerStore;
import com.driftwatch.core.metrics.DriftwatchMetrics;
import com.driftwatch.core.model.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires one handler per stage. A configured command always wins; otherwise
 * ingestion and deployment fall back to their built-in implementations.
 */
@Configuration
public class StageHandlerConfig {

    private static final Logger log = LoggerFactory.getLogger(StageHandlerConfig.class);

    @Bean
    public StepInvoker stepInvoker(PipelineConfig config, LedgerStore ledger, ArrivalDetector detector,
                                   EventBus eventBus, DriftwatchMetrics metrics) {
        return new StepInvoker(handlersFor(config, ledger, detector), eventBus, metrics);
    }

    static List<StageHandler> handlersFor(PipelineConfig config, LedgerStore ledger, ArrivalDetector detector) {
        List<StageHandler> handlers = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            StageHandler handler = config.commandFor(stage)
                    .<StageHandler>map(cmd -> new ExternalCommandStageHandler(stage, cmd))
                    .orElseGet(() -> switch (stage) {
                        case INGESTION -> new IngestionStageHandler(ledger, detector);
                        case DEPLOYMENT -> new DeploymentStageHandler(config.artifactExtensions());
                        default -> new UnconfiguredStageHandler(stage);
                    });
            log.debug("Stage {} -> {}", stage.stageName(), handler.describe());
            handlers.add(handler);
        }
        return handlers;
    }
}
