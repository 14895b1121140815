package com.driftwatch.core.stage;

import com.driftwatch.core.PipelineFixture;
import com.driftwatch.core.arrival.ArrivalDetector;
import com.driftwatch.core.config.PipelineConfig;
import com.driftwatch.core.config.PipelineConfig.StageCommand;
import com.driftwatch.core.ledger.LedgerStore;
import com.driftwatch.core.model.PipelineStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class StageHandlerConfigTest {

    private final LedgerStore ledger = mock(LedgerStore.class);
    private final ArrivalDetector detector = new ArrivalDetector(".csv");

    private static PipelineConfig withCommands(PipelineConfig c, Map<PipelineStage, StageCommand> commands) {
        return new PipelineConfig(c.sourceDir(), c.ingestedDir(), c.modelDir(), c.productionDir(),
                c.testDataDir(), c.ledgerFile(), c.fileExtension(), c.initializeSchema(),
                c.artifactExtensions(), commands);
    }

    @Test
    @DisplayName("without commands ingestion and deployment are built in and the rest unconfigured")
    void defaults() {
        var handlers = StageHandlerConfig.handlersFor(PipelineFixture.config(Path.of("/w")), ledger, detector);

        assertEquals(5, handlers.size());
        assertInstanceOf(IngestionStageHandler.class, handlers.get(0));
        assertInstanceOf(UnconfiguredStageHandler.class, handlers.get(1));
        assertInstanceOf(UnconfiguredStageHandler.class, handlers.get(2));
        assertInstanceOf(DeploymentStageHandler.class, handlers.get(3));
        assertInstanceOf(UnconfiguredStageHandler.class, handlers.get(4));
        assertFalse(handlers.get(1).run(Map.of()).success());
    }

    @Test
    @DisplayName("a configured command replaces the built-in handler")
    void commandWins() {
        var command = new StageCommand(List.of("python3", "ingest.py"), Path.of("/w"));
        var config = withCommands(PipelineFixture.config(Path.of("/w")),
                Map.of(PipelineStage.INGESTION, command, PipelineStage.TRAINING, command));

        var handlers = StageHandlerConfig.handlersFor(config, ledger, detector);

        assertInstanceOf(ExternalCommandStageHandler.class, handlers.get(0));
        assertInstanceOf(ExternalCommandStageHandler.class, handlers.get(1));
        assertEquals(PipelineStage.TRAINING, handlers.get(1).stage());
    }
}
