package com.driftwatch.core.health;

import com.driftwatch.core.PipelineFixture;
import com.driftwatch.core.arrival.ArrivalDetector;
import com.driftwatch.core.config.PipelineConfig;
import com.driftwatch.core.config.PipelineConfig.StageCommand;
import com.driftwatch.core.events.EventBus;
import com.driftwatch.core.ledger.LedgerStore;
import com.driftwatch.core.metrics.DriftwatchMetrics;
import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.stage.ExternalCommandStageHandler;
import com.driftwatch.core.stage.StageHandler;
import com.driftwatch.core.stage.StepInvoker;
import com.driftwatch.core.stage.UnconfiguredStageHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckServiceTest {

    @TempDir
    Path base;

    private PipelineConfig config;
    private LedgerStore ledger;
    private ArrivalDetector detector;

    @BeforeEach
    void setUp() throws Exception {
        config = PipelineFixture.config(base);
        Files.createDirectories(config.sourceDir());
        ledger = PipelineFixture.ledger(config);
        detector = new ArrivalDetector(config);
    }

    private StepInvoker invoker(boolean allConfigured) {
        List<StageHandler> handlers = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            handlers.add(allConfigured || stage != PipelineStage.REPORTING
                    ? new ExternalCommandStageHandler(stage, new StageCommand(List.of("true"), base))
                    : new UnconfiguredStageHandler(stage));
        }
        return new StepInvoker(handlers, new EventBus(), new DriftwatchMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("all components UP when ledger, source and stages are ready")
    void allUp() {
        var service = new HealthCheckService(ledger, detector, config, invoker(true));

        var checks = service.checkAll();

        assertEquals(List.of("ledger", "source", "stages"), checks.stream().map(HealthStatus::component).toList());
        assertTrue(checks.stream().allMatch(HealthStatus::isUp));
    }

    @Test
    @DisplayName("an unconfigured stage degrades the stages component")
    void unconfiguredStage() {
        var service = new HealthCheckService(ledger, detector, config, invoker(false));

        var stages = service.checkStages();

        assertEquals(HealthStatus.Status.DEGRADED, stages.status());
        assertTrue(stages.detail().contains("reporting"));
        assertEquals("not configured", stages.metadata().get("reporting"));
    }

    @Test
    @DisplayName("a missing source directory is DOWN")
    void sourceDown() throws Exception {
        Files.delete(config.sourceDir());
        var service = new HealthCheckService(ledger, detector, config, invoker(true));

        assertEquals(HealthStatus.Status.DOWN, service.checkSource().status());
    }

    @Test
    @DisplayName("a ledger without tables is DOWN")
    void ledgerDown() {
        var bare = PipelineFixture.uninitializedLedger(PipelineFixture.config(base.resolve("bare")));
        var service = new HealthCheckService(bare, detector, config, invoker(true));

        var status = service.checkLedger();

        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertEquals(bare.location(), status.metadata().get("location"));
    }
}
