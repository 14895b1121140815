package com.driftwatch.core.engine;

import com.driftwatch.core.PipelineFixture;
import com.driftwatch.core.error.StepFailureException;
import com.driftwatch.core.events.EventBus;
import com.driftwatch.core.metrics.DriftwatchMetrics;
import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.model.StepResult;
import com.driftwatch.core.stage.RecordingStageHandler;
import com.driftwatch.core.stage.RecordingStageHandler.Call;
import com.driftwatch.core.stage.StageHandler;
import com.driftwatch.core.stage.StageParameters;
import com.driftwatch.core.stage.StepInvoker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.driftwatch.core.model.PipelineStage.*;
import static com.driftwatch.core.stage.RecordingStageHandler.stages;
import static org.junit.jupiter.api.Assertions.*;

class PipelineRunnerTest {

    private List<Call> calls;
    private EventBus eventBus;
    private StageParameters parameters;

    @BeforeEach
    void setUp() {
        calls = new ArrayList<>();
        eventBus = new EventBus();
        parameters = new StageParameters(PipelineFixture.config(Path.of("/w")));
    }

    private PipelineRunner runner(List<StageHandler> handlers) {
        var invoker = new StepInvoker(handlers, eventBus, new DriftwatchMetrics(new SimpleMeterRegistry()));
        return new PipelineRunner(invoker, parameters, eventBus);
    }

    @Nested
    @DisplayName("parse")
    class ParseTests {

        @Test
        @DisplayName("'all' selects every stage")
        void all() {
            assertEquals(EnumSet.allOf(PipelineStage.class), PipelineRunner.parse("all"));
            assertEquals(EnumSet.allOf(PipelineStage.class), PipelineRunner.parse(" ALL "));
        }

        @Test
        @DisplayName("a comma list selects the named stages")
        void list() {
            assertEquals(Set.of(INGESTION, SCORING), PipelineRunner.parse("scoring, ingestion"));
        }

        @Test
        @DisplayName("an unknown or empty list is rejected")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> PipelineRunner.parse("scoring,serving"));
            assertThrows(IllegalArgumentException.class, () -> PipelineRunner.parse(" , "));
            assertThrows(IllegalArgumentException.class, () -> PipelineRunner.parse(""));
        }
    }

    @Test
    @DisplayName("runs the requested stages in pipeline order")
    void fixedOrder() {
        var ran = runner(RecordingStageHandler.allSucceeding(calls))
                .run(List.of(REPORTING, INGESTION, SCORING));

        assertEquals(List.of(INGESTION, SCORING, REPORTING), ran);
        assertEquals(List.of(INGESTION, SCORING, REPORTING), stages(calls));
    }

    @Test
    @DisplayName("standard scoring parameters point at the model directory")
    void scoringParameters() {
        runner(RecordingStageHandler.allSucceeding(calls)).run(List.of(SCORING));

        assertEquals("/w/models/trainedmodel.pkl", calls.get(0).params().get("model_file"));
    }

    @Test
    @DisplayName("stops at the first failing stage")
    void stopsOnFailure() {
        List<StageHandler> handlers = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            handlers.add(stage == TRAINING
                    ? new RecordingStageHandler(TRAINING, calls, p -> StepResult.failed(TRAINING, "oom", 0))
                    : RecordingStageHandler.succeeding(stage, calls));
        }

        var ex = assertThrows(StepFailureException.class,
                () -> runner(handlers).run(EnumSet.allOf(PipelineStage.class)));

        assertEquals(TRAINING, ex.stage());
        assertEquals("oom", ex.diagnostic());
        assertEquals(List.of(INGESTION, TRAINING), stages(calls));
    }

    @Test
    @DisplayName("an empty selection runs nothing")
    void emptySelection() {
        assertTrue(runner(RecordingStageHandler.allSucceeding(calls)).run(List.of()).isEmpty());
        assertTrue(calls.isEmpty());
    }
}
