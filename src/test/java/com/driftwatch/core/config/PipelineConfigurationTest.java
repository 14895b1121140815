package com.driftwatch.core.config;

import com.driftwatch.core.model.PipelineStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigurationTest {

    private final Path workingDir = Path.of("/srv/pipeline");

    @Test
    @DisplayName("defaults resolve against the working directory")
    void defaults() {
        var config = PipelineConfiguration.resolve(new DriftwatchProperties(), workingDir);

        assertEquals(workingDir.resolve("sourcedata"), config.sourceDir());
        assertEquals(workingDir.resolve("production_deployment/trainedmodel.pkl"), config.deployedModelFile());
        assertEquals(workingDir.resolve("ingesteddata/finaldata.csv"), config.mergedDataFile());
        assertEquals(workingDir.resolve("db/pipeline_data.sqlite"), config.ledgerFile());
        assertEquals(".csv", config.fileExtension());
        assertEquals(List.of(".pkl", ".txt"), config.artifactExtensions());
        assertTrue(config.stageCommands().isEmpty());
        assertTrue(config.initializeSchema());
    }

    @Test
    @DisplayName("base-dir and absolute paths are honoured")
    void baseDir() {
        var props = new DriftwatchProperties();
        props.getPaths().setBaseDir("project");
        props.getPaths().setModelDir("/opt/models");

        var config = PipelineConfiguration.resolve(props, workingDir);

        assertEquals(workingDir.resolve("project/sourcedata"), config.sourceDir());
        assertEquals(Path.of("/opt/models"), config.modelDir());
    }

    @Test
    @DisplayName("extension gets a leading dot and lower case")
    void normalizesExtension() {
        var props = new DriftwatchProperties();
        props.setFileExtension("TSV");

        assertEquals(".tsv", PipelineConfiguration.resolve(props, workingDir).fileExtension());
    }

    @Test
    @DisplayName("stage commands are keyed by stage with their working directory")
    void stageCommands() {
        var props = new DriftwatchProperties();
        var training = new DriftwatchProperties.Stage();
        training.setCommand(List.of("python3", "training.py"));
        training.setWorkingDir("scripts");
        props.getStages().put("training", training);
        props.getStages().put("reporting", new DriftwatchProperties.Stage());

        var config = PipelineConfiguration.resolve(props, workingDir);

        var command = config.commandFor(PipelineStage.TRAINING).orElseThrow();
        assertEquals(List.of("python3", "training.py"), command.command());
        assertEquals(workingDir.resolve("scripts"), command.workingDir());
        assertTrue(config.commandFor(PipelineStage.REPORTING).isEmpty());
    }

    @Test
    @DisplayName("an unknown stage key fails fast")
    void unknownStage() {
        var props = new DriftwatchProperties();
        var stage = new DriftwatchProperties.Stage();
        stage.setCommand(List.of("true"));
        props.getStages().put("serving", stage);

        assertThrows(IllegalStateException.class, () -> PipelineConfiguration.resolve(props, workingDir));
    }

    @Test
    @DisplayName("a blank extension fails fast")
    void blankExtension() {
        var props = new DriftwatchProperties();
        props.setFileExtension(" ");

        assertThrows(IllegalStateException.class, () -> PipelineConfiguration.resolve(props, workingDir));
    }
}
