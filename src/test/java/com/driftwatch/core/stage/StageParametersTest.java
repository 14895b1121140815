package com.driftwatch.core.stage;

import com.driftwatch.core.PipelineFixture;
import com.driftwatch.core.config.PipelineConfig;
import com.driftwatch.core.model.PipelineStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StageParametersTest {

    private final Path base = Path.of("/work");
    private PipelineConfig config;
    private StageParameters parameters;

    @BeforeEach
    void setUp() {
        config = PipelineFixture.config(base);
        parameters = new StageParameters(config);
    }

    @Test
    @DisplayName("each stage receives exactly its documented keys")
    void keysPerStage() {
        assertEquals(Set.of("input_path", "out_file", "record_file", "db_file"),
                parameters.forStage(PipelineStage.INGESTION).keySet());
        assertEquals(Set.of("data_file", "model_path", "db_file"),
                parameters.forStage(PipelineStage.TRAINING).keySet());
        assertEquals(Set.of("model_file", "data_test_file", "db_file"),
                parameters.forStage(PipelineStage.SCORING).keySet());
        assertEquals(Set.of("model_path", "record_file", "deploy_path"),
                parameters.forStage(PipelineStage.DEPLOYMENT).keySet());
        assertEquals(Set.of("model_file", "test_data_file", "db_file"),
                parameters.forStage(PipelineStage.REPORTING).keySet());
    }

    @Test
    @DisplayName("standard scoring evaluates the freshly trained model")
    void scoringUsesTrainedModel() {
        assertEquals("/work/models/trainedmodel.pkl",
                parameters.forStage(PipelineStage.SCORING).get(StageParams.MODEL_FILE));
        assertEquals("/work/testdata/testdata.csv",
                parameters.forStage(PipelineStage.SCORING).get(StageParams.DATA_TEST_FILE));
    }

    @Test
    @DisplayName("deployed scoring evaluates the production model on the ingested data")
    void deployedScoring() {
        var params = parameters.forDeployedScoring();

        assertEquals("/work/production_deployment/trainedmodel.pkl", params.get(StageParams.MODEL_FILE));
        assertEquals("/work/ingesteddata/finaldata.csv", params.get(StageParams.DATA_TEST_FILE));
        assertEquals("/work/db/pipeline_data.sqlite", params.get(StageParams.DB_FILE));
    }

    @Test
    @DisplayName("ingestion and deployment share the ingested-file record")
    void sharedRecordFile() {
        assertEquals(parameters.forStage(PipelineStage.INGESTION).get(StageParams.RECORD_FILE),
                parameters.forStage(PipelineStage.DEPLOYMENT).get(StageParams.RECORD_FILE));
        assertEquals("/work/ingesteddata/ingestedfiles.txt",
                parameters.forStage(PipelineStage.DEPLOYMENT).get(StageParams.RECORD_FILE));
    }
}
