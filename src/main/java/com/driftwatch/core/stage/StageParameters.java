package com.driftwatch.core.stage;

import com.driftwatch.core.config.PipelineConfig;
import com.driftwatch.core.model.PipelineStage;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * Derives each stage's parameter map from the static {@link PipelineConfig}.
 */
@Component
public class StageParameters {

    private final PipelineConfig config;

    public StageParameters(PipelineConfig config) {
        this.config = config;
    }

    /**
     * Standard parameters for a stage. Scoring evaluates the freshly trained
     * model in the model directory.
     */
    public Map<String, String> forStage(PipelineStage stage) {
        String db = path(config.ledgerFile());
        return switch (stage) {
            case INGESTION -> Map.of(
                    StageParams.INPUT_PATH, path(config.sourceDir()),
                    StageParams.OUT_FILE, path(config.mergedDataFile()),
                    StageParams.RECORD_FILE, path(config.ingestedRecordFile()),
                    StageParams.DB_FILE, db);
            case TRAINING -> Map.of(
                    StageParams.DATA_FILE, path(config.mergedDataFile()),
                    StageParams.MODEL_PATH, path(config.modelDir()),
                    StageParams.DB_FILE, db);
            case SCORING -> scoring(config.trainedModelFile(), config.testDataFile());
            case DEPLOYMENT -> Map.of(
                    StageParams.MODEL_PATH, path(config.modelDir()),
                    StageParams.RECORD_FILE, path(config.ingestedRecordFile()),
                    StageParams.DEPLOY_PATH, path(config.productionDir()));
            case REPORTING -> Map.of(
                    StageParams.MODEL_FILE, path(config.deployedModelFile()),
                    StageParams.TEST_DATA_FILE, path(config.testDataFile()),
                    StageParams.DB_FILE, db);
        };
    }

    /**
     * Scoring parameters for the drift check: the production model evaluated
     * on the freshly ingested data.
     */
    public Map<String, String> forDeployedScoring() {
        return scoring(config.deployedModelFile(), config.mergedDataFile());
    }

    private Map<String, String> scoring(Path modelFile, Path dataFile) {
        return Map.of(
                StageParams.MODEL_FILE, path(modelFile),
                StageParams.DATA_TEST_FILE, path(dataFile),
                StageParams.DB_FILE, path(config.ledgerFile()));
    }

    private static String path(Path p) {
        return p.toAbsolutePath().toString();
    }
}
