package com.driftwatch.core.config;

import com.driftwatch.core.model.PipelineStage;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolved, immutable pipeline configuration. Every path is absolute.
 * Built once at startup and handed to each component that needs a location.
 *
 * @param sourceDir          directory watched for new data files
 * @param ingestedDir        where ingestion writes the merged dataset and its file record
 * @param modelDir           where training writes model artifacts
 * @param productionDir      production deployment directory
 * @param testDataDir        directory holding {@code testdata.csv}
 * @param ledgerFile         SQLite file with the ledger tables
 * @param fileExtension      extension of tabular data files, including the dot
 * @param initializeSchema   create missing ledger tables on first ledger access
 * @param artifactExtensions extensions of model artifacts copied on deployment
 * @param stageCommands      external command per stage, when configured
 */
public record PipelineConfig(
    Path sourceDir,
    Path ingestedDir,
    Path modelDir,
    Path productionDir,
    Path testDataDir,
    Path ledgerFile,
    String fileExtension,
    boolean initializeSchema,
    List<String> artifactExtensions,
    Map<PipelineStage, StageCommand> stageCommands
) {
    public static final String MERGED_DATA_FILE = "finaldata.csv";
    public static final String INGESTED_RECORD_FILE = "ingestedfiles.txt";
    public static final String MODEL_FILE = "trainedmodel.pkl";
    public static final String TEST_DATA_FILE = "testdata.csv";

    public PipelineConfig {
        artifactExtensions = List.copyOf(artifactExtensions);
        stageCommands = Map.copyOf(stageCommands);
    }

    public Path mergedDataFile() {
        return ingestedDir.resolve(MERGED_DATA_FILE);
    }

    public Path ingestedRecordFile() {
        return ingestedDir.resolve(INGESTED_RECORD_FILE);
    }

    public Path trainedModelFile() {
        return modelDir.resolve(MODEL_FILE);
    }

    public Path deployedModelFile() {
        return productionDir.resolve(MODEL_FILE);
    }

    public Path testDataFile() {
        return testDataDir.resolve(TEST_DATA_FILE);
    }

    public Optional<StageCommand> commandFor(PipelineStage stage) {
        return Optional.ofNullable(stageCommands.get(stage));
    }

    /**
     * External command line for a stage.
     *
     * @param command    executable and leading arguments
     * @param workingDir directory the process starts in
     */
    public record StageCommand(List<String> command, Path workingDir) {
        public StageCommand {
            command = List.copyOf(command);
            if (command.isEmpty()) {
                throw new IllegalArgumentException("Stage command must not be empty");
            }
        }
    }
}
