package com.driftwatch.core.stage;

import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Built-in deployment stage.
 * <p>
 * Recreates the deployment directory and copies the model artifacts plus the
 * ingested-file record into it. Artifacts stay in the model directory.
 */
public class DeploymentStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(DeploymentStageHandler.class);

    private final List<String> artifactExtensions;

    public DeploymentStageHandler(List<String> artifactExtensions) {
        this.artifactExtensions = artifactExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.DEPLOYMENT;
    }

    @Override
    public StepResult run(Map<String, String> params) {
        Path modelDir = Path.of(IngestionStageHandler.require(params, StageParams.MODEL_PATH));
        Path recordFile = Path.of(IngestionStageHandler.require(params, StageParams.RECORD_FILE));
        Path deployDir = Path.of(IngestionStageHandler.require(params, StageParams.DEPLOY_PATH));

        try {
            List<Path> artifacts = listArtifacts(modelDir);
            if (artifacts.isEmpty()) {
                return StepResult.failed(stage(), "no model artifacts " + artifactExtensions + " in " + modelDir, 0);
            }
            if (!Files.isRegularFile(recordFile)) {
                return StepResult.failed(stage(), "ingested-file record missing: " + recordFile, 0);
            }

            recreate(deployDir);
            List<Path> toCopy = new ArrayList<>(artifacts);
            toCopy.add(recordFile);
            for (Path source : toCopy) {
                Path target = deployDir.resolve(source.getFileName().toString());
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
                log.info("Deployed {} -> {}", source, target);
            }
            return StepResult.ok(stage(), 0);
        } catch (IOException e) {
            log.error("Deployment to {} failed", deployDir, e);
            return StepResult.failed(stage(), "cannot deploy to " + deployDir + ": " + e.getMessage(), 0);
        }
    }

    @Override
    public String describe() {
        return "built-in artifact copy " + artifactExtensions;
    }

    private List<Path> listArtifacts(Path modelDir) throws IOException {
        if (!Files.isDirectory(modelDir)) {
            throw new IOException("model directory does not exist: " + modelDir);
        }
        List<Path> artifacts = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(modelDir)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString().toLowerCase(Locale.ROOT);
                if (Files.isRegularFile(entry) && artifactExtensions.stream().anyMatch(name::endsWith)) {
                    artifacts.add(entry);
                }
            }
        }
        artifacts.sort(Comparator.naturalOrder());
        return artifacts;
    }

    private static void recreate(Path dir) throws IOException {
        if (Files.exists(dir)) {
            try (Stream<Path> walk = Files.walk(dir)) {
                for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                    Files.delete(p);
                }
            }
        }
        Files.createDirectories(dir);
    }
}
