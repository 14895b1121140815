package com.driftwatch.core.config;

import com.driftwatch.core.model.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns {@link DriftwatchProperties} into the {@link PipelineConfig} bean.
 * Relative paths resolve against {@code driftwatch.paths.base-dir}, or the
 * process working directory when that is blank.
 */
@Configuration
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    public PipelineConfig pipelineConfig(DriftwatchProperties properties) {
        PipelineConfig config = resolve(properties, Path.of(System.getProperty("user.dir")));
        log.info("Pipeline configured: source={}, models={}, production={}, ledger={}",
                config.sourceDir(), config.modelDir(), config.productionDir(), config.ledgerFile());
        return config;
    }

    /**
     * Resolves raw properties against a fallback working directory.
     *
     * @throws IllegalStateException if a stage key is unknown or the extension is blank
     */
    public static PipelineConfig resolve(DriftwatchProperties properties, Path workingDir) {
        var paths = properties.getPaths();
        Path base = paths.getBaseDir() == null || paths.getBaseDir().isBlank()
                ? workingDir.toAbsolutePath()
                : workingDir.toAbsolutePath().resolve(paths.getBaseDir());
        base = base.normalize();

        String extension = properties.getFileExtension();
        if (extension == null || extension.isBlank()) {
            throw new IllegalStateException("driftwatch.file-extension must not be blank");
        }
        extension = extension.startsWith(".") ? extension : "." + extension;

        Map<PipelineStage, PipelineConfig.StageCommand> commands = new EnumMap<>(PipelineStage.class);
        for (var entry : properties.getStages().entrySet()) {
            PipelineStage stage;
            try {
                stage = PipelineStage.fromName(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid key driftwatch.stages." + entry.getKey(), e);
            }
            var stageProps = entry.getValue();
            if (stageProps.getCommand() == null || stageProps.getCommand().isEmpty()) {
                continue;
            }
            Path stageDir = stageProps.getWorkingDir() == null || stageProps.getWorkingDir().isBlank()
                    ? base
                    : base.resolve(stageProps.getWorkingDir()).normalize();
            commands.put(stage, new PipelineConfig.StageCommand(stageProps.getCommand(), stageDir));
        }

        return new PipelineConfig(
                resolvePath(base, paths.getSourceDir()),
                resolvePath(base, paths.getIngestedDir()),
                resolvePath(base, paths.getModelDir()),
                resolvePath(base, paths.getProductionDir()),
                resolvePath(base, paths.getTestDataDir()),
                resolvePath(base, paths.getLedgerFile()),
                extension.toLowerCase(Locale.ROOT),
                properties.getLedger().isInitializeSchema(),
                properties.getDeployment().getArtifactExtensions(),
                commands
        );
    }

    private static Path resolvePath(Path base, String value) {
        return base.resolve(value).normalize();
    }
}
