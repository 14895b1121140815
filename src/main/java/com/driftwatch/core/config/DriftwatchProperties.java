package com.driftwatch.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw configuration bound from {@code driftwatch.*}. Only read once, by
 * {@link PipelineConfiguration}, which resolves it into a {@link PipelineConfig}.
 */
@Component
@ConfigurationProperties(prefix = "driftwatch")
public class DriftwatchProperties {

    private Paths paths = new Paths();
    private String fileExtension = ".csv";
    private Ledger ledger = new Ledger();
    private Deployment deployment = new Deployment();
    private Map<String, Stage> stages = new LinkedHashMap<>();

    public Paths getPaths() { return paths; }
    public void setPaths(Paths paths) { this.paths = paths; }
    public String getFileExtension() { return fileExtension; }
    public void setFileExtension(String fileExtension) { this.fileExtension = fileExtension; }
    public Ledger getLedger() { return ledger; }
    public void setLedger(Ledger ledger) { this.ledger = ledger; }
    public Deployment getDeployment() { return deployment; }
    public void setDeployment(Deployment deployment) { this.deployment = deployment; }
    public Map<String, Stage> getStages() { return stages; }
    public void setStages(Map<String, Stage> stages) { this.stages = stages; }

    public static class Paths {
        private String baseDir = "";
        private String sourceDir = "sourcedata";
        private String ingestedDir = "ingesteddata";
        private String modelDir = "models";
        private String productionDir = "production_deployment";
        private String testDataDir = "testdata";
        private String ledgerFile = "db/pipeline_data.sqlite";

        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
        public String getSourceDir() { return sourceDir; }
        public void setSourceDir(String sourceDir) { this.sourceDir = sourceDir; }
        public String getIngestedDir() { return ingestedDir; }
        public void setIngestedDir(String ingestedDir) { this.ingestedDir = ingestedDir; }
        public String getModelDir() { return modelDir; }
        public void setModelDir(String modelDir) { this.modelDir = modelDir; }
        public String getProductionDir() { return productionDir; }
        public void setProductionDir(String productionDir) { this.productionDir = productionDir; }
        public String getTestDataDir() { return testDataDir; }
        public void setTestDataDir(String testDataDir) { this.testDataDir = testDataDir; }
        public String getLedgerFile() { return ledgerFile; }
        public void setLedgerFile(String ledgerFile) { this.ledgerFile = ledgerFile; }
    }

    public static class Ledger {
        private boolean initializeSchema = true;

        public boolean isInitializeSchema() { return initializeSchema; }
        public void setInitializeSchema(boolean initializeSchema) { this.initializeSchema = initializeSchema; }
    }

    public static class Deployment {
        private List<String> artifactExtensions = new ArrayList<>(List.of(".pkl", ".txt"));

        public List<String> getArtifactExtensions() { return artifactExtensions; }
        public void setArtifactExtensions(List<String> artifactExtensions) { this.artifactExtensions = artifactExtensions; }
    }

    /**
     * External command for one stage. An empty command keeps the built-in handler
     * (ingestion, deployment) or leaves the stage unconfigured.
     */
    public static class Stage {
        private List<String> command = new ArrayList<>();
        private String workingDir = "";

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getWorkingDir() { return workingDir; }
        public void setWorkingDir(String workingDir) { this.workingDir = workingDir; }
    }
}
