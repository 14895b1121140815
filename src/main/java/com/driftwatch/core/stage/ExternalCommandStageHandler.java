package com.driftwatch.core.stage;

import com.driftwatch.core.config.PipelineConfig.StageCommand;
import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs a stage as an external process.
 * <p>
 * Parameters are appended to the configured command line as
 * {@code --<key> <value>} pairs in key order. Output (stdout and stderr merged)
 * is logged line by line and the tail is kept as the failure diagnostic.
 * Exit code 0 is success. There is no timeout.
 */
public class ExternalCommandStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(ExternalCommandStageHandler.class);

    static final int TAIL_LINES = 20;
    static final int MAX_DIAGNOSTIC_CHARS = 4000;

    private final PipelineStage stage;
    private final StageCommand command;

    public ExternalCommandStageHandler(PipelineStage stage, StageCommand command) {
        this.stage = stage;
        this.command = command;
    }

    @Override
    public PipelineStage stage() {
        return stage;
    }

    @Override
    public StepResult run(Map<String, String> params) {
        List<String> commandLine = buildCommandLine(params);
        log.info("Running {} command: {}", stage.stageName(), commandLine);

        Process process;
        try {
            var builder = new ProcessBuilder(commandLine).redirectErrorStream(true);
            if (command.workingDir() != null) {
                builder.directory(command.workingDir().toFile());
            }
            process = builder.start();
        } catch (IOException e) {
            log.error("Cannot start {} command {}", stage.stageName(), commandLine, e);
            return StepResult.failed(stage, "cannot start command: " + e.getMessage(), 0);
        }
        return await(process);
    }

    /**
     * Drains the merged output and waits for exit. The process is destroyed
     * if its output cannot be read or the wait is interrupted.
     */
    StepResult await(Process process) {
        Deque<String> tail = new ArrayDeque<>();
        try {
            // Consume output so the child never blocks on a full pipe
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.info("[{}] {}", stage.stageName(), line);
                    tail.addLast(line);
                    if (tail.size() > TAIL_LINES) {
                        tail.removeFirst();
                    }
                }
            }

            int exitCode = process.waitFor();
            if (exitCode == 0) {
                return StepResult.ok(stage, 0);
            }
            return StepResult.failed(stage,
                    "exit code " + exitCode + truncateOutput(String.join("\n", tail)), 0);
        } catch (IOException e) {
            log.error("Lost output of {} command, destroying it", stage.stageName(), e);
            process.destroy();
            return StepResult.failed(stage, "cannot read command output: " + e.getMessage(), 0);
        } catch (InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            return StepResult.failed(stage, "interrupted while waiting for command", 0);
        }
    }

    @Override
    public String describe() {
        return String.join(" ", command.command());
    }

    List<String> buildCommandLine(Map<String, String> params) {
        List<String> line = new ArrayList<>(command.command());
        new TreeMap<>(params).forEach((key, value) -> {
            line.add("--" + key);
            line.add(value);
        });
        return line;
    }

    /**
     * Keeps the last {@value #MAX_DIAGNOSTIC_CHARS} characters of the output tail.
     */
    static String truncateOutput(String output) {
        if (output == null || output.isBlank()) return "";
        if (output.length() <= MAX_DIAGNOSTIC_CHARS) return ": " + output;
        return ": ... [truncated " + (output.length() - MAX_DIAGNOSTIC_CHARS) + " chars] ...\n"
                + output.substring(output.length() - MAX_DIAGNOSTIC_CHARS);
    }
}
