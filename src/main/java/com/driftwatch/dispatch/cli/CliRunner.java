package com.driftwatch.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final List<String> PROPERTY_PREFIXES = List.of("driftwatch.", "spring.", "logging.");

    private final DriftwatchCommand driftwatchCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(DriftwatchCommand driftwatchCommand, IFactory factory) {
        this.driftwatchCommand = driftwatchCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(driftwatchCommand, factory).execute(commandArgs(args));
    }

    /**
     * Drops Spring property overrides such as {@code --driftwatch.file-extension=.tsv};
     * Spring Boot has already applied them to the environment.
     */
    static String[] commandArgs(String... args) {
        return Arrays.stream(args)
                .filter(arg -> !isPropertyOverride(arg))
                .toArray(String[]::new);
    }

    private static boolean isPropertyOverride(String arg) {
        return arg.startsWith("--") && arg.contains("=")
                && PROPERTY_PREFIXES.stream().anyMatch(prefix -> arg.startsWith("--" + prefix));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
