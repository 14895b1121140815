package com.driftwatch.dispatch.cli;

import com.driftwatch.core.engine.DriftController;
import com.driftwatch.core.error.DriftwatchException;
import com.driftwatch.core.events.EventBus;
import com.driftwatch.core.model.RunOutcome;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Top-level CLI command for Driftwatch.
 * <p>
 * Without a subcommand it runs the drift controller once. Exit code 0 means
 * a clean terminal state; typed failures map to their own exit codes.
 */
@Command(
        name = "driftwatch",
        mixinStandardHelpOptions = true,
        version = "Driftwatch 0.1.0",
        description = "Detects model drift on new data and retrains when needed",
        subcommands = {
                PipelineCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DriftwatchCommand implements Callable<Integer> {

    private final DriftController controller;
    private final EventBus eventBus;

    public DriftwatchCommand(DriftController controller, EventBus eventBus) {
        this.controller = controller;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var subscription = eventBus.subscribe(ConsoleOutput::event);
        try {
            RunOutcome outcome = controller.runOnce();
            ConsoleOutput.outcome(outcome);
            switch (outcome.status()) {
                case NO_NEW_DATA -> ConsoleOutput.success("No new data, nothing to do");
                case NO_DRIFT -> ConsoleOutput.success("No drift detected, deployed model kept");
                default -> ConsoleOutput.success("Drift detected, model retrained and redeployed");
            }
            return CommandLine.ExitCode.OK;
        } catch (DriftwatchException e) {
            return FailureReporter.report(e);
        } finally {
            subscription.unsubscribe();
        }
    }
}
