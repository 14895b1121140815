package com.driftwatch.dispatch.cli;

import com.driftwatch.core.engine.PipelineRunner;
import com.driftwatch.core.error.DriftwatchException;
import com.driftwatch.core.events.EventBus;
import com.driftwatch.core.model.PipelineStage;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: driftwatch pipeline --steps &lt;all|list&gt;
 * <p>
 * Runs stages unconditionally in pipeline order. Used for the first run and
 * to resume after a failed controller run.
 */
@Command(name = "pipeline", mixinStandardHelpOptions = true,
        description = "Run pipeline stages without a drift decision")
@Component
public class PipelineCommand implements Callable<Integer> {

    @Option(names = {"--steps", "-s"}, defaultValue = PipelineRunner.ALL,
            description = "'all' or a comma-separated list of: ingestion, training, scoring, deployment, reporting")
    private String steps;

    private final PipelineRunner runner;
    private final EventBus eventBus;

    public PipelineCommand(PipelineRunner runner, EventBus eventBus) {
        this.runner = runner;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Set<PipelineStage> stages;
        try {
            stages = PipelineRunner.parse(steps);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }

        var subscription = eventBus.subscribe(ConsoleOutput::event);
        try {
            List<PipelineStage> ran = runner.run(stages);
            ConsoleOutput.success("Pipeline finished: " + ran);
            return CommandLine.ExitCode.OK;
        } catch (DriftwatchException e) {
            return FailureReporter.report(e);
        } finally {
            subscription.unsubscribe();
        }
    }
}
