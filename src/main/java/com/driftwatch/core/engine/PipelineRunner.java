package com.driftwatch.core.engine;

import com.driftwatch.core.error.StepFailureException;
import com.driftwatch.core.events.EventBus;
import com.driftwatch.core.events.PipelineEvent;
import com.driftwatch.core.logging.MdcContext;
import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.model.StepResult;
import com.driftwatch.core.stage.StageParameters;
import com.driftwatch.core.stage.StepInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runs a chosen subset of stages in the fixed pipeline order, independent of
 * any drift decision. Used to bootstrap the ledgers and to re-trigger the
 * remainder of an aborted run.
 */
@Service
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    public static final String ALL = "all";

    private final StepInvoker invoker;
    private final StageParameters parameters;
    private final EventBus eventBus;

    public PipelineRunner(StepInvoker invoker, StageParameters parameters, EventBus eventBus) {
        this.invoker = invoker;
        this.parameters = parameters;
        this.eventBus = eventBus;
    }

    /**
     * Parses {@code "all"} or a comma-separated list of stage names.
     *
     * @throws IllegalArgumentException on an empty list or an unknown stage name
     */
    public static Set<PipelineStage> parse(String steps) {
        if (steps == null || steps.isBlank()) {
            throw new IllegalArgumentException("No steps given. Use 'all' or a comma-separated list of stages.");
        }
        if (ALL.equals(steps.trim().toLowerCase(Locale.ROOT))) {
            return EnumSet.allOf(PipelineStage.class);
        }
        Set<PipelineStage> stages = EnumSet.noneOf(PipelineStage.class);
        for (String part : steps.split(",")) {
            if (!part.isBlank()) {
                stages.add(PipelineStage.fromName(part));
            }
        }
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("No steps given. Use 'all' or a comma-separated list of stages.");
        }
        return stages;
    }

    /**
     * Runs the given stages in pipeline order and stops at the first failure.
     *
     * @return the stages that ran, in order
     * @throws StepFailureException when a stage fails
     */
    public List<PipelineStage> run(Collection<PipelineStage> stages) {
        Set<PipelineStage> ordered = stages.isEmpty()
                ? EnumSet.noneOf(PipelineStage.class)
                : EnumSet.copyOf(stages);
        String runId = RunIds.next();
        MdcContext.setRun(runId);
        try {
            log.info("Pipeline run {} with stages {}", runId, ordered);
            eventBus.publish(PipelineEvent.of("run.started", runId, null,
                    Map.of("stages", ordered.stream().map(PipelineStage::stageName).toList())));
            List<PipelineStage> ran = new ArrayList<>();
            for (PipelineStage stage : ordered) {
                StepResult result = invoker.runStep(runId, stage, parameters.forStage(stage));
                ran.add(stage);
                if (!result.success()) {
                    throw StepFailureException.from(result);
                }
            }
            eventBus.publish(PipelineEvent.of("run.completed", runId, null,
                    Map.of("stages", ran.stream().map(PipelineStage::stageName).toList())));
            return ran;
        } finally {
            MdcContext.clear();
        }
    }
}
