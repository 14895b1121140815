package com.driftwatch.core.state;

import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.model.RunFailure;
import com.driftwatch.core.model.RunStatus;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * Graph state for one drift-controller run.
 * <p>
 * Scores and the failure are optional channels: a node only writes them once
 * known. {@code stagesRun} is an appender so every node adds the stages it
 * invoked without replacing earlier entries.
 */
public class DriftState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("runId",            Channels.base(() -> "")),
        Map.entry("status",           Channels.base(() -> RunStatus.START.name())),
        Map.entry("hasNewData",       Channels.base(() -> false)),
        Map.entry("proceedToRetrain", Channels.base(() -> false)),
        Map.entry("newFiles",         Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("previousScore",    Channels.base((Reducer<Double>) null)),
        Map.entry("currentScore",     Channels.base((Reducer<Double>) null)),
        Map.entry("failure",          Channels.base((Reducer<RunFailure>) null)),
        Map.entry("stagesRun",        Channels.appender(ArrayList::new))
    );

    public DriftState(Map<String, Object> initData) {
        super(initData);
    }

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public RunStatus status() {
        String raw = this.<String>value("status").orElse(RunStatus.START.name());
        return RunStatus.valueOf(raw);
    }

    public boolean hasNewData() {
        return this.<Boolean>value("hasNewData").orElse(false);
    }

    public boolean proceedToRetrain() {
        return this.<Boolean>value("proceedToRetrain").orElse(false);
    }

    public List<String> newFiles() {
        return this.<List<String>>value("newFiles").orElse(List.of());
    }

    public OptionalDouble previousScore() {
        return score("previousScore");
    }

    public OptionalDouble currentScore() {
        return score("currentScore");
    }

    public Optional<RunFailure> failure() {
        return value("failure");
    }

    public boolean failed() {
        return status() == RunStatus.FAILED;
    }

    /**
     * Stages invoked so far, in invocation order.
     */
    public List<PipelineStage> stagesRun() {
        List<String> names = this.<List<String>>value("stagesRun").orElse(List.of());
        return names.stream().map(PipelineStage::fromName).toList();
    }

    private OptionalDouble score(String key) {
        return this.<Number>value(key)
                .map(n -> OptionalDouble.of(n.doubleValue()))
                .orElse(OptionalDouble.empty());
    }
}
