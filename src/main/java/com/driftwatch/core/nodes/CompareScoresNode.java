package com.driftwatch.core.nodes;

import com.driftwatch.core.error.DriftwatchException;
import com.driftwatch.core.error.PreconditionException;
import com.driftwatch.core.events.EventBus;
import com.driftwatch.core.events.PipelineEvent;
import com.driftwatch.core.ledger.LedgerStore;
import com.driftwatch.core.metrics.DriftwatchMetrics;
import com.driftwatch.core.model.RunStatus;
import com.driftwatch.core.model.ScoreRecord;
import com.driftwatch.core.state.DriftState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Decides whether the model has drifted.
 * <p>
 * Compares the two most recent scores of the history. Drift means the newest
 * score is strictly lower than the one before it; an equal score is not drift.
 */
@Component
public class CompareScoresNode {

    private static final Logger log = LoggerFactory.getLogger(CompareScoresNode.class);

    private final LedgerStore ledger;
    private final EventBus eventBus;
    private final DriftwatchMetrics metrics;

    public CompareScoresNode(LedgerStore ledger, EventBus eventBus, DriftwatchMetrics metrics) {
        this.ledger = ledger;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(DriftState state) {
        List<ScoreRecord> history;
        try {
            history = ledger.readScoreHistory();
            if (history.size() < 2) {
                throw new PreconditionException(history.size());
            }
        } catch (DriftwatchException e) {
            log.error("Score comparison aborted: {}", e.getMessage());
            return NodeResults.failed(e);
        }

        double previous = history.get(history.size() - 2).score();
        double current = history.get(history.size() - 1).score();
        boolean drift = isDrift(previous, current);

        metrics.recordScore(current);
        metrics.recordDriftDecision(drift);
        eventBus.publish(PipelineEvent.of("drift.evaluated", state.runId(), null,
                Map.of("previous", previous, "current", current, "drift", drift)));
        log.info("Score comparison: previous={} current={} -> {}", previous, current, drift ? "drift" : "no drift");

        return Map.of(
                "status", drift ? RunStatus.RETRAINING.name() : RunStatus.COMPARING.name(),
                "previousScore", previous,
                "currentScore", current,
                "proceedToRetrain", drift);
    }

    static boolean isDrift(double previous, double current) {
        return current < previous;
    }
}
