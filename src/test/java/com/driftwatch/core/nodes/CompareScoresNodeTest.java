package com.driftwatch.core.nodes;

import com.driftwatch.core.error.PreconditionException;
import com.driftwatch.core.error.StoreUnavailableException;
import com.driftwatch.core.events.EventBus;
import com.driftwatch.core.events.PipelineEvent;
import com.driftwatch.core.ledger.LedgerStore;
import com.driftwatch.core.metrics.DriftwatchMetrics;
import com.driftwatch.core.model.FailureKind;
import com.driftwatch.core.model.RunFailure;
import com.driftwatch.core.model.RunStatus;
import com.driftwatch.core.model.ScoreRecord;
import com.driftwatch.core.state.DriftState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CompareScoresNodeTest {

    private static final Instant T0 = Instant.parse("2024-02-01T00:00:00Z");

    private LedgerStore ledger;
    private SimpleMeterRegistry registry;
    private List<PipelineEvent> events;
    private CompareScoresNode node;
    private final DriftState state = new DriftState(Map.of("runId", "DRIFT-1"));

    @BeforeEach
    void setUp() {
        ledger = mock(LedgerStore.class);
        registry = new SimpleMeterRegistry();
        var eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribe(events::add);
        node = new CompareScoresNode(ledger, eventBus, new DriftwatchMetrics(registry));
    }

    private void history(double... scores) {
        List<ScoreRecord> records = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            records.add(new ScoreRecord(T0.plusSeconds(i), scores[i]));
        }
        when(ledger.readScoreHistory()).thenReturn(records);
    }

    @Test
    @DisplayName("a lower current score is drift")
    void drift() {
        history(0.5, 0.9, 0.7);

        var update = node.apply(state);

        assertEquals(true, update.get("proceedToRetrain"));
        assertEquals(RunStatus.RETRAINING.name(), update.get("status"));
        assertEquals(0.9, update.get("previousScore"));
        assertEquals(0.7, update.get("currentScore"));
    }

    @Test
    @DisplayName("an equal score is not drift")
    void equalIsNoDrift() {
        history(0.8, 0.8);

        assertEquals(false, node.apply(state).get("proceedToRetrain"));
    }

    @Test
    @DisplayName("a higher score is not drift")
    void higherIsNoDrift() {
        history(0.8, 0.81);

        assertEquals(false, node.apply(state).get("proceedToRetrain"));
    }

    @Test
    @DisplayName("fewer than two records fails with a precondition error")
    void precondition() {
        history(0.8);

        var update = node.apply(state);

        assertEquals(RunStatus.FAILED.name(), update.get("status"));
        var failure = (RunFailure) update.get("failure");
        assertEquals(FailureKind.PRECONDITION, failure.kind());
        assertEquals(1, ((PreconditionException) failure.cause()).historySize());
        assertFalse(update.containsKey("proceedToRetrain"));
    }

    @Test
    @DisplayName("an empty history fails with a precondition error and publishes no decision")
    void emptyHistory() {
        history();

        var update = node.apply(state);

        assertEquals(RunStatus.FAILED.name(), update.get("status"));
        var failure = (RunFailure) update.get("failure");
        assertEquals(FailureKind.PRECONDITION, failure.kind());
        assertEquals(0, ((PreconditionException) failure.cause()).historySize());
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("an unreadable ledger fails with store unavailable")
    void storeUnavailable() {
        when(ledger.readScoreHistory()).thenThrow(new StoreUnavailableException("db", "locked", null));

        var failure = (RunFailure) node.apply(state).get("failure");

        assertEquals(FailureKind.STORE_UNAVAILABLE, failure.kind());
    }

    @Test
    @DisplayName("publishes the decision and records metrics")
    void observability() {
        history(0.9, 0.7);

        node.apply(state);

        assertEquals(1, events.size());
        assertEquals("drift.evaluated", events.get(0).eventType());
        assertEquals(true, events.get(0).payload().get("drift"));
        var counter = registry.find("driftwatch.drift.decisions").tag("result", "drift").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }
}
