package com.driftwatch.core.ledger;

import com.driftwatch.core.config.DriftwatchProperties;
import com.driftwatch.core.config.PipelineConfiguration;
import com.driftwatch.core.error.StoreUnavailableException;
import com.driftwatch.core.model.ScoreRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LedgerConfigTest {

    @TempDir
    Path base;

    @Test
    @DisplayName("creating the bean leaves the ledger file and its directory untouched")
    void noSideEffectsAtStartup() {
        var config = PipelineConfiguration.resolve(new DriftwatchProperties(), base);

        new LedgerConfig().ledgerStore(config);

        assertFalse(Files.exists(config.ledgerFile().getParent()));
    }

    @Test
    @DisplayName("the first ledger call creates the directory and both tables")
    void initializesOnFirstCall() {
        var config = PipelineConfiguration.resolve(new DriftwatchProperties(), base);
        LedgerStore store = new LedgerConfig().ledgerStore(config);

        assertTrue(store.readScoreHistory().isEmpty());
        assertTrue(Files.exists(config.ledgerFile()));

        store.appendScore(new ScoreRecord(Instant.parse("2024-01-01T00:00:00Z"), 0.8));
        assertTrue(store.readIngestedFiles().isEmpty());
        assertEquals(1, store.readScoreHistory().size());
    }

    @Test
    @DisplayName("with initialization disabled a fresh ledger has no tables")
    void initializationDisabled() throws Exception {
        var properties = new DriftwatchProperties();
        properties.getLedger().setInitializeSchema(false);
        var config = PipelineConfiguration.resolve(properties, base);
        Files.createDirectories(config.ledgerFile().getParent());

        LedgerStore store = new LedgerConfig().ledgerStore(config);

        assertThrows(StoreUnavailableException.class, store::readScoreHistory);
    }
}
