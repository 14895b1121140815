package com.driftwatch.core.ledger;

import com.driftwatch.core.error.StoreUnavailableException;
import com.driftwatch.core.model.IngestedFileRecord;
import com.driftwatch.core.model.ScoreRecord;

import java.util.List;
import java.util.Set;

/**
 * Access to the two provenance ledgers: the ingested-file table, replaced on
 * each ingestion, and the append-only score history.
 * <p>
 * Each call opens and closes its own connection, so rows committed by an
 * external stage between two calls are visible to the second one. Every
 * method throws {@link StoreUnavailableException} when a table cannot be
 * opened or read.
 */
public interface LedgerStore {

    /**
     * Basenames recorded by the most recent ingestion.
     */
    Set<String> readIngestedFiles();

    /**
     * Full rows of the ingested-file table, in insertion order.
     */
    List<IngestedFileRecord> readIngestedFileRecords();

    /**
     * Score history ascending by timestamp; rows with equal timestamps keep
     * insertion order. Empty when the table has no rows.
     */
    List<ScoreRecord> readScoreHistory();

    /**
     * Appends one score. Reserved for the scoring collaborator; the drift
     * controller never writes scores.
     */
    void appendScore(ScoreRecord record);

    /**
     * Replaces the ingested-file table with the given batch in one transaction.
     */
    void replaceIngestedFiles(List<IngestedFileRecord> records);

    /**
     * Creates the ledger tables when they do not exist yet.
     */
    void initializeSchema();

    /**
     * Verifies that a connection opens and both tables can be queried.
     */
    void checkAvailable();

    /**
     * Human-readable location of the store, used in diagnostics.
     */
    String location();
}
