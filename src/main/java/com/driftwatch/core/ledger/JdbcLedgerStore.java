package com.driftwatch.core.ledger;

import com.driftwatch.core.error.StoreUnavailableException;
import com.driftwatch.core.model.IngestedFileRecord;
import com.driftwatch.core.model.ScoreRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * JDBC {@link LedgerStore} over the SQLite ledger file.
 * <p>
 * Tables:
 * <pre>
 *   ingested_files(date TEXT, file TEXT)   replaced wholesale per ingestion
 *   model_score(date TEXT, score REAL)     append-only
 * </pre>
 * A store built with {@link #initializingOnFirstUse} creates the ledger
 * directory and both tables on its first call, not at construction.
 */
public class JdbcLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcLedgerStore.class);

    static final String INGESTED_FILES_TABLE = "ingested_files";
    static final String SCORE_TABLE = "model_score";

    private static final String CREATE_INGESTED_FILES_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                date TEXT NOT NULL,
                file TEXT NOT NULL
            )
            """.formatted(INGESTED_FILES_TABLE);

    private static final String CREATE_SCORE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                date  TEXT NOT NULL,
                score REAL NOT NULL
            )
            """.formatted(SCORE_TABLE);

    private static final String SELECT_INGESTED_SQL = """
            SELECT date, file FROM %s ORDER BY rowid ASC
            """.formatted(INGESTED_FILES_TABLE);

    private static final String SELECT_SCORES_SQL = """
            SELECT date, score FROM %s ORDER BY rowid ASC
            """.formatted(SCORE_TABLE);

    private static final String INSERT_SCORE_SQL = """
            INSERT INTO %s (date, score) VALUES (?, ?)
            """.formatted(SCORE_TABLE);

    private static final String DELETE_INGESTED_SQL = """
            DELETE FROM %s
            """.formatted(INGESTED_FILES_TABLE);

    private static final String INSERT_INGESTED_SQL = """
            INSERT INTO %s (date, file) VALUES (?, ?)
            """.formatted(INGESTED_FILES_TABLE);

    private final DataSource dataSource;
    private final String location;
    private final Path ledgerFile;
    private volatile boolean schemaReady;

    public JdbcLedgerStore(DataSource dataSource, String location) {
        this(dataSource, location, null);
    }

    private JdbcLedgerStore(DataSource dataSource, String location, Path ledgerFile) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.location = location;
        this.ledgerFile = ledgerFile;
        this.schemaReady = ledgerFile == null;
    }

    public static JdbcLedgerStore initializingOnFirstUse(DataSource dataSource, Path ledgerFile) {
        return new JdbcLedgerStore(dataSource, ledgerFile.toString(), ledgerFile);
    }

    private void ensureSchema() {
        if (schemaReady) {
            return;
        }
        synchronized (this) {
            if (schemaReady) {
                return;
            }
            try {
                Files.createDirectories(ledgerFile.toAbsolutePath().getParent());
            } catch (IOException e) {
                throw new StoreUnavailableException(location, "cannot create ledger directory: " + e.getMessage(), e);
            }
            initializeSchema();
            schemaReady = true;
        }
    }

    @Override
    public Set<String> readIngestedFiles() {
        Set<String> names = new LinkedHashSet<>();
        for (IngestedFileRecord record : readIngestedFileRecords()) {
            names.add(record.filename());
        }
        return names;
    }

    @Override
    public List<IngestedFileRecord> readIngestedFileRecords() {
        ensureSchema();
        List<IngestedFileRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_INGESTED_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                records.add(new IngestedFileRecord(
                        LedgerTimestamps.parse(rs.getString("date")),
                        rs.getString("file")));
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException(location, "cannot read " + INGESTED_FILES_TABLE + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new StoreUnavailableException(location, "corrupt row in " + INGESTED_FILES_TABLE + ": " + e.getMessage(), e);
        }
        log.debug("Read {} ingested file records", records.size());
        return records;
    }

    @Override
    public List<ScoreRecord> readScoreHistory() {
        ensureSchema();
        List<ScoreRecord> history = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SCORES_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                String date = rs.getString("date");
                double score = rs.getDouble("score");
                if (rs.wasNull()) {
                    throw new IllegalArgumentException("null score at " + date);
                }
                history.add(new ScoreRecord(LedgerTimestamps.parse(date), score));
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException(location, "cannot read " + SCORE_TABLE + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new StoreUnavailableException(location, "corrupt row in " + SCORE_TABLE + ": " + e.getMessage(), e);
        }
        // List.sort is stable, so equal timestamps keep rowid order
        history.sort(Comparator.comparing(ScoreRecord::timestamp));
        log.debug("Read {} score records", history.size());
        return history;
    }

    @Override
    public void appendScore(ScoreRecord record) {
        ensureSchema();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SCORE_SQL)) {
            stmt.setString(1, LedgerTimestamps.format(record.timestamp()));
            stmt.setDouble(2, record.score());
            stmt.executeUpdate();
            log.info("Appended score {} at {}", record.score(), record.timestamp());
        } catch (SQLException e) {
            throw new StoreUnavailableException(location, "cannot append to " + SCORE_TABLE + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void replaceIngestedFiles(List<IngestedFileRecord> records) {
        ensureSchema();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement delete = conn.prepareStatement(DELETE_INGESTED_SQL);
                 PreparedStatement insert = conn.prepareStatement(INSERT_INGESTED_SQL)) {
                delete.executeUpdate();
                for (IngestedFileRecord record : records) {
                    insert.setString(1, LedgerTimestamps.format(record.timestamp()));
                    insert.setString(2, record.filename());
                    insert.addBatch();
                }
                insert.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            log.info("Replaced {} with {} records", INGESTED_FILES_TABLE, records.size());
        } catch (SQLException e) {
            throw new StoreUnavailableException(location, "cannot replace " + INGESTED_FILES_TABLE + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void initializeSchema() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_INGESTED_FILES_SQL);
            stmt.execute(CREATE_SCORE_SQL);
            log.info("Ledger tables '{}' and '{}' ensured at {}", INGESTED_FILES_TABLE, SCORE_TABLE, location);
        } catch (SQLException e) {
            throw new StoreUnavailableException(location, "cannot create ledger tables: " + e.getMessage(), e);
        }
    }

    @Override
    public void checkAvailable() {
        ensureSchema();
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.executeQuery("SELECT COUNT(*) FROM " + INGESTED_FILES_TABLE).close();
            stmt.executeQuery("SELECT COUNT(*) FROM " + SCORE_TABLE).close();
        } catch (SQLException e) {
            throw new StoreUnavailableException(location, e.getMessage(), e);
        }
    }

    @Override
    public String location() {
        return location;
    }
}
