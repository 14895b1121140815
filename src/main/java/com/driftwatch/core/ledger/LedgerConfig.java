package com.driftwatch.core.ledger;

import com.driftwatch.core.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteDataSource;

/**
 * Provides the ledger {@link LedgerStore} bean over the configured SQLite file.
 * <p>
 * {@link SQLiteDataSource} opens a fresh connection on every request and holds
 * no pool, which keeps each ledger call independent. Nothing touches the file
 * until the first ledger call, so commands like {@code --version} leave the
 * disk alone.
 */
@Configuration
public class LedgerConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfig.class);

    @Bean
    public LedgerStore ledgerStore(PipelineConfig config) {
        var dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + config.ledgerFile());

        if (config.initializeSchema()) {
            return JdbcLedgerStore.initializingOnFirstUse(dataSource, config.ledgerFile());
        }
        log.info("Ledger schema initialization disabled; expecting existing tables at {}", config.ledgerFile());
        return new JdbcLedgerStore(dataSource, config.ledgerFile().toString());
    }
}
