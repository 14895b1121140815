package com.driftwatch.dispatch.cli;

import com.driftwatch.core.error.DriftwatchException;
import com.driftwatch.core.ledger.LedgerStore;
import com.driftwatch.core.model.IngestedFileRecord;
import com.driftwatch.core.model.ScoreRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: driftwatch history
 * <p>
 * Shows the most recent score records (newest last) and the files of the
 * latest ingestion.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "Show score history and ingested files")
@Component
public class HistoryCommand implements Callable<Integer> {

    @Option(names = {"--limit", "-n"}, description = "Number of score records", defaultValue = "10")
    private int limit;

    private final LedgerStore ledger;

    public HistoryCommand(LedgerStore ledger) {
        this.ledger = ledger;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<ScoreRecord> history;
        List<IngestedFileRecord> files;
        try {
            history = ledger.readScoreHistory();
            files = ledger.readIngestedFileRecords();
        } catch (DriftwatchException e) {
            return FailureReporter.report(e);
        }

        if (history.isEmpty()) {
            ConsoleOutput.info("No scores recorded.");
        } else {
            int shown = Math.max(0, Math.min(limit, history.size()));
            List<ScoreRecord> display = history.subList(history.size() - shown, history.size());
            ConsoleOutput.info("Scores (" + display.size() + " of " + history.size() + "):");
            System.out.printf("  %-30s %s%n", "DATE", "SCORE");
            System.out.println("  " + "-".repeat(40));
            for (ScoreRecord record : display) {
                System.out.printf(Locale.ROOT, "  %-30s %.4f%n", record.timestamp(), record.score());
            }
        }

        System.out.println();
        if (files.isEmpty()) {
            ConsoleOutput.info("No files ingested.");
        } else {
            ConsoleOutput.info("Latest ingestion (" + files.get(0).timestamp() + "):");
            for (IngestedFileRecord file : files) {
                System.out.println("  " + file.filename());
            }
        }
        return CommandLine.ExitCode.OK;
    }
}
