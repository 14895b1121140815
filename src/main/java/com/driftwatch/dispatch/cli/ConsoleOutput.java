package com.driftwatch.dispatch.cli;

import com.driftwatch.core.events.PipelineEvent;
import com.driftwatch.core.model.RunOutcome;
import picocli.CommandLine;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * ANSI-colored terminal output utilities for the Driftwatch CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) DRIFTWATCH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DRIFTWATCH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Prints one progress line for a run event.
     */
    public static void event(PipelineEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.started" -> "@|fg(cyan) [RUN]|@";
            case "stage.started", "stage.completed" -> "@|fg(blue) [STAGE]|@";
            case "stage.failed" -> "@|fg(red) [STAGE]|@";
            case "drift.evaluated" -> "@|bold,fg(yellow) [DRIFT]|@";
            case "run.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "run.failed" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.stage() != null ? event.stage() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + subject + event.eventType() + " " + event.payload()));
    }

    public static void outcome(RunOutcome outcome) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run " + outcome.runId() + "|@"));
        System.out.println("  Status: " + outcome.status());
        if (!outcome.newFiles().isEmpty()) {
            System.out.println("  New files: " + String.join(", ", outcome.newFiles()));
        }
        if (outcome.currentScore().isPresent()) {
            System.out.println("  Scores: previous " + format(outcome.previousScore())
                    + ", current " + format(outcome.currentScore())
                    + (outcome.driftDetected() ? " (drift)" : ""));
        }
        if (!outcome.stagesRun().isEmpty()) {
            System.out.println("  Stages: " + outcome.stagesRun());
        }
        System.out.println("  Duration: " + formatDuration(outcome.durationMs()));
    }

    static String format(OptionalDouble score) {
        return score.isPresent() ? String.format(Locale.ROOT, "%.4f", score.getAsDouble()) : "-";
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
