package com.twinforge.dispatch.cli;

import com.twinforge.core.model.JudgmentResult;
import com.twinforge.core.model.SubsystemOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the Twinforge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TWINFORGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TWINFORGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void target(SubsystemOutcome outcome) {
        if (!outcome.required()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|faint " + outcome.target().wireName() + " skipped|@"));
            return;
        }
        String status = outcome.passed()
                ? "@|fg(green) " + outcome.status() + "|@"
                : "@|fg(red) " + outcome.status() + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|fg(blue) [%s]|@ %s after %d/%d sub-iteration(s), %d file(s) (%s)",
                outcome.target().wireName().toUpperCase(), status,
                outcome.subIterations(), outcome.maxSubIterations(),
                outcome.artifacts().size(), formatDuration(outcome.durationMs()))));
        for (String diagnostic : outcome.lastDiagnostics()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + diagnostic));
        }
    }

    public static void judgment(JudgmentResult judgment) {
        String verdict = judgment.compatible()
                ? "@|fg(green),bold [COMPATIBLE]|@"
                : "@|fg(red),bold [INCOMPATIBLE]|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  " + verdict + " " + judgment.summary()));
        for (String issue : judgment.issues()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + issue));
        }
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "run.created" -> "@|fg(cyan) [RUN]|@";
            case "planning.started", "planning.completed", "replanning.started" -> "@|fg(magenta) [PLAN]|@";
            case "build.started", "target.coding", "target.verifying", "target.skipped" -> "@|fg(blue) [TARGET]|@";
            case "target.passed" -> "@|fg(green) [TARGET]|@";
            case "target.failed" -> "@|fg(red) [TARGET]|@";
            case "judging.started", "judgment.result" -> "@|bold,fg(yellow) [JUDGE]|@";
            case "run.delivered" -> "@|fg(green),bold [DELIVERED]|@";
            case "run.failed" -> "@|fg(red),bold [FAILED]|@";
            case "run.stopped" -> "@|fg(yellow),bold [STOPPED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
