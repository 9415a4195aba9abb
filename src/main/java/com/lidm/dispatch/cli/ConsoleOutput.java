package com.lidm.dispatch.cli;

import com.lidm.core.model.ConfidenceSummary;
import com.lidm.core.model.SubTask;
import com.lidm.core.model.TraceEntry;
import com.lidm.core.resilience.CircuitBreakerSnapshot;
import com.lidm.core.resilience.RateLimitSnapshot;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the LIDM CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LIDM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LIDM]|@ " + message));
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

    public static void subtask(SubTask subtask) {
        String status = switch (subtask.status()) {
            case COMPLETED -> "@|fg(green) COMPLETED|@";
            case FAILED -> "@|fg(red) FAILED   |@";
            default -> "@|fg(yellow) " + subtask.status() + "|@";
        };
        String tier = subtask.tierUsed() != null ? subtask.tierUsed().key() : "-";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + subtask.id() + " [" + tier + ", " + subtask.attemptCount()
                + " attempt" + (subtask.attemptCount() != 1 ? "s" : "") + "] " + subtask.instruction()));
        if (subtask.isFailed() && subtask.error() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + subtask.error()));
        }
    }

    public static void confidence(ConfidenceSummary confidence) {
        if (confidence.score() == null) {
            info("Confidence: " + confidence.method());
            return;
        }
        String color = confidence.confident() ? "fg(green)" : "fg(red)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LIDM]|@ Confidence: @|" + color + " "
                + String.format("%.2f", confidence.score()) + "|@ (" + confidence.method() + ")"
                + (confidence.needsToolVerification() ? " @|fg(yellow) needs tool verification|@" : "")));
    }

    public static void traceEntry(TraceEntry entry) {
        String outcomeColor = entry.outcome().succeeded() ? "fg(green)" : "fg(red)";
        String tier = entry.tier() != null ? entry.tier().key() : "-";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %-10s %-6s %-9s @|%s %-12s|@ %6dms %s",
                entry.phase(),
                entry.subtaskId() != null ? entry.subtaskId() : "",
                tier,
                outcomeColor, entry.outcome(),
                entry.latencyMs(),
                entry.detail() != null ? entry.detail() : "")));
    }

    public static void circuit(CircuitBreakerSnapshot snapshot) {
        String color = switch (snapshot.state()) {
            case CLOSED -> "fg(green)";
            case HALF_OPEN -> "fg(yellow)";
            case OPEN -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [CIRCUIT]|@ " + snapshot.name() + " @|" + color + " " + snapshot.state() + "|@"
                + " calls=" + snapshot.totalCalls() + " failed=" + snapshot.failedCalls()
                + " rejected=" + snapshot.rejectedCalls()
                + " backoff=" + formatDuration(snapshot.currentBackoff().toMillis())));
    }

    public static void rateLimit(RateLimitSnapshot snapshot) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) [RATE]|@ " + snapshot.name()
                + String.format(" %.1f/%d tokens", snapshot.availableTokens(), snapshot.burst())
                + String.format(" (%.1f/s)", snapshot.rate())
                + " granted=" + snapshot.grantedRequests() + " rejected=" + snapshot.rejectedRequests()));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
