package com.outrider.dispatch.cli;

import com.outrider.core.model.AgentSnapshot;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Outrider CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) OUTRIDER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [OUTRIDER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(AgentSnapshot snapshot) {
        String color = switch (snapshot.status()) {
            case COMPLETED -> "fg(green)";
            case FAILED, KILLED -> "fg(red)";
            default -> "fg(blue)";
        };
        String line = "@|" + color + " [AGENT " + snapshot.status().name() + "]|@ "
                + snapshot.id() + " (" + snapshot.role().value() + "/" + snapshot.model().value() + ")";
        if (snapshot.status().isTerminal()) {
            line += " in " + formatDuration(snapshot.duration().toMillis());
        }
        if (snapshot.failureReason() != null) {
            line += ": " + snapshot.failureReason();
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
    }

    public static void tool(String name, String description) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + name + "|@  " + description));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        if (ms < 60_000) return String.format("%.1fs", ms / 1000.0);
        return String.format("%dm %ds", ms / 60_000, (ms % 60_000) / 1000);
    }
}
