package com.hypecycle.dispatch.cli;

import com.hypecycle.core.model.ClassificationResult;
import com.hypecycle.core.model.PhaseOpinion;
import picocli.CommandLine;

import java.util.Locale;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the HypeCycle CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HYPECYCLE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HYPECYCLE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void progressEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "classification.started" -> "@|fg(cyan) [START]|@";
            case "collector.completed" -> "@|fg(blue) [COLLECT]|@";
            case "expansion.applied", "expansion.skipped" -> "@|fg(magenta) [EXPAND]|@";
            case "cache.hit" -> "@|fg(green) [CACHE]|@";
            case "classification.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "classification.failed" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    public static void result(ClassificationResult result) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + result.keyword() + "|@ -> @|bold,fg(yellow) " + result.phase().wireName() + "|@"
                        + " (confidence " + percent(result.confidence()) + ")"
                        + (result.cacheHit() ? " @|faint [cached]|@" : "")));
        System.out.println("  " + result.reasoning());
        System.out.println();

        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Per-source opinions|@"));
        for (Map.Entry<String, PhaseOpinion> entry : result.perSourceAnalyses().entrySet()) {
            PhaseOpinion opinion = entry.getValue();
            System.out.printf("  %-8s %-20s %s%n", entry.getKey(), opinion.phase().wireName(), percent(opinion.confidence()));
        }
        System.out.println();
        System.out.println("  Collectors: " + result.collectorsSucceeded() + "/5"
                + (result.partialData() ? " (partial data)" : ""));
        if (result.queryExpansionApplied()) {
            System.out.println("  Expanded terms: " + String.join(", ", result.expandedTerms()));
        }
        System.out.println("  Expires: " + result.expiresAt());

        if (!result.errors().isEmpty()) {
            System.out.println();
            warn("Errors (" + result.errors().size() + "):");
            for (String e : result.errors()) {
                warn("  " + e);
            }
        }
    }

    static String percent(double confidence) {
        return String.format(Locale.ROOT, "%.0f%%", confidence * 100);
    }
}
