package com.hypecycle.dispatch.cli;

import com.hypecycle.core.cache.CacheEntry;
import com.hypecycle.core.cache.CacheStore;
import com.hypecycle.core.cache.CacheStoreException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * CLI command: hypecycle history
 * <p>
 * Lists the most recent stored analyses as a table:
 * Keyword | Phase | Confidence | Sources | Created | Cache state.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recent analyses")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final CacheStore cacheStore;
    private final Clock clock;

    public HistoryCommand(CacheStore cacheStore, Clock clock) {
        this.cacheStore = cacheStore;
        this.clock = clock;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<CacheEntry> entries;
        try {
            entries = cacheStore.recent(Math.max(1, limit));
        } catch (CacheStoreException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        if (entries.isEmpty()) {
            ConsoleOutput.info("No analyses found.");
            return;
        }

        Instant now = clock.instant();
        ConsoleOutput.info("Analyses (" + entries.size() + "):");
        System.out.println();
        System.out.printf("  %-30s %-20s %-6s %-8s %-25s %s%n", "KEYWORD", "PHASE", "CONF", "SOURCES", "CREATED", "CACHE");
        System.out.println("  " + "-".repeat(98));

        for (CacheEntry entry : entries) {
            System.out.printf("  %-30s %-20s %-6s %-8s %-25s %s%n",
                    truncate(entry.keyword(), 30),
                    entry.finalOpinion().phase().wireName(),
                    ConsoleOutput.percent(entry.finalOpinion().confidence()),
                    entry.sourceMetrics().size() + "/5",
                    entry.createdAt(),
                    entry.isExpired(now) ? "expired" : "live");
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
