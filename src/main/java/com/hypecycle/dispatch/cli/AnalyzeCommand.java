package com.hypecycle.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hypecycle.core.engine.ClassificationEngine;
import com.hypecycle.core.engine.ClassificationFailedException;
import com.hypecycle.core.engine.InsufficientDataException;
import com.hypecycle.core.events.ClassificationEvent;
import com.hypecycle.core.events.EventBus;
import com.hypecycle.core.model.ClassificationResult;
import com.hypecycle.core.model.InvalidKeywordException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: hypecycle analyze "&lt;keyword&gt;"
 * <p>
 * Runs one classification in-process, printing pipeline progress as it happens,
 * then the result. With {@code --json} only the result JSON is printed.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Classify a technology keyword")
@Component
public class AnalyzeCommand implements Runnable {

    @Parameters(index = "0", description = "Technology keyword, e.g. \"quantum computing\"")
    private String keyword;

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    private final ClassificationEngine classificationEngine;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public AnalyzeCommand(ClassificationEngine classificationEngine, EventBus eventBus, ObjectMapper objectMapper) {
        this.classificationEngine = classificationEngine;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        if (!json) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Analyzing \"" + keyword.trim() + "\"...");
        }

        EventBus.Subscription subscription = json ? null : eventBus.subscribeAll(this::printProgress);
        ClassificationResult result;
        try {
            result = classificationEngine.classify(keyword);
        } catch (InvalidKeywordException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        } catch (InsufficientDataException e) {
            ConsoleOutput.error("Insufficient data: " + e.getCollectorsSucceeded() + "/5 collectors succeeded, "
                    + e.getMinimumRequired() + " required");
            for (String reason : e.getReasons()) {
                ConsoleOutput.error("  " + reason);
            }
            return;
        } catch (ClassificationFailedException e) {
            ConsoleOutput.error("Analysis failed: " + e.getMessage());
            return;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Could not render result as JSON: " + e.getOriginalMessage());
            }
        } else {
            ConsoleOutput.result(result);
        }
    }

    private void printProgress(ClassificationEvent event) {
        String detail = switch (event.eventType()) {
            case "collector.completed" -> event.source() + " "
                    + (Boolean.TRUE.equals(event.payload().get("success")) ? "ok" : "failed: " + event.payload().get("reason"))
                    + (Boolean.TRUE.equals(event.payload().get("expanded")) ? " (expanded query)" : "");
            case "expansion.applied" -> "niche keyword, expanded with " + event.payload().get("terms");
            case "expansion.skipped" -> String.valueOf(event.payload().get("reason"));
            default -> event.keyword();
        };
        ConsoleOutput.progressEvent(event.eventType(), detail);
    }
}
