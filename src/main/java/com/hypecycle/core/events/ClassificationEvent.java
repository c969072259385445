package com.hypecycle.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a classification run, used for CLI progress output.
 *
 * @param eventType event type (e.g. "classification.started", "collector.completed")
 * @param runId     the run this event belongs to
 * @param keyword   the keyword being classified
 * @param source    the source this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ClassificationEvent(
    String eventType,
    String runId,
    String keyword,
    String source,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static ClassificationEvent of(String eventType, String runId, String keyword,
                                         String source, Map<String, Object> payload) {
        return new ClassificationEvent(eventType, runId, keyword, source,
                payload == null ? Map.of() : payload, Instant.now());
    }
}
