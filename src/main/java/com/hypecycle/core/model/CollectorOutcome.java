package com.hypecycle.core.model;

import java.io.Serializable;

/**
 * Result of one collector invocation: either present metrics or a failure reason.
 */
public record CollectorOutcome(
        SourceName source,
        SourceMetrics metrics,
        String failureReason
) implements Serializable {

    public CollectorOutcome {
        if (source == null) {
            throw new IllegalArgumentException("source is required");
        }
        if ((metrics == null) == (failureReason == null)) {
            throw new IllegalArgumentException("exactly one of metrics or failureReason must be set");
        }
    }

    public static CollectorOutcome ok(SourceMetrics metrics) {
        return new CollectorOutcome(metrics.source(), metrics, null);
    }

    public static CollectorOutcome failed(SourceName source, String reason) {
        return new CollectorOutcome(source, null,
                reason == null || reason.isBlank() ? "unknown error" : reason);
    }

    public boolean present() {
        return metrics != null;
    }

    /** Error-list entry for a failed outcome, e.g. {@code "news collector failed: Rate limited"}. */
    public String describeFailure() {
        return source.key() + " collector failed: " + failureReason;
    }
}
