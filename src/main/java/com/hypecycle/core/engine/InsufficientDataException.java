package com.hypecycle.core.engine;

import java.util.List;

/**
 * Thrown when fewer collectors than the configured minimum produced metrics, even after
 * query expansion. Carries the failure reason of every collector that failed.
 */
public class InsufficientDataException extends RuntimeException {

    private final List<String> reasons;
    private final int collectorsSucceeded;
    private final int minimumRequired;

    public InsufficientDataException(String message, List<String> reasons, int collectorsSucceeded, int minimumRequired) {
        super(message);
        this.reasons = List.copyOf(reasons);
        this.collectorsSucceeded = collectorsSucceeded;
        this.minimumRequired = minimumRequired;
    }

    public List<String> getReasons() {
        return reasons;
    }

    public int getCollectorsSucceeded() {
        return collectorsSucceeded;
    }

    public int getMinimumRequired() {
        return minimumRequired;
    }
}
