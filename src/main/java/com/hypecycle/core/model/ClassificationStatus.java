package com.hypecycle.core.model;

/**
 * Lifecycle of one classification run through the graph.
 */
public enum ClassificationStatus {
    IDLE,
    CACHE_CHECK,
    CACHE_HIT,
    COLLECTING,
    NICHE_CHECK,
    EXPANDING,
    VERIFYING,
    CLASSIFYING,
    SYNTHESIZING,
    PERSISTING,
    DONE,
    FAILED;

    /** Terminal states end the graph run. */
    public boolean isTerminal() {
        return this == CACHE_HIT || this == DONE || this == FAILED;
    }
}
