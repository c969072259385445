package com.hypecycle.core.llm;

/**
 * Coarse classification of classifier call failures.
 */
public enum ClassifierErrorKind {
    RATE_LIMITED,
    UNAUTHENTICATED,
    TIMED_OUT,
    MALFORMED_RESPONSE,
    UPSTREAM_ERROR
}
