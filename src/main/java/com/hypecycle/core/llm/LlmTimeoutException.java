package com.hypecycle.core.llm;

/**
 * Thrown when an LLM call does not complete within the configured per-call timeout.
 */
public class LlmTimeoutException extends RuntimeException {

    public LlmTimeoutException(String message) {
        super(message);
    }
}
