package com.hypecycle.core.llm;

/**
 * Thrown when LLM output cannot be parsed into the expected structure,
 * or parses but violates the reply contract (unknown phase, confidence out of range).
 */
public class LlmParseException extends RuntimeException {
    public LlmParseException(String message) {
        super(message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
