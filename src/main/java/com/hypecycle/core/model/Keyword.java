package com.hypecycle.core.model;

/**
 * Keyword normalization shared by the REST API, the CLI and the engine.
 */
public final class Keyword {

    public static final int MAX_LENGTH = 100;

    private Keyword() {}

    /**
     * Trims the raw keyword and checks its length.
     *
     * @throws InvalidKeywordException if the trimmed keyword is empty or longer than {@value #MAX_LENGTH}
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidKeywordException("Keyword must not be empty");
        }
        String trimmed = raw.trim();
        if (trimmed.length() > MAX_LENGTH) {
            throw new InvalidKeywordException(
                    "Keyword must be at most " + MAX_LENGTH + " characters, got " + trimmed.length());
        }
        return trimmed;
    }
}
