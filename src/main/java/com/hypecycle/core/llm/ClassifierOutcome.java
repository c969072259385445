package com.hypecycle.core.llm;

/**
 * Result of a classifier call: a value, or an error kind with a message.
 *
 * @param <T> the value type
 */
public record ClassifierOutcome<T>(T value, ClassifierErrorKind errorKind, String message) {

    public ClassifierOutcome {
        if ((value == null) == (errorKind == null)) {
            throw new IllegalArgumentException("exactly one of value or errorKind must be set");
        }
    }

    public static <T> ClassifierOutcome<T> ok(T value) {
        return new ClassifierOutcome<>(value, null, null);
    }

    public static <T> ClassifierOutcome<T> failed(ClassifierErrorKind kind, String message) {
        return new ClassifierOutcome<>(null, kind, message);
    }

    public boolean isOk() {
        return value != null;
    }

    /** For failed outcomes, e.g. {@code "RATE_LIMITED: 429 - slow down"}. */
    public String describeError() {
        return errorKind + ": " + message;
    }
}
