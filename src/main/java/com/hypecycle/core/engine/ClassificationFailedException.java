package com.hypecycle.core.engine;

import com.hypecycle.core.model.FailureKind;

import java.util.List;

/**
 * Thrown when a run fails after data collection: too few per-source opinions, a failed
 * synthesis, a failed cache write, or an unexpected error in the pipeline.
 */
public class ClassificationFailedException extends RuntimeException {

    private final FailureKind kind;
    private final List<String> errors;

    public ClassificationFailedException(FailureKind kind, String message, List<String> errors) {
        super(message);
        this.kind = kind;
        this.errors = List.copyOf(errors);
    }

    public ClassificationFailedException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.errors = List.of();
    }

    public FailureKind getKind() {
        return kind;
    }

    public List<String> getErrors() {
        return errors;
    }
}
