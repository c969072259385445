package com.hypecycle.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One classification verdict: a phase, a confidence in [0, 1] and the model's reasoning.
 * Used both for per-source opinions and for the synthesized final opinion.
 */
public record PhaseOpinion(
        @JsonProperty("phase") Phase phase,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("reasoning") String reasoning
) implements Serializable {

    public PhaseOpinion {
        if (phase == null) {
            throw new IllegalArgumentException("phase is required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
        if (reasoning == null || reasoning.isBlank()) {
            throw new IllegalArgumentException("reasoning is required");
        }
    }
}
