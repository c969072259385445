package com.hypecycle.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The five positions on the hype cycle curve.
 * <p>
 * Wire names are the lowercase identifiers exchanged with the LLM, stored in the
 * cache and returned by the API. Unknown names are rejected, never mapped to a default.
 */
public enum Phase {

    INNOVATION_TRIGGER("innovation_trigger"),
    PEAK("peak"),
    TROUGH("trough"),
    SLOPE("slope"),
    PLATEAU("plateau");

    private final String wireName;

    Phase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves an exact wire name.
     *
     * @throws IllegalArgumentException if the name is not one of the five phases
     */
    @JsonCreator
    public static Phase fromWireName(String name) {
        for (Phase phase : values()) {
            if (phase.wireName.equals(name)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + name);
    }

    public static boolean isValid(String name) {
        try {
            fromWireName(name);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
