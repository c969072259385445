package com.hypecycle.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Whether the query was expanded for this classification, and with which terms.
 */
public record ExpansionState(boolean applied, List<String> terms) implements Serializable {

    public ExpansionState {
        terms = terms == null ? List.of() : List.copyOf(terms);
        if (applied && terms.isEmpty()) {
            throw new IllegalArgumentException("an applied expansion must carry terms");
        }
    }

    public static ExpansionState none() {
        return new ExpansionState(false, List.of());
    }

    public static ExpansionState applied(List<String> terms) {
        return new ExpansionState(true, terms);
    }
}
