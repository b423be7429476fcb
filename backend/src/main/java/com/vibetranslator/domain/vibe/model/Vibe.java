package com.vibetranslator.domain.vibe.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The five tone categories every message is rewritten into.
 * Declaration order is the canonical output order.
 */
public enum Vibe {
    PROFESSIONAL("Professional"),
    FRIENDLY("Friendly"),
    PERSUASIVE("Persuasive"),
    CONCISE("Concise"),
    EMPATHETIC("Empathetic");

    private final String label;

    Vibe(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Exact label lookup. Provider output using any other spelling is not a known vibe.
     */
    public static Optional<Vibe> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(v -> v.label.equals(label))
                .findFirst();
    }
}
