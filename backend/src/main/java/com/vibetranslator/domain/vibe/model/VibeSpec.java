package com.vibetranslator.domain.vibe.model;

/**
 * A vibe together with the guidance text used to steer its rewrite.
 */
public record VibeSpec(Vibe vibe, String guidance) {

    public String name() {
        return vibe.label();
    }
}
