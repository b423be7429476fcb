package com.vibetranslator.infrastructure.ai.pipeline;

import com.vibetranslator.domain.vibe.model.GenerationPrompt;
import com.vibetranslator.domain.vibe.model.Vibe;
import com.vibetranslator.domain.vibe.model.VibeCandidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic last tier. Never calls out and never fails.
 */
@Component
public class LocalTemplateGenerationTier implements VibeGenerationTier {

    public static final String NAME = "local-templates";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GenerationAttempt attemptGenerate(GenerationPrompt prompt, String message) {
        String text = message == null ? "" : message;
        List<VibeCandidate> candidates = new ArrayList<>();
        for (Vibe vibe : Vibe.values()) {
            String lower = vibe.label().toLowerCase(Locale.ROOT);
            candidates.add(new VibeCandidate(
                    vibe.label(),
                    "[" + vibe.label() + "] " + text,
                    "Uses " + lower + " tone cues based on simple template guidance.",
                    List.of(
                            "Use when you need a " + lower + " tone.",
                            "Useful for quick edits when time is limited."
                    )));
        }
        return GenerationAttempt.accepted(candidates);
    }
}
