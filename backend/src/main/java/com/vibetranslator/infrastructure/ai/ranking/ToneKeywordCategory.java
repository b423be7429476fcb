package com.vibetranslator.infrastructure.ai.ranking;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword categories for the heuristic tone bonus.
 * A category applies only when the requested tone is one of its tones.
 */
enum ToneKeywordCategory {
    PROFESSIONAL(Set.of("professional", "formal"), List.of("regards", "sincerely", "appreciate")),
    FRIENDLY(Set.of("friendly"), List.of("thanks", "excited", "glad", "hey")),
    CONCISE(Set.of("concise"), List.of()),
    PERSUASIVE(Set.of("persuasive"), List.of("benefit", "impact", "value", "recommend")),
    EMPATHETIC(Set.of("empathetic"), List.of("understand", "appreciate", "support", "sorry"));

    static final int CONCISE_MAX_LENGTH = 200;

    private final Set<String> tones;
    private final List<String> keywords;

    ToneKeywordCategory(Set<String> tones, List<String> keywords) {
        this.tones = tones;
        this.keywords = keywords;
    }

    boolean appliesTo(String targetTone) {
        return targetTone != null && tones.contains(targetTone.strip().toLowerCase(Locale.ROOT));
    }

    boolean matches(String text) {
        if (this == CONCISE) {
            return text.length() < CONCISE_MAX_LENGTH;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lowered::contains);
    }
}
