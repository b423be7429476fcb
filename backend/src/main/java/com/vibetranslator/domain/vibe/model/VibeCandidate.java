package com.vibetranslator.domain.vibe.model;

import java.util.List;

/**
 * One rewrite proposal for a single vibe.
 *
 * @param vibe          canonical vibe label
 * @param rewrittenText the rewritten message
 * @param explanation   why this rewrite fits the vibe
 * @param useCases      up to four short usage hints
 * @param score         ranking score, null until ranked
 */
public record VibeCandidate(
        String vibe,
        String rewrittenText,
        String explanation,
        List<String> useCases,
        Double score
) {
    public static final int MAX_USE_CASES = 4;

    public VibeCandidate {
        useCases = useCases == null
                ? List.of()
                : List.copyOf(useCases.subList(0, Math.min(useCases.size(), MAX_USE_CASES)));
    }

    public VibeCandidate(String vibe, String rewrittenText, String explanation, List<String> useCases) {
        this(vibe, rewrittenText, explanation, useCases, null);
    }

    public VibeCandidate withRewrittenText(String text) {
        return new VibeCandidate(vibe, text, explanation, useCases, score);
    }

    public VibeCandidate withScore(double newScore) {
        return new VibeCandidate(vibe, rewrittenText, explanation, useCases, newScore);
    }
}
