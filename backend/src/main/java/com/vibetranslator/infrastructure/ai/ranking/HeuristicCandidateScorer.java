package com.vibetranslator.infrastructure.ai.ranking;

import com.vibetranslator.domain.vibe.model.VibeCandidate;

import java.util.List;

/**
 * Offline scorer: length bucket plus tone keyword bonuses. Never fails.
 */
public class HeuristicCandidateScorer implements CandidateScorer {

    public static final String NAME = "heuristic";

    static final double KEYWORD_BONUS = 0.5;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Double> score(List<VibeCandidate> candidates, String message, String targetTone, String platform) {
        return candidates.stream()
                .map(c -> heuristicScore(c.rewrittenText(), targetTone))
                .toList();
    }

    public static double heuristicScore(String text, String targetTone) {
        String value = text == null ? "" : text;
        double score = lengthBase(value.length());
        for (ToneKeywordCategory category : ToneKeywordCategory.values()) {
            if (category.appliesTo(targetTone) && category.matches(value)) {
                score += KEYWORD_BONUS;
            }
        }
        return score;
    }

    // Favors 100-350 characters
    static double lengthBase(int length) {
        if (length <= 40) {
            return 4.0;
        } else if (length <= 100) {
            return 7.0;
        } else if (length <= 350) {
            return 8.5;
        } else if (length <= 700) {
            return 7.2;
        }
        return 5.5;
    }
}
