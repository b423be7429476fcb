package com.vibetranslator.infrastructure.ai.ranking;

import com.vibetranslator.domain.vibe.model.VibeCandidate;

import java.util.List;

/**
 * One stage of the scoring fallback chain.
 */
public interface CandidateScorer {

    String name();

    /**
     * Scores every candidate.
     *
     * @return one score per candidate, aligned with the input list
     * @throws com.vibetranslator.domain.vibe.exception.VibePipelineException when the scorer cannot
     *         produce a score for every candidate
     */
    List<Double> score(List<VibeCandidate> candidates, String message, String targetTone, String platform);
}
