package com.vibetranslator.infrastructure.ai.pipeline;

import com.vibetranslator.domain.vibe.model.ValidationIssueType;
import com.vibetranslator.domain.vibe.model.VibeCandidate;

import java.util.List;
import java.util.Map;

/**
 * Output of the generation orchestrator.
 *
 * @param candidates       the five candidates in canonical vibe order
 * @param servedBy         name of the tier whose output was accepted
 * @param attempts         every tier attempt made for this request, in order
 * @param validationIssues platform issues per vibe label (only vibes with issues)
 */
public record GenerationResult(
        List<VibeCandidate> candidates,
        String servedBy,
        List<AttemptRecord> attempts,
        Map<String, List<ValidationIssueType>> validationIssues
) {
    public GenerationResult {
        candidates = List.copyOf(candidates);
        attempts = List.copyOf(attempts);
        validationIssues = Map.copyOf(validationIssues);
    }

    public boolean usedFallback() {
        return attempts.size() > 1;
    }
}
