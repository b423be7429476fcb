package com.vibetranslator.infrastructure.ai.pipeline;

import com.vibetranslator.domain.vibe.model.VibeCandidate;

import java.util.List;

/**
 * Either the accepted candidates of a tier or the reason it failed.
 */
public record GenerationAttempt(
        List<VibeCandidate> candidates,
        AttemptOutcome outcome,
        String errorDetails
) {
    public static GenerationAttempt accepted(List<VibeCandidate> candidates) {
        return new GenerationAttempt(List.copyOf(candidates), AttemptOutcome.SUCCESS, null);
    }

    public static GenerationAttempt failed(AttemptOutcome outcome, String errorDetails) {
        if (outcome == AttemptOutcome.SUCCESS) {
            throw new IllegalArgumentException("failed attempt needs a failure outcome");
        }
        return new GenerationAttempt(List.of(), outcome, errorDetails);
    }

    public boolean isAccepted() {
        return outcome == AttemptOutcome.SUCCESS;
    }
}
