package com.vibetranslator.infrastructure.ai.pipeline;

import com.vibetranslator.domain.vibe.model.GenerationPrompt;

/**
 * One stage of the generation fallback chain.
 * Implementations report failure through the returned attempt rather than by throwing.
 */
public interface VibeGenerationTier {

    String name();

    /**
     * @param prompt  assembled prompt
     * @param message the masked message (used by tiers that do not call a provider)
     */
    GenerationAttempt attemptGenerate(GenerationPrompt prompt, String message);
}
