package com.vibetranslator.domain.vibe.service;

import com.vibetranslator.domain.vibe.exception.ProviderUnavailableException;

/**
 * External text generation backend (one tier of the provider chain).
 */
public interface GenerationService {

    /**
     * Identifier used in logs and attempt records (e.g. "openai:gpt-4o-mini").
     */
    String name();

    /**
     * Sends one chat completion request and returns the provider's raw text.
     * The text is untrusted and not yet validated.
     *
     * @param systemPrompt instruction block
     * @param userPrompt   content block
     * @param temperature  sampling temperature
     * @return raw response text
     * @throws ProviderUnavailableException on network, auth, configuration or empty-response failures
     */
    String complete(String systemPrompt, String userPrompt, double temperature);
}
