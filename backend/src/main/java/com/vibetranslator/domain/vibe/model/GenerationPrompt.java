package com.vibetranslator.domain.vibe.model;

/**
 * Instruction block and content block sent to a generation service.
 */
public record GenerationPrompt(String systemPrompt, String userPrompt) {}
