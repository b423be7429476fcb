package com.vibetranslator.domain.vibe.model;

/**
 * Style or platform guidance snippet returned by the grounding store.
 */
public record GroundingDocument(String title, String text, double relevance) {}
