package com.vibetranslator.domain.vibe.model;

public record ToneAnalysis(String overallTone, String rationale) {}
