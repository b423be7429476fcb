package com.vibetranslator.interfaces.api.dto;

import com.vibetranslator.domain.vibe.model.PlatformTips;
import com.vibetranslator.domain.vibe.model.ToneAnalysis;
import com.vibetranslator.domain.vibe.model.ValidationIssueType;

import java.util.List;
import java.util.Map;

public record RewriteVibesResponse(
        String originalMessage,
        ToneAnalysis toneAnalysis,
        List<VibeItem> vibes,
        PlatformTips platformTips,
        String servedBy,
        Map<String, List<ValidationIssueType>> platformIssues
) {}
