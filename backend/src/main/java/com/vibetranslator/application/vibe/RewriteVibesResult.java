package com.vibetranslator.application.vibe;

import com.vibetranslator.domain.vibe.model.PlatformTips;
import com.vibetranslator.domain.vibe.model.ToneAnalysis;
import com.vibetranslator.infrastructure.ai.pipeline.GenerationResult;

public record RewriteVibesResult(
        String originalMessage,
        ToneAnalysis toneAnalysis,
        GenerationResult generation,
        PlatformTips platformTips
) {}
