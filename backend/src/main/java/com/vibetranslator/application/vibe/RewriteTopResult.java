package com.vibetranslator.application.vibe;

import com.vibetranslator.domain.vibe.model.PlatformTips;
import com.vibetranslator.domain.vibe.model.VibeCandidate;

import java.util.List;

public record RewriteTopResult(
        String originalMessage,
        String targetTone,
        PlatformTips platformTips,
        List<VibeCandidate> topRewrites,
        String servedBy
) {}
