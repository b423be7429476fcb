package com.vibetranslator.interfaces.api.dto;

import com.vibetranslator.domain.vibe.model.PlatformTips;

import java.util.List;

public record RewriteTopResponse(
        String originalMessage,
        String targetTone,
        PlatformTips platformTips,
        List<VibeItem> topRewrites,
        String servedBy
) {}
