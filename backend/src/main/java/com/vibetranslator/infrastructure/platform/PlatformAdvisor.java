package com.vibetranslator.infrastructure.platform;

import com.vibetranslator.domain.vibe.model.PlatformTips;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Static messaging tips per platform.
 */
@Component
public class PlatformAdvisor {

    private static final Map<String, String> PLATFORM_TIPS = Map.of(
            "whatsapp", "Keep it short, use line breaks for readability. Emojis help convey tone, but don't overuse.",
            "linkedin", "Stay professional, avoid slang, include a clear ask, and keep paragraphs short.",
            "email", "Use a clear subject, polite greeting, one key ask, and a short signature block.",
            "twitter", "Be concise and action-oriented; consider a thread for longer thoughts.",
            "sms", "Very concise, one clear ask, avoid links unless necessary."
    );

    private static final String GENERIC_TIP =
            "Adapt tone to the audience; keep it clear, short, and respectful.";
    private static final String UNKNOWN_TIP =
            "No specific guidance found; keep it concise and audience-appropriate.";

    public PlatformTips getTips(String platform) {
        if (platform == null || platform.isBlank()) {
            return new PlatformTips(StaticPlatformRulesProvider.GENERIC, GENERIC_TIP);
        }
        String key = platform.strip().toLowerCase(Locale.ROOT);
        return new PlatformTips(key, PLATFORM_TIPS.getOrDefault(key, UNKNOWN_TIP));
    }
}
