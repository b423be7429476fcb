package com.vibetranslator.infrastructure.platform;

import com.vibetranslator.domain.vibe.model.PlatformRules;
import com.vibetranslator.domain.vibe.service.PlatformRulesProvider;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Fixed per-platform formatting rules, loaded once and never mutated.
 */
@Component
public class StaticPlatformRulesProvider implements PlatformRulesProvider {

    public static final String GENERIC = "generic";

    static final PlatformRules GENERIC_RULES = new PlatformRules(GENERIC, 4000, 10, true);

    private static final Map<String, PlatformRules> RULES = Map.of(
            "twitter", new PlatformRules("twitter", 280, 3, true),
            "x", new PlatformRules("x", 280, 3, true),
            "linkedin", new PlatformRules("linkedin", 3000, 5, true),
            "instagram", new PlatformRules("instagram", 2200, 30, true),
            "whatsapp", new PlatformRules("whatsapp", 1000, 3, true),
            "email", new PlatformRules("email", 5000, 2, true),
            "sms", new PlatformRules("sms", 160, 0, false),
            "slack", new PlatformRules("slack", 4000, 5, true)
    );

    @Override
    public PlatformRules getRules(String platform) {
        if (platform == null || platform.isBlank()) {
            return GENERIC_RULES;
        }
        return RULES.getOrDefault(platform.strip().toLowerCase(Locale.ROOT), GENERIC_RULES);
    }
}
