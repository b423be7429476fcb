package com.vibetranslator.domain.vibe.service;

import com.vibetranslator.domain.vibe.model.PlatformRules;

public interface PlatformRulesProvider {

    /**
     * Returns the rules for a platform, or the generic rules when the platform is null or unknown.
     */
    PlatformRules getRules(String platform);
}
