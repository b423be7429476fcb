package com.vibetranslator.domain.vibe.model;

/**
 * Formatting constraints for a single platform.
 *
 * @param platform     normalized platform key ("generic" when unknown)
 * @param maxChars     maximum text length
 * @param hashtagsMax  maximum number of hashtags
 * @param linebreaksOk whether newlines are allowed
 */
public record PlatformRules(
        String platform,
        int maxChars,
        int hashtagsMax,
        boolean linebreaksOk
) {
    public PlatformRules {
        if (maxChars < 1) {
            throw new IllegalArgumentException("maxChars must be >= 1");
        }
        if (hashtagsMax < 0) {
            throw new IllegalArgumentException("hashtagsMax must be >= 0");
        }
    }
}
