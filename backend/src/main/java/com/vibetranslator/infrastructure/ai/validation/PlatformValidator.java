package com.vibetranslator.infrastructure.ai.validation;

import com.vibetranslator.domain.vibe.model.PlatformRules;
import com.vibetranslator.domain.vibe.model.ValidationIssueType;
import com.vibetranslator.domain.vibe.model.ValidationOutcome;
import com.vibetranslator.domain.vibe.service.PlatformRulesProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes generated text to a platform's constraints.
 * Rules run in fixed order: length cap, hashtag cap, linebreak policy.
 * Issues are reported, never thrown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlatformValidator {

    // A hashtag starts the text or follows whitespace
    private static final Pattern HASHTAG_PATTERN = Pattern.compile(
            "(?:^|\\s)#\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    // Same whitespace notion as the hashtag pattern, so every counted hashtag is its own token
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final PlatformRulesProvider rulesProvider;

    public ValidationOutcome validate(String text, String platform) {
        PlatformRules rules = rulesProvider.getRules(platform);
        List<ValidationIssueType> issues = new ArrayList<>();
        String fixed = text == null ? "" : text;

        // Rule 1: length cap (keeps maxChars - 1 characters, never half a surrogate pair)
        if (fixed.length() > rules.maxChars()) {
            fixed = fixed.substring(0, cutIndex(fixed, rules.maxChars() - 1));
            issues.add(ValidationIssueType.TRIMMED_TO_MAX_CHARS);
        }

        // Rule 2: hashtag cap, greedy left to right. Rejoining with single spaces is intended.
        if (countHashtags(fixed) > rules.hashtagsMax()) {
            fixed = dropExtraHashtags(fixed, rules.hashtagsMax());
            issues.add(ValidationIssueType.REMOVED_EXTRA_HASHTAGS);
        }

        // Rule 3: linebreak policy
        if (!rules.linebreaksOk() && fixed.indexOf('\n') >= 0) {
            fixed = fixed.replace('\n', ' ');
            issues.add(ValidationIssueType.REMOVED_LINEBREAKS);
        }

        if (!issues.isEmpty()) {
            log.debug("[PlatformValidator] platform={}, issues={}", rules.platform(), issues);
        }
        return new ValidationOutcome(fixed, issues, rules);
    }

    public static int countHashtags(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        Matcher m = HASHTAG_PATTERN.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    private static int cutIndex(String text, int cut) {
        if (cut > 0 && Character.isHighSurrogate(text.charAt(cut - 1))) {
            return cut - 1;
        }
        return cut;
    }

    private static String dropExtraHashtags(String text, int keepMax) {
        List<String> kept = new ArrayList<>();
        int remaining = keepMax;
        for (String token : WHITESPACE.split(text)) {
            if (token.isEmpty()) {
                continue;
            }
            if (token.startsWith("#")) {
                if (remaining > 0) {
                    kept.add(token);
                    remaining--;
                }
            } else {
                kept.add(token);
            }
        }
        return String.join(" ", kept);
    }
}
