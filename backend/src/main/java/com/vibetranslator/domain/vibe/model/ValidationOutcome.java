package com.vibetranslator.domain.vibe.model;

import java.util.List;

/**
 * Result of normalizing a text against platform rules.
 * Issues are informational only, the normalized text is always usable.
 */
public record ValidationOutcome(
        String text,
        List<ValidationIssueType> issues,
        PlatformRules rules
) {
    public ValidationOutcome {
        issues = List.copyOf(issues);
    }

    public boolean hasIssue(ValidationIssueType type) {
        return issues.contains(type);
    }
}
