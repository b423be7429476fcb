package com.vibetranslator.domain.vibe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValidationIssueType {
    TRIMMED_TO_MAX_CHARS("trimmed_to_max_chars"),
    REMOVED_EXTRA_HASHTAGS("removed_extra_hashtags"),
    REMOVED_LINEBREAKS("removed_linebreaks");

    private final String tag;

    ValidationIssueType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
