package com.vibetranslator.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vibetranslator.domain.vibe.model.VibeCandidate;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VibeItem(
        String vibe,
        String rewrittenText,
        String explanation,
        List<String> useCases,
        Double score
) {
    public static VibeItem from(VibeCandidate candidate) {
        return new VibeItem(candidate.vibe(), candidate.rewrittenText(), candidate.explanation(),
                candidate.useCases(), candidate.score());
    }

    public static List<VibeItem> fromAll(List<VibeCandidate> candidates) {
        return candidates.stream().map(VibeItem::from).toList();
    }
}
