package com.vibetranslator.infrastructure.ai;

import com.vibetranslator.domain.vibe.model.GenerationPrompt;
import com.vibetranslator.domain.vibe.model.GroundingDocument;
import com.vibetranslator.domain.vibe.model.Vibe;
import com.vibetranslator.domain.vibe.model.VibeSpec;
import com.vibetranslator.domain.vibe.service.VibeTemplateProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the bounded instruction/content prompt pair for five-vibe generation.
 */
@Component
@RequiredArgsConstructor
public class VibePromptAssembler {

    public static final int MAX_MESSAGE_CHARS = 2000;
    static final int GUIDANCE_PREVIEW_CHARS = 180;
    static final int GROUNDING_EXCERPT_CHARS = 240;

    private final VibeTemplateProvider vibeTemplateProvider;

    private static final String CANONICAL_LABELS = Arrays.stream(Vibe.values())
            .map(Vibe::label)
            .collect(Collectors.joining(", "));

    private static final String SYSTEM_PROMPT = """
            You rewrite short messages in multiple specific tones.
            Return a strict JSON array with exactly 5 objects, each having the keys:
            vibe, rewritten_text, explanation, use_cases (array of at most 4 short strings).
            The vibe values must be exactly: %s, in that order, each used once.
            Respond with the JSON array only, no commentary.""".formatted(CANONICAL_LABELS);

    /**
     * @param message   PII-masked message
     * @param grounding retrieved guidance, already limited to top-k
     * @param topK      maximum grounding excerpts to include
     */
    public GenerationPrompt assemble(String message, List<GroundingDocument> grounding, int topK) {
        StringBuilder sb = new StringBuilder();
        sb.append("Rewrite the message into five vibes using the guidance below, respond with JSON only.\n\n");
        sb.append("Message: ").append(TextTruncator.truncate(message, MAX_MESSAGE_CHARS)).append("\n\n");

        sb.append("Vibe guidance:\n");
        for (VibeSpec spec : vibeTemplateProvider.getVibes()) {
            sb.append("- ").append(spec.name()).append(": ")
                    .append(TextTruncator.truncate(spec.guidance(), GUIDANCE_PREVIEW_CHARS))
                    .append("\n");
        }

        if (grounding != null && !grounding.isEmpty()) {
            sb.append("\nRetrieved guidance:\n");
            grounding.stream()
                    .limit(Math.max(0, topK))
                    .forEach(doc -> sb.append("- ").append(doc.title()).append(": ")
                            .append(TextTruncator.truncate(doc.text(), GROUNDING_EXCERPT_CHARS))
                            .append("\n"));
        }

        return new GenerationPrompt(SYSTEM_PROMPT, sb.toString());
    }
}
