package com.vibetranslator.infrastructure.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.vibetranslator.domain.vibe.model.ToneAnalysis;
import com.vibetranslator.domain.vibe.service.GenerationService;
import com.vibetranslator.infrastructure.ai.StructuralParser.ParsedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Classifies the overall tone of the incoming message.
 * Uses the primary generation service when it answers with valid JSON, a keyword heuristic otherwise.
 */
@Slf4j
@Service
public class ToneAnalysisService {

    private static final double TEMPERATURE = 0.2;
    private static final int MAX_MESSAGE_CHARS = 2000;

    static final String HEURISTIC_RATIONALE =
            "Heuristic analysis based on presence of polite, urgent, apologetic, or positive keywords.";

    private static final String SYSTEM_PROMPT = """
            You analyze the tone of short user messages.
            Return strict JSON with keys: overall_tone (string), rationale (string). JSON only.""";

    private static final List<String> POLITE = List.of("please", "would you", "kindly", "appreciate");
    private static final List<String> URGENT = List.of("urgent", "asap", "now", "immediately");
    private static final List<String> APOLOGETIC = List.of("sorry", "apologize", "regret");
    private static final List<String> POSITIVE = List.of("great", "awesome", "thanks", "thank you");

    private final GenerationService generationService;
    private final ProviderCallExecutor callExecutor;
    private final StructuralParser parser;

    public ToneAnalysisService(List<GenerationService> generationServices,
                               ProviderCallExecutor callExecutor,
                               StructuralParser parser) {
        this.generationService = generationServices.isEmpty() ? null : generationServices.get(0);
        this.callExecutor = callExecutor;
        this.parser = parser;
    }

    public ToneAnalysis analyze(String message) {
        String text = TextTruncator.truncate(message, MAX_MESSAGE_CHARS);

        if (generationService != null) {
            try {
                String userPrompt = "Analyze the tone of this message and return JSON only.\n\nMessage: " + text + "\n";
                String raw = callExecutor.call("tone:" + generationService.name(),
                        () -> generationService.complete(SYSTEM_PROMPT, userPrompt, TEMPERATURE));
                ParsedResponse parsed = parser.parse(raw);
                if (parsed.isStructured()) {
                    JsonNode root = parsed.json();
                    JsonNode tone = root.get("overall_tone");
                    if (root.isObject() && tone != null && tone.isTextual()) {
                        return new ToneAnalysis(tone.asText(), root.path("rationale").asText(""));
                    }
                }
                log.warn("[ToneAnalysis] Unexpected response shape, using heuristic");
            } catch (RuntimeException e) {
                log.warn("[ToneAnalysis] LLM call failed, using heuristic: {}", e.getMessage());
            }
        }

        return heuristic(message);
    }

    static ToneAnalysis heuristic(String message) {
        String lowered = message == null ? "" : message.toLowerCase(Locale.ROOT);
        String tone;
        if (containsAny(lowered, POLITE)) {
            tone = "Polite";
        } else if (containsAny(lowered, URGENT)) {
            tone = "Urgent";
        } else if (containsAny(lowered, APOLOGETIC)) {
            tone = "Apologetic";
        } else if (containsAny(lowered, POSITIVE)) {
            tone = "Positive";
        } else {
            tone = "Neutral";
        }
        return new ToneAnalysis(tone, HEURISTIC_RATIONALE);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
