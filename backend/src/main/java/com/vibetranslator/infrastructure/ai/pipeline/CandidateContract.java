package com.vibetranslator.infrastructure.ai.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.vibetranslator.domain.vibe.exception.ContractViolationException;
import com.vibetranslator.domain.vibe.model.Vibe;
import com.vibetranslator.domain.vibe.model.VibeCandidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Strict schema check for generated five-vibe output.
 * <p>
 * Accepts only an array of exactly five objects with textual {@code vibe}, {@code rewritten_text},
 * {@code explanation} and an array of textual {@code use_cases}. Every vibe must be an exact canonical
 * label and appear once. Records are re-keyed by their vibe label into canonical order;
 * the position a provider put them in is ignored.
 * </p>
 */
@Component
public class CandidateContract {

    static final String FIELD_VIBE = "vibe";
    static final String FIELD_TEXT = "rewritten_text";
    static final String FIELD_EXPLANATION = "explanation";
    static final String FIELD_USE_CASES = "use_cases";

    public List<VibeCandidate> validate(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new ContractViolationException("expected a JSON array of candidates");
        }
        int expected = Vibe.values().length;
        if (root.size() != expected) {
            throw new ContractViolationException(
                    "expected exactly " + expected + " candidates, got " + root.size());
        }

        Map<Vibe, VibeCandidate> byVibe = new EnumMap<>(Vibe.class);
        for (int i = 0; i < root.size(); i++) {
            JsonNode record = root.get(i);
            if (!record.isObject()) {
                throw new ContractViolationException("candidate #" + i + " is not an object");
            }

            String label = requireText(record, FIELD_VIBE, i);
            Vibe vibe = Vibe.fromLabel(label)
                    .orElseThrow(() -> new ContractViolationException("unrecognized vibe label: " + label));
            if (byVibe.containsKey(vibe)) {
                throw new ContractViolationException("duplicate vibe label: " + label);
            }

            String text = requireText(record, FIELD_TEXT, i);
            String explanation = requireText(record, FIELD_EXPLANATION, i);
            List<String> useCases = requireTextArray(record, FIELD_USE_CASES, i);

            byVibe.put(vibe, new VibeCandidate(vibe.label(), text, explanation, useCases));
        }

        List<VibeCandidate> ordered = new ArrayList<>(expected);
        for (Vibe vibe : Vibe.values()) {
            ordered.add(byVibe.get(vibe));
        }
        return ordered;
    }

    private static String requireText(JsonNode record, String field, int index) {
        JsonNode value = record.get(field);
        if (value == null || !value.isTextual()) {
            throw new ContractViolationException(
                    "candidate #" + index + " is missing textual field '" + field + "'");
        }
        return value.asText();
    }

    private static List<String> requireTextArray(JsonNode record, String field, int index) {
        JsonNode value = record.get(field);
        if (value == null || !value.isArray()) {
            throw new ContractViolationException(
                    "candidate #" + index + " is missing array field '" + field + "'");
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new ContractViolationException(
                        "candidate #" + index + " has a non-text entry in '" + field + "'");
            }
            items.add(item.asText());
        }
        return items;
    }
}
