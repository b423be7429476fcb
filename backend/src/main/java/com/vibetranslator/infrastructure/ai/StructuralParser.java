package com.vibetranslator.infrastructure.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts a JSON payload from raw provider text.
 * <p>
 * Strips a surrounding markdown code fence, then parses strictly (trailing tokens rejected).
 * Never throws: unparsable input comes back as the original raw text.
 * </p>
 */
@Slf4j
@Component
public class StructuralParser {

    private static final String FENCE = "```";

    private final ObjectReader strictReader;

    public StructuralParser(ObjectMapper objectMapper) {
        this.strictReader = objectMapper.reader()
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public record ParsedResponse(JsonNode json, String raw) {

        public boolean isStructured() {
            return json != null;
        }
    }

    public ParsedResponse parse(String raw) {
        String original = raw == null ? "" : raw;
        String cleaned = stripFence(original.strip());

        try {
            JsonNode node = strictReader.readTree(cleaned);
            if (node == null || node.isMissingNode()) {
                return new ParsedResponse(null, original);
            }
            return new ParsedResponse(node, original);
        } catch (JsonProcessingException e) {
            log.debug("[StructuralParser] Not JSON ({}): {}", e.getOriginalMessage(), abbreviate(original));
            return new ParsedResponse(null, original);
        } catch (RuntimeException e) {
            log.debug("[StructuralParser] Parse error: {}", e.getMessage());
            return new ParsedResponse(null, original);
        }
    }

    static String stripFence(String text) {
        if (!text.startsWith(FENCE)) {
            return text;
        }
        String cleaned = text;
        int firstNewline = cleaned.indexOf('\n');
        if (firstNewline >= 0) {
            cleaned = cleaned.substring(firstNewline + 1);
        }
        if (cleaned.endsWith(FENCE)) {
            int lastNewline = cleaned.lastIndexOf('\n');
            if (lastNewline >= 0) {
                cleaned = cleaned.substring(0, lastNewline);
            }
        }
        return cleaned;
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
