package com.vibetranslator.infrastructure.ai.ranking;

import com.fasterxml.jackson.databind.JsonNode;
import com.vibetranslator.domain.vibe.exception.MalformedResponseException;
import com.vibetranslator.domain.vibe.exception.RankingContractViolationException;
import com.vibetranslator.domain.vibe.model.VibeCandidate;
import com.vibetranslator.domain.vibe.service.GenerationService;
import com.vibetranslator.infrastructure.ai.ProviderCallExecutor;
import com.vibetranslator.infrastructure.ai.StructuralParser;
import com.vibetranslator.infrastructure.ai.StructuralParser.ParsedResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rubric-based scoring through a generation service.
 * <p>
 * Every candidate is sent with an explicit id ({@code c1..cN}) and the response must score each id
 * exactly once, so a reordered or partial answer cannot attach a score to the wrong candidate.
 * </p>
 */
@Slf4j
public class LlmCandidateScorer implements CandidateScorer {

    static final double MIN_SCORE = 0.0;
    static final double MAX_SCORE = 10.0;
    private static final double TEMPERATURE = 0.2;

    static final String SYSTEM_PROMPT = """
            You are a precise evaluator. Score each candidate from 0 to 10 based on:
            1) tone alignment to the requested tone,
            2) clarity and readability,
            3) fit for the specified platform (format, length, conventions).
            Return a STRICT JSON array with one object per candidate: {"id": "<candidate id>", "score": <number>}.
            Score every candidate id exactly once. JSON only.""";

    private final GenerationService service;
    private final ProviderCallExecutor callExecutor;
    private final StructuralParser parser;

    public LlmCandidateScorer(GenerationService service, ProviderCallExecutor callExecutor, StructuralParser parser) {
        this.service = service;
        this.callExecutor = callExecutor;
        this.parser = parser;
    }

    @Override
    public String name() {
        return "llm:" + service.name();
    }

    @Override
    public List<Double> score(List<VibeCandidate> candidates, String message, String targetTone, String platform) {
        String userPrompt = buildUserPrompt(candidates, message, targetTone, platform);
        String raw = callExecutor.call(name(), () -> service.complete(SYSTEM_PROMPT, userPrompt, TEMPERATURE));

        ParsedResponse parsed = parser.parse(raw);
        if (!parsed.isStructured()) {
            throw new MalformedResponseException(name() + " returned non-JSON scores");
        }
        return readScores(parsed.json(), candidates.size());
    }

    static String candidateId(int index) {
        return "c" + (index + 1);
    }

    static String buildUserPrompt(List<VibeCandidate> candidates, String message, String targetTone, String platform) {
        StringBuilder sb = new StringBuilder();
        sb.append("Target tone: ").append(targetTone).append("\n");
        sb.append("Platform: ").append(platform == null || platform.isBlank() ? "generic" : platform).append("\n\n");
        sb.append("Original message: ").append(message).append("\n\n");
        sb.append("Candidates:\n");
        for (int i = 0; i < candidates.size(); i++) {
            sb.append("- id ").append(candidateId(i)).append(": ")
                    .append(candidates.get(i).rewrittenText()).append("\n");
        }
        return sb.toString();
    }

    static List<Double> readScores(JsonNode root, int expected) {
        if (!root.isArray() || root.size() != expected) {
            throw new RankingContractViolationException("expected an array of " + expected + " scores, got "
                    + (root.isArray() ? root.size() + " entries" : root.getNodeType()));
        }

        Map<String, Double> byId = new HashMap<>();
        for (JsonNode entry : root) {
            JsonNode id = entry.get("id");
            JsonNode score = entry.get("score");
            if (id == null || !id.isTextual() || score == null || !score.isNumber()) {
                throw new RankingContractViolationException("score entry needs a textual id and numeric score: " + entry);
            }
            if (byId.put(id.asText(), clamp(score.asDouble())) != null) {
                throw new RankingContractViolationException("duplicate score for id " + id.asText());
            }
        }

        List<Double> scores = new ArrayList<>(expected);
        for (int i = 0; i < expected; i++) {
            Double score = byId.get(candidateId(i));
            if (score == null) {
                throw new RankingContractViolationException("missing score for id " + candidateId(i));
            }
            scores.add(score);
        }
        return scores;
    }

    private static double clamp(double score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
