package com.vibetranslator.application.vibe;

import com.vibetranslator.domain.vibe.model.PlatformTips;
import com.vibetranslator.domain.vibe.model.ToneAnalysis;
import com.vibetranslator.domain.vibe.model.VibeCandidate;
import com.vibetranslator.infrastructure.ai.ToneAnalysisService;
import com.vibetranslator.infrastructure.ai.pipeline.GenerationResult;
import com.vibetranslator.infrastructure.ai.pipeline.VibeGenerationOrchestrator;
import com.vibetranslator.infrastructure.ai.preprocessing.PiiMasker;
import com.vibetranslator.infrastructure.ai.ranking.RankingEngine;
import com.vibetranslator.infrastructure.grounding.InMemoryGroundingStore;
import com.vibetranslator.infrastructure.platform.PlatformAdvisor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class VibeAppService {

    private final PiiMasker piiMasker;
    private final ToneAnalysisService toneAnalysisService;
    private final VibeGenerationOrchestrator generationOrchestrator;
    private final RankingEngine rankingEngine;
    private final PlatformAdvisor platformAdvisor;
    private final InMemoryGroundingStore groundingStore;

    /**
     * Tone analysis plus the five vibe rewrites for a message.
     */
    public RewriteVibesResult rewriteVibes(String message, String platform, String userId) {
        requireMessage(message);
        String clean = piiMasker.mask(message);

        ToneAnalysis tone = toneAnalysisService.analyze(clean);
        GenerationResult generation = generationOrchestrator.generate(clean, platform, userId);
        PlatformTips tips = platformAdvisor.getTips(platform);

        log.info("Rewrite vibes - platform: {}, textLength: {}, servedBy: {}, attempts: {}",
                platform, clean.length(), generation.servedBy(), generation.attempts().size());

        return new RewriteVibesResult(message, tone, generation, tips);
    }

    /**
     * The five vibes ranked for a target tone, cut to the top {@code numCandidates}.
     */
    public RewriteTopResult rewriteTop(String message, String platform, String targetTone,
                                       Integer numCandidates, String userId) {
        requireMessage(message);
        if (targetTone == null || targetTone.isBlank()) {
            throw new IllegalArgumentException("targetTone is required");
        }
        int count = numCandidates == null ? RankingEngine.DEFAULT_COUNT : numCandidates;
        if (count < RankingEngine.MIN_COUNT || count > RankingEngine.MAX_COUNT) {
            throw new IllegalArgumentException(String.format(
                    "numCandidates must be between %d and %d", RankingEngine.MIN_COUNT, RankingEngine.MAX_COUNT));
        }

        String clean = piiMasker.mask(message);
        GenerationResult generation = generationOrchestrator.generate(clean, platform, userId);
        List<VibeCandidate> top = rankingEngine.rank(generation.candidates(), clean, targetTone, platform, count);

        log.info("Rewrite top - platform: {}, targetTone: {}, count: {}, servedBy: {}",
                platform, targetTone, count, generation.servedBy());

        return new RewriteTopResult(clean, targetTone, platformAdvisor.getTips(platform), top, generation.servedBy());
    }

    public int seedGuidelines() {
        return groundingStore.seedGuidelines();
    }

    public String acceptFeedback(String userId, String message, String acceptedText,
                                 String platform, String targetTone) {
        return groundingStore.upsertUserExample(
                userId, piiMasker.mask(message), platform, targetTone, piiMasker.mask(acceptedText));
    }

    private static void requireMessage(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
    }
}
