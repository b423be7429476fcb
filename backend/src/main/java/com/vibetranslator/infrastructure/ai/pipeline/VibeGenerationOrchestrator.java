package com.vibetranslator.infrastructure.ai.pipeline;

import com.vibetranslator.domain.vibe.model.GenerationPrompt;
import com.vibetranslator.domain.vibe.model.GroundingDocument;
import com.vibetranslator.domain.vibe.model.ValidationIssueType;
import com.vibetranslator.domain.vibe.model.ValidationOutcome;
import com.vibetranslator.domain.vibe.model.Vibe;
import com.vibetranslator.domain.vibe.model.VibeCandidate;
import com.vibetranslator.infrastructure.ai.PipelineMetricsTracker;
import com.vibetranslator.infrastructure.ai.TextTruncator;
import com.vibetranslator.infrastructure.ai.VibePromptAssembler;
import com.vibetranslator.infrastructure.ai.validation.PlatformValidator;
import com.vibetranslator.infrastructure.grounding.GroundingClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces the five vibe candidates for a message:
 * <p>
 * grounding → prompt → tier chain (primary → secondary → local templates) → platform normalization
 * </p>
 * Each tier is tried once; the first attempt whose output passes the contract wins.
 * The local template tier is always last, so generation never fails.
 */
@Slf4j
public class VibeGenerationOrchestrator {

    public static final int GROUNDING_TOP_K = 5;

    private static final List<String> CANONICAL_LABELS = Arrays.stream(Vibe.values())
            .map(Vibe::label)
            .toList();

    private final List<VibeGenerationTier> tiers;
    private final GroundingClient groundingClient;
    private final VibePromptAssembler promptAssembler;
    private final PlatformValidator platformValidator;
    private final PipelineMetricsTracker metrics;

    public VibeGenerationOrchestrator(List<VibeGenerationTier> tiers,
                                      GroundingClient groundingClient,
                                      VibePromptAssembler promptAssembler,
                                      PlatformValidator platformValidator,
                                      PipelineMetricsTracker metrics) {
        List<VibeGenerationTier> chain = new ArrayList<>(tiers);
        if (chain.isEmpty() || !(chain.get(chain.size() - 1) instanceof LocalTemplateGenerationTier)) {
            chain.add(new LocalTemplateGenerationTier());
        }
        this.tiers = List.copyOf(chain);
        this.groundingClient = groundingClient;
        this.promptAssembler = promptAssembler;
        this.platformValidator = platformValidator;
        this.metrics = metrics;
    }

    public List<String> tierNames() {
        return tiers.stream().map(VibeGenerationTier::name).toList();
    }

    public GenerationResult generate(String message, String platform) {
        return generate(message, platform, null);
    }

    /**
     * @param message  PII-masked message
     * @param platform target platform (nullable)
     * @param userId   user whose accepted examples may ground the prompt (nullable)
     */
    public GenerationResult generate(String message, String platform, String userId) {
        String text = TextTruncator.truncate(message, VibePromptAssembler.MAX_MESSAGE_CHARS);

        List<GroundingDocument> grounding = groundingClient.retrieve(
                GroundingClient.buildQuery(text, platform), platform, userId, GROUNDING_TOP_K);
        GenerationPrompt prompt = promptAssembler.assemble(text, grounding, GROUNDING_TOP_K);

        log.info("[Generation] textLength: {}, platform: {}, grounding docs: {}, tiers: {}",
                text.length(), platform, grounding.size(), tierNames());

        List<AttemptRecord> attempts = new ArrayList<>();
        for (int i = 0; i < tiers.size(); i++) {
            VibeGenerationTier tier = tiers.get(i);
            long start = System.currentTimeMillis();
            GenerationAttempt attempt = attemptSafely(tier, prompt, text);
            long duration = System.currentTimeMillis() - start;

            if (attempt.isAccepted() && !hasCanonicalOrder(attempt.candidates())) {
                metrics.recordContractViolation();
                attempt = GenerationAttempt.failed(AttemptOutcome.CONTRACT_VIOLATION,
                        "tier output is not in canonical vibe order");
            }

            attempts.add(new AttemptRecord(tier.name(), i, attempt.outcome(), duration, attempt.errorDetails()));

            if (attempt.isAccepted()) {
                if (tier instanceof LocalTemplateGenerationTier) {
                    metrics.recordLocalFallback();
                }
                log.info("[Generation] Accepted output from tier {} ({}ms)", tier.name(), duration);
                return normalize(attempt.candidates(), platform, tier.name(), attempts);
            }

            metrics.recordTierFallback(tier.name(), attempt.outcome() + ": " + attempt.errorDetails());
        }

        // Unreachable while the local tier is last; kept so a misbehaving tier list cannot break the guarantee
        GenerationAttempt local = new LocalTemplateGenerationTier().attemptGenerate(prompt, text);
        metrics.recordLocalFallback();
        return normalize(local.candidates(), platform, LocalTemplateGenerationTier.NAME, attempts);
    }

    private GenerationAttempt attemptSafely(VibeGenerationTier tier, GenerationPrompt prompt, String text) {
        try {
            GenerationAttempt attempt = tier.attemptGenerate(prompt, text);
            if (attempt == null) {
                return GenerationAttempt.failed(AttemptOutcome.PROVIDER_UNAVAILABLE, "tier returned no attempt");
            }
            return attempt;
        } catch (RuntimeException e) {
            log.warn("[Generation] Tier {} threw {}: {}", tier.name(), e.getClass().getSimpleName(), e.getMessage());
            return GenerationAttempt.failed(AttemptOutcome.PROVIDER_UNAVAILABLE, e.getMessage());
        }
    }

    private static boolean hasCanonicalOrder(List<VibeCandidate> candidates) {
        return candidates.stream().map(VibeCandidate::vibe).toList().equals(CANONICAL_LABELS);
    }

    private GenerationResult normalize(List<VibeCandidate> candidates, String platform,
                                       String servedBy, List<AttemptRecord> attempts) {
        if (platform == null || platform.isBlank()) {
            return new GenerationResult(candidates, servedBy, attempts, Map.of());
        }

        List<VibeCandidate> normalized = new ArrayList<>(candidates.size());
        Map<String, List<ValidationIssueType>> issues = new LinkedHashMap<>();
        for (VibeCandidate candidate : candidates) {
            ValidationOutcome outcome = platformValidator.validate(candidate.rewrittenText(), platform);
            normalized.add(candidate.withRewrittenText(outcome.text()));
            if (!outcome.issues().isEmpty()) {
                issues.put(candidate.vibe(), outcome.issues());
            }
        }

        if (!issues.isEmpty()) {
            log.info("[Generation] Platform normalization ({}): {}", platform, issues);
        }
        return new GenerationResult(normalized, servedBy, attempts, issues);
    }
}
