package com.vibetranslator.infrastructure.ai.pipeline;

import com.vibetranslator.domain.vibe.exception.ContractViolationException;
import com.vibetranslator.domain.vibe.exception.ProviderUnavailableException;
import com.vibetranslator.domain.vibe.model.GenerationPrompt;
import com.vibetranslator.domain.vibe.model.VibeCandidate;
import com.vibetranslator.domain.vibe.service.GenerationService;
import com.vibetranslator.infrastructure.ai.PipelineMetricsTracker;
import com.vibetranslator.infrastructure.ai.ProviderCallExecutor;
import com.vibetranslator.infrastructure.ai.StructuralParser;
import com.vibetranslator.infrastructure.ai.StructuralParser.ParsedResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Tier backed by an external generation service: call once, parse, check the contract.
 */
@Slf4j
public class ServiceGenerationTier implements VibeGenerationTier {

    private final GenerationService service;
    private final ProviderCallExecutor callExecutor;
    private final StructuralParser parser;
    private final CandidateContract contract;
    private final PipelineMetricsTracker metrics;
    private final double temperature;

    public ServiceGenerationTier(GenerationService service,
                                 ProviderCallExecutor callExecutor,
                                 StructuralParser parser,
                                 CandidateContract contract,
                                 PipelineMetricsTracker metrics,
                                 double temperature) {
        this.service = service;
        this.callExecutor = callExecutor;
        this.parser = parser;
        this.contract = contract;
        this.metrics = metrics;
        this.temperature = temperature;
    }

    @Override
    public String name() {
        return service.name();
    }

    @Override
    public GenerationAttempt attemptGenerate(GenerationPrompt prompt, String message) {
        String raw;
        try {
            raw = callExecutor.call(name(), () ->
                    service.complete(prompt.systemPrompt(), prompt.userPrompt(), temperature));
        } catch (ProviderUnavailableException e) {
            metrics.recordProviderFailure();
            return GenerationAttempt.failed(AttemptOutcome.PROVIDER_UNAVAILABLE, e.getMessage());
        }

        ParsedResponse parsed = parser.parse(raw);
        if (!parsed.isStructured()) {
            metrics.recordParseFailure();
            log.warn("[{}] Response is not JSON ({} chars)", name(), raw == null ? 0 : raw.length());
            return GenerationAttempt.failed(AttemptOutcome.MALFORMED_RESPONSE, "response is not valid JSON");
        }

        try {
            List<VibeCandidate> candidates = contract.validate(parsed.json());
            return GenerationAttempt.accepted(candidates);
        } catch (ContractViolationException e) {
            metrics.recordContractViolation();
            log.warn("[{}] Contract violation: {}", name(), e.getMessage());
            return GenerationAttempt.failed(AttemptOutcome.CONTRACT_VIOLATION, e.getMessage());
        }
    }
}
