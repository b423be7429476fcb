package com.vibetranslator.infrastructure.ai;

import com.vibetranslator.domain.vibe.service.GenerationService;
import com.vibetranslator.infrastructure.ai.pipeline.CandidateContract;
import com.vibetranslator.infrastructure.ai.pipeline.LocalTemplateGenerationTier;
import com.vibetranslator.infrastructure.ai.pipeline.ServiceGenerationTier;
import com.vibetranslator.infrastructure.ai.pipeline.VibeGenerationOrchestrator;
import com.vibetranslator.infrastructure.ai.pipeline.VibeGenerationTier;
import com.vibetranslator.infrastructure.ai.ranking.CandidateScorer;
import com.vibetranslator.infrastructure.ai.ranking.LlmCandidateScorer;
import com.vibetranslator.infrastructure.ai.ranking.RankingEngine;
import com.vibetranslator.infrastructure.ai.validation.PlatformValidator;
import com.vibetranslator.infrastructure.grounding.GroundingClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the generation tier chain and the scoring chain from the configured services.
 */
@Configuration
public class VibePipelineConfig {

    @Value("${openai.temperature}")
    private double temperature;

    @Bean
    public VibeGenerationOrchestrator vibeGenerationOrchestrator(List<GenerationService> generationServices,
                                                                 ProviderCallExecutor providerCallExecutor,
                                                                 StructuralParser structuralParser,
                                                                 CandidateContract candidateContract,
                                                                 LocalTemplateGenerationTier localTemplateTier,
                                                                 GroundingClient groundingClient,
                                                                 VibePromptAssembler promptAssembler,
                                                                 PlatformValidator platformValidator,
                                                                 PipelineMetricsTracker metrics) {
        List<VibeGenerationTier> tiers = new ArrayList<>();
        for (GenerationService service : generationServices) {
            tiers.add(new ServiceGenerationTier(service, providerCallExecutor, structuralParser,
                    candidateContract, metrics, temperature));
        }
        tiers.add(localTemplateTier);
        return new VibeGenerationOrchestrator(tiers, groundingClient, promptAssembler, platformValidator, metrics);
    }

    @Bean
    public RankingEngine rankingEngine(List<GenerationService> generationServices,
                                       ProviderCallExecutor providerCallExecutor,
                                       StructuralParser structuralParser,
                                       PipelineMetricsTracker metrics) {
        List<CandidateScorer> scorers = new ArrayList<>();
        for (GenerationService service : generationServices) {
            scorers.add(new LlmCandidateScorer(service, providerCallExecutor, structuralParser));
        }
        return new RankingEngine(scorers, metrics);
    }
}
