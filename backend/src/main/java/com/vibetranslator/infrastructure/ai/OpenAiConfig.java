package com.vibetranslator.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.vibetranslator.domain.vibe.service.GenerationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Builds the external generation tiers and the executor their calls run on.
 * Injected as a list, services come out primary first; the scoring chain reuses them.
 */
@Slf4j
@Configuration
public class OpenAiConfig {

    @Value("${openai.api-key:}")
    private String primaryApiKey;

    @Value("${openai.model}")
    private String primaryModel;

    @Value("${openai.max-tokens}")
    private int maxTokens;

    @Value("${secondary.api-key:}")
    private String secondaryApiKey;

    @Value("${secondary.base-url}")
    private String secondaryBaseUrl;

    @Value("${secondary.model}")
    private String secondaryModel;

    @Value("${vibe.ai.call-timeout-seconds}")
    private int callTimeoutSeconds;

    @Value("${vibe.ai.executor-threads}")
    private int executorThreads;

    @Bean
    @Order(1)
    public GenerationService primaryGenerationService(PipelineMetricsTracker metrics) {
        var service = new OpenAiGenerationService("primary", buildClient(primaryApiKey, null), primaryModel, maxTokens, metrics);
        if (!service.isConfigured()) {
            log.warn("openai.api-key is blank; primary tier will always fall through");
        }
        return service;
    }

    @Bean
    @Order(2)
    public GenerationService secondaryGenerationService(PipelineMetricsTracker metrics) {
        var service = new OpenAiGenerationService("secondary", buildClient(secondaryApiKey, secondaryBaseUrl), secondaryModel, maxTokens, metrics);
        if (!service.isConfigured()) {
            log.warn("secondary.api-key is blank; secondary tier will always fall through");
        }
        return service;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService aiCallExecutor() {
        return Executors.newFixedThreadPool(executorThreads);
    }

    @Bean
    public ProviderCallExecutor providerCallExecutor(ExecutorService aiCallExecutor) {
        return new ProviderCallExecutor(aiCallExecutor, Duration.ofSeconds(callTimeoutSeconds));
    }

    private OpenAIClient buildClient(String apiKey, String baseUrl) {
        if (apiKey == null || apiKey.isBlank()) {
            return null;
        }
        var builder = OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .maxRetries(0)
                .timeout(Duration.ofSeconds(callTimeoutSeconds));
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }
}
