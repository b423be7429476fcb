package com.vibetranslator.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.vibetranslator.domain.vibe.exception.ProviderUnavailableException;
import com.vibetranslator.domain.vibe.service.GenerationService;
import lombok.extern.slf4j.Slf4j;

/**
 * Chat-completion call through the OpenAI SDK.
 * Also used for OpenAI-compatible endpoints (the secondary tier points the client at another base URL).
 * A null client means the tier has no API key and every call fails fast.
 */
@Slf4j
public class OpenAiGenerationService implements GenerationService {

    private final String name;
    private final OpenAIClient client;
    private final String model;
    private final int maxTokens;
    private final PipelineMetricsTracker metrics;

    public OpenAiGenerationService(String name, OpenAIClient client, String model,
                                   int maxTokens, PipelineMetricsTracker metrics) {
        this.name = name;
        this.client = client;
        this.model = model;
        this.maxTokens = maxTokens;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return name + ":" + model;
    }

    public boolean isConfigured() {
        return client != null;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, double temperature) {
        if (client == null) {
            throw new ProviderUnavailableException(name + " provider is not configured (missing API key)");
        }

        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(systemPrompt)
                    .addUserMessage(userPrompt)
                    .build();

            ChatCompletion completion = client.chat().completions().create(params);

            completion.usage().ifPresent(usage -> {
                log.info("Token usage [{}] - prompt: {}, completion: {}, total: {}",
                        name(), usage.promptTokens(), usage.completionTokens(), usage.totalTokens());
                metrics.recordTokenUsage(usage.promptTokens(), usage.completionTokens());
            });

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new ProviderUnavailableException(name() + " returned no content"));

            return content.trim();
        } catch (ProviderUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.warn("[{}] Chat completion failed: {}", name(), e.getMessage());
            throw new ProviderUnavailableException(name() + " call failed: " + e.getMessage(), e);
        }
    }
}
