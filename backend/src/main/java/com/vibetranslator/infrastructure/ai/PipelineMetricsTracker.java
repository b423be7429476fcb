package com.vibetranslator.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters for degraded pipeline paths and token usage.
 */
@Slf4j
@Component
public class PipelineMetricsTracker {

    private final AtomicLong tierFallbacks = new AtomicLong();
    private final AtomicLong localFallbacks = new AtomicLong();
    private final AtomicLong parseFailures = new AtomicLong();
    private final AtomicLong contractViolations = new AtomicLong();
    private final AtomicLong providerFailures = new AtomicLong();
    private final AtomicLong groundingFailures = new AtomicLong();
    private final AtomicLong heuristicRankings = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();

    public void recordTierFallback(String fromTier, String reason) {
        long count = tierFallbacks.incrementAndGet();
        log.info("Tier fallback #{} - tier {} failed: {}", count, fromTier, reason);
    }

    public void recordLocalFallback() {
        long count = localFallbacks.incrementAndGet();
        log.warn("Local template fallback used (cumulative: {})", count);
    }

    public void recordParseFailure() {
        parseFailures.incrementAndGet();
    }

    public void recordContractViolation() {
        contractViolations.incrementAndGet();
    }

    public void recordProviderFailure() {
        providerFailures.incrementAndGet();
    }

    public void recordGroundingFailure() {
        groundingFailures.incrementAndGet();
    }

    public void recordHeuristicRanking() {
        long count = heuristicRankings.incrementAndGet();
        log.info("Heuristic ranking used (cumulative: {})", count);
    }

    public void recordTokenUsage(long promptTokens, long completionTokens) {
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);
    }

    public long getTierFallbacks() {
        return tierFallbacks.get();
    }

    public long getLocalFallbacks() {
        return localFallbacks.get();
    }

    public long getParseFailures() {
        return parseFailures.get();
    }

    public long getContractViolations() {
        return contractViolations.get();
    }

    public long getProviderFailures() {
        return providerFailures.get();
    }

    public long getGroundingFailures() {
        return groundingFailures.get();
    }

    public long getHeuristicRankings() {
        return heuristicRankings.get();
    }

    public long getTotalPromptTokens() {
        return totalPromptTokens.get();
    }

    public long getTotalCompletionTokens() {
        return totalCompletionTokens.get();
    }
}
