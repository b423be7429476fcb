package com.vibetranslator.infrastructure.grounding;

import com.vibetranslator.domain.vibe.exception.GroundingFailureException;
import com.vibetranslator.domain.vibe.model.GroundingDocument;
import com.vibetranslator.domain.vibe.service.GroundingStore;
import com.vibetranslator.infrastructure.ai.PipelineMetricsTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Best-effort retrieval of style guidance. Never throws: any store failure means no grounding.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GroundingClient {

    private final GroundingStore groundingStore;
    private final PipelineMetricsTracker metrics;

    public static String buildQuery(String message, String platform) {
        String platformKey = platform == null || platform.isBlank() ? "generic" : platform;
        return platformKey + " guidance for: " + message;
    }

    public List<GroundingDocument> retrieve(String query, String platform, String userId, int topK) {
        if (topK <= 0) {
            return List.of();
        }
        try {
            List<GroundingDocument> docs = groundingStore.retrieve(query, platform, userId, topK);
            if (docs == null) {
                throw new GroundingFailureException("grounding store returned null");
            }
            return docs.stream()
                    .sorted(Comparator.comparingDouble(GroundingDocument::relevance).reversed())
                    .limit(topK)
                    .toList();
        } catch (RuntimeException e) {
            metrics.recordGroundingFailure();
            log.warn("[Grounding] Retrieval failed, continuing without grounding: {}", e.getMessage());
            return List.of();
        }
    }
}
