package com.vibetranslator.domain.vibe.service;

import com.vibetranslator.domain.vibe.model.GroundingDocument;

import java.util.List;

/**
 * Retrieval store holding platform/tone guidance and accepted user examples.
 */
public interface GroundingStore {

    /**
     * @param query    free-text query
     * @param platform platform filter (nullable)
     * @param userId   include this user's examples (nullable)
     * @param topK     maximum documents to return
     * @return documents ordered by relevance descending
     */
    List<GroundingDocument> retrieve(String query, String platform, String userId, int topK);
}
