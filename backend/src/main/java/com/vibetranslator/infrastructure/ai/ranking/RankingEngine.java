package com.vibetranslator.infrastructure.ai.ranking;

import com.vibetranslator.domain.vibe.exception.RankingContractViolationException;
import com.vibetranslator.domain.vibe.model.VibeCandidate;
import com.vibetranslator.infrastructure.ai.PipelineMetricsTracker;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Scores candidates through the scorer chain (LLM scorers, then the heuristic) and ranks them.
 * Scoring never fails: the heuristic scorer is always last.
 */
@Slf4j
public class RankingEngine {

    public static final int MIN_COUNT = 1;
    public static final int MAX_COUNT = 10;
    public static final int DEFAULT_COUNT = 3;

    private final List<CandidateScorer> scorers;
    private final HeuristicCandidateScorer heuristic;
    private final PipelineMetricsTracker metrics;

    public RankingEngine(List<CandidateScorer> scorers, PipelineMetricsTracker metrics) {
        List<CandidateScorer> chain = new ArrayList<>(scorers);
        chain.removeIf(HeuristicCandidateScorer.class::isInstance);
        this.heuristic = new HeuristicCandidateScorer();
        chain.add(heuristic);
        this.scorers = List.copyOf(chain);
        this.metrics = metrics;
    }

    public List<String> scorerNames() {
        return scorers.stream().map(CandidateScorer::name).toList();
    }

    /**
     * Returns every candidate with its score set, in the submitted order.
     */
    public List<VibeCandidate> score(List<VibeCandidate> candidates, String message,
                                     String targetTone, String platform) {
        if (candidates.isEmpty()) {
            return List.of();
        }

        for (CandidateScorer scorer : scorers) {
            try {
                List<Double> scores = scorer.score(candidates, message, targetTone, platform);
                if (scores == null || scores.size() != candidates.size()
                        || scores.stream().anyMatch(Objects::isNull)) {
                    throw new RankingContractViolationException("scorer " + scorer.name()
                            + " did not score every candidate");
                }
                if (scorer == heuristic) {
                    metrics.recordHeuristicRanking();
                }
                log.info("[Ranking] Scored {} candidates with {}", candidates.size(), scorer.name());
                return applyScores(candidates, scores);
            } catch (RuntimeException e) {
                log.warn("[Ranking] Scorer {} failed, falling back: {}", scorer.name(), e.getMessage());
            }
        }

        // The heuristic never throws; reaching here means it was handed bad input
        metrics.recordHeuristicRanking();
        return applyScores(candidates, heuristic.score(candidates, message, targetTone, platform));
    }

    /**
     * Scores, stable-sorts by score descending (ties keep submitted order) and keeps the top {@code count}.
     */
    public List<VibeCandidate> rank(List<VibeCandidate> candidates, String message,
                                    String targetTone, String platform, int count) {
        if (count < MIN_COUNT || count > MAX_COUNT) {
            throw new IllegalArgumentException("count must be between " + MIN_COUNT + " and " + MAX_COUNT);
        }
        List<VibeCandidate> scored = new ArrayList<>(score(candidates, message, targetTone, platform));
        scored.sort(Comparator.comparingDouble(VibeCandidate::score).reversed());
        return List.copyOf(scored.subList(0, Math.min(count, scored.size())));
    }

    private static List<VibeCandidate> applyScores(List<VibeCandidate> candidates, List<Double> scores) {
        List<VibeCandidate> result = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            result.add(candidates.get(i).withScore(scores.get(i)));
        }
        return result;
    }
}
