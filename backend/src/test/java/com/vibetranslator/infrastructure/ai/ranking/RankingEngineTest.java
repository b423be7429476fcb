package com.vibetranslator.infrastructure.ai.ranking;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibetranslator.domain.vibe.model.VibeCandidate;
import com.vibetranslator.infrastructure.ai.PipelineMetricsTracker;
import com.vibetranslator.infrastructure.ai.ProviderCallExecutor;
import com.vibetranslator.infrastructure.ai.StructuralParser;
import com.vibetranslator.testsupport.ScriptedGenerationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RankingEngineTest {

    private ExecutorService executor;
    private ProviderCallExecutor callExecutor;
    private StructuralParser parser;
    private PipelineMetricsTracker metrics;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        callExecutor = new ProviderCallExecutor(executor, Duration.ofSeconds(2));
        parser = new StructuralParser(new ObjectMapper());
        metrics = new PipelineMetricsTracker();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static VibeCandidate candidate(String vibe, int length) {
        return new VibeCandidate(vibe, "x".repeat(length), "", List.of());
    }

    private static List<VibeCandidate> byLength(int... lengths) {
        return java.util.Arrays.stream(lengths)
                .mapToObj(l -> candidate("v" + l, l))
                .toList();
    }

    private RankingEngine heuristicOnly() {
        return new RankingEngine(List.of(), metrics);
    }

    private LlmCandidateScorer llm(ScriptedGenerationService service) {
        return new LlmCandidateScorer(service, callExecutor, parser);
    }

    @Nested
    @DisplayName("Heuristic ranking")
    class Heuristic {

        @Test
        @DisplayName("Concise target: every candidate scored and ranked by the length and brevity rule")
        void conciseScenario() {
            List<VibeCandidate> candidates = byLength(500, 50, 1000, 150, 300);

            List<VibeCandidate> scored = heuristicOnly().score(candidates, "msg", "Concise", null);
            assertThat(scored).extracting(VibeCandidate::score).containsExactly(7.2, 7.5, 5.5, 9.0, 8.5);

            List<VibeCandidate> ranked = heuristicOnly().rank(candidates, "msg", "Concise", null, 5);
            assertThat(ranked).extracting(c -> c.rewrittenText().length())
                    .containsExactly(150, 300, 50, 500, 1000);
            assertThat(metrics.getHeuristicRankings()).isEqualTo(2);
        }

        @Test
        @DisplayName("Equal scores keep their submitted order")
        void stableOnTies() {
            List<VibeCandidate> candidates = List.of(
                    candidate("first", 120), candidate("second", 200), candidate("third", 300));

            List<VibeCandidate> ranked = heuristicOnly().rank(candidates, "msg", "Neutral", null, 3);

            assertThat(ranked).extracting(VibeCandidate::vibe).containsExactly("first", "second", "third");
        }

        @Test
        @DisplayName("Only the top count survive")
        void countTruncates() {
            List<VibeCandidate> ranked = heuristicOnly()
                    .rank(byLength(500, 50, 1000, 150, 300), "msg", "Concise", null, 2);

            assertThat(ranked).extracting(c -> c.rewrittenText().length()).containsExactly(150, 300);
        }

        @Test
        @DisplayName("A count larger than the candidate list returns them all")
        void countLargerThanList() {
            assertThat(heuristicOnly().rank(byLength(50, 150), "msg", "Concise", null, 10)).hasSize(2);
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1, 11})
        @DisplayName("Counts outside 1..10 are rejected")
        void countOutOfRange(int count) {
            assertThatThrownBy(() -> heuristicOnly().rank(byLength(50), "msg", "Concise", null, count))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Scoring an empty list returns an empty list")
        void emptyInput() {
            assertThat(heuristicOnly().score(List.of(), "msg", "Concise", null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Scorer chain")
    class Chain {

        @Test
        @DisplayName("LLM scores are used when the response covers every candidate")
        void llmScoresUsed() {
            var service = ScriptedGenerationService.returning("primary", """
                    [{"id": "c2", "score": 3}, {"id": "c1", "score": 8}]""");
            RankingEngine engine = new RankingEngine(List.of(llm(service)), metrics);

            List<VibeCandidate> ranked = engine.rank(byLength(50, 150), "msg", "Concise", null, 2);

            assertThat(ranked).extracting(VibeCandidate::vibe).containsExactly("v50", "v150");
            assertThat(ranked).extracting(VibeCandidate::score).containsExactly(8.0, 3.0);
            assertThat(metrics.getHeuristicRankings()).isZero();
        }

        @Test
        @DisplayName("A partial score list from the first scorer moves on to the second")
        void partialScoresFallThrough() {
            var primary = ScriptedGenerationService.returning("primary", """
                    [{"id": "c1", "score": 8}]""");
            var secondary = ScriptedGenerationService.returning("secondary", """
                    [{"id": "c1", "score": 2}, {"id": "c2", "score": 6}]""");
            RankingEngine engine = new RankingEngine(List.of(llm(primary), llm(secondary)), metrics);

            List<VibeCandidate> scored = engine.score(byLength(50, 150), "msg", "Concise", null);

            assertThat(scored).extracting(VibeCandidate::score).containsExactly(2.0, 6.0);
            assertThat(secondary.calls()).isEqualTo(1);
        }

        @Test
        @DisplayName("All LLM scorers failing ends with heuristic scores")
        void allFailHeuristic() {
            RankingEngine engine = new RankingEngine(List.of(
                    llm(ScriptedGenerationService.failing("primary")),
                    llm(ScriptedGenerationService.returning("secondary", "not json"))), metrics);

            List<VibeCandidate> scored = engine.score(byLength(500, 50), "msg", "Concise", null);

            assertThat(scored).extracting(VibeCandidate::score).containsExactly(7.2, 7.5);
            assertThat(metrics.getHeuristicRankings()).isEqualTo(1);
        }

        @Test
        @DisplayName("A scorer returning the wrong number of scores is skipped")
        void wrongSizeSkipped() {
            CandidateScorer shortScorer = new CandidateScorer() {
                @Override
                public String name() {
                    return "short";
                }

                @Override
                public List<Double> score(List<VibeCandidate> candidates, String message,
                                          String targetTone, String platform) {
                    return List.of(9.0);
                }
            };
            RankingEngine engine = new RankingEngine(List.of(shortScorer), metrics);

            List<VibeCandidate> scored = engine.score(byLength(500, 50), "msg", "Concise", null);

            assertThat(scored).extracting(VibeCandidate::score).containsExactly(7.2, 7.5);
        }

        @Test
        @DisplayName("The heuristic is always the final scorer")
        void heuristicAlwaysLast() {
            RankingEngine engine = new RankingEngine(List.of(
                    new HeuristicCandidateScorer(),
                    llm(ScriptedGenerationService.failing("primary"))), metrics);

            assertThat(engine.scorerNames()).containsExactly("llm:primary", HeuristicCandidateScorer.NAME);
        }
    }
}
